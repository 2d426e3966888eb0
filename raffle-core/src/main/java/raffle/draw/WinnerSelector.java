package raffle.draw;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Seeded selection of distinct winners from a snapshot.
 *
 * <p>A partial Fisher–Yates shuffle over a copy of the snapshot, driven by
 * {@link SeededStream}: the first {@code min(k, n)} positions after shuffling are the winners,
 * in selection order. Anyone holding the snapshot and the seed can reproduce the result.
 */
public final class WinnerSelector {

  /**
   * Selects up to {@code count} distinct ids from {@code population}.
   *
   * @param population eligible ids in snapshot order (not modified)
   * @param seed       the published seed
   * @param count      number of winners wanted, must be &ge; 0
   * @return the winners in selection order; the whole population when {@code count} exceeds it
   */
  public static List<Long> select(List<Long> population, String seed, int count) {
    Objects.requireNonNull(population, "population");
    Objects.requireNonNull(seed, "seed");
    if (count < 0) {
      throw new IllegalArgumentException("count must be >= 0, got: " + count);
    }
    int n = population.size();
    int picks = Math.min(count, n);
    if (picks == 0) {
      return List.of();
    }

    List<Long> pool = new ArrayList<>(population);
    SeededStream stream = new SeededStream(seed);
    for (int i = 0; i < picks; i++) {
      int j = i + stream.nextInt(n - i);
      Collections.swap(pool, i, j);
    }
    return List.copyOf(pool.subList(0, picks));
  }

  private WinnerSelector() {}
}
