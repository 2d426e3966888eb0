package raffle.draw;

import raffle.StoreError;
import raffle.model.Winner;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link DrawEngine#runDraw}. Draws never throw for expected outcomes.
 *
 * <ul>
 *   <li>{@link Completed}: winners committed (or nothing to do for {@code k = 0})</li>
 *   <li>{@link AlreadyRunning}: another execution holds the run id</li>
 *   <li>{@link AlreadyCompleted}: the run id already has committed winners</li>
 *   <li>{@link InsufficientParticipants}: no approved participants</li>
 *   <li>{@link Rejected}: bad input or a datastore failure</li>
 * </ul>
 */
public sealed interface DrawOutcome {

  String runId();

  /**
   * @param seed        the published seed; empty when no selection was made
   * @param winners     winners in selection order
   * @param underFilled whether fewer winners than requested were available
   */
  record Completed(String runId, String seed, List<Winner> winners, boolean underFilled)
      implements DrawOutcome {
    public Completed {
      Objects.requireNonNull(seed, "seed");
      winners = List.copyOf(winners);
    }

    public List<Long> winnerIds() {
      return winners.stream().map(Winner::participantId).toList();
    }
  }

  record AlreadyRunning(String runId) implements DrawOutcome {
  }

  record AlreadyCompleted(String runId) implements DrawOutcome {
  }

  record InsufficientParticipants(String runId) implements DrawOutcome {
  }

  record Rejected(String runId, StoreError error) implements DrawOutcome {
    public Rejected {
      Objects.requireNonNull(error, "error");
    }
  }
}
