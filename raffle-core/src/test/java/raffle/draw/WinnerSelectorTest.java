package raffle.draw;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class WinnerSelectorTest {

  private static List<Long> ids(int n) {
    return LongStream.rangeClosed(1, n).boxed().toList();
  }

  @Test
  void sameSeedAndSnapshotReproduceWinners() {
    List<Long> first = WinnerSelector.select(ids(100), "abc123", 10);
    List<Long> second = WinnerSelector.select(ids(100), "abc123", 10);

    assertEquals(10, first.size());
    assertEquals(first, second);
  }

  @Test
  void winnersAreDistinctMembersOfThePopulation() {
    List<Long> population = ids(100);
    List<Long> winners = WinnerSelector.select(population, "abc123", 10);

    assertEquals(10, new HashSet<>(winners).size());
    assertTrue(population.containsAll(winners));
  }

  @Test
  void differentSeedsGiveDifferentWinners() {
    assertNotEquals(
        WinnerSelector.select(ids(1000), "seed-a", 5),
        WinnerSelector.select(ids(1000), "seed-b", 5));
  }

  @Test
  void underfilledDrawReturnsWholePopulation() {
    List<Long> winners = WinnerSelector.select(ids(3), "abc123", 5);

    assertEquals(3, winners.size());
    assertEquals(new HashSet<>(ids(3)), new HashSet<>(winners));
  }

  @Test
  void zeroCountOrEmptyPopulationSelectsNobody() {
    assertTrue(WinnerSelector.select(ids(10), "abc123", 0).isEmpty());
    assertTrue(WinnerSelector.select(List.of(), "abc123", 3).isEmpty());
  }

  @Test
  void negativeCountIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> WinnerSelector.select(ids(10), "abc123", -1));
  }

  @Test
  void doesNotModifyPopulation() {
    List<Long> population = new java.util.ArrayList<>(ids(20));
    List<Long> copy = List.copyOf(population);

    WinnerSelector.select(population, "abc123", 20);

    assertEquals(copy, population);
  }

  @Test
  void prefixOfLargerDrawMatchesSmallerDraw() {
    List<Long> five = WinnerSelector.select(ids(50), "abc123", 5);
    List<Long> ten = WinnerSelector.select(ids(50), "abc123", 10);

    assertEquals(five, ten.subList(0, 5));
  }
}
