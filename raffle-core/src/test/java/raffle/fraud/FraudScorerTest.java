package raffle.fraud;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FraudScorerTest {

  private final FraudScorer scorer = new FraudScorer();

  @Test
  void benignRegistrationPasses() {
    FraudScore score = scorer.score(FraudSignals.builder().fullName("Ivan Petrov").build());

    assertEquals(0.0, score.value());
    assertEquals(Verdict.PASS, score.verdict());
    assertTrue(score.reasons().isEmpty());
    assertFalse(score.isSuspicious());
  }

  @Test
  void duplicatePhoneIsFlagged() {
    FraudScore score = scorer.score(FraudSignals.builder()
        .fullName("Ivan Petrov").duplicatePhone(true).build());

    assertEquals(0.5, score.value(), 1e-9);
    assertEquals(Verdict.FLAG, score.verdict());
    assertEquals(java.util.List.of("duplicate phone"), score.reasons());
  }

  @Test
  void duplicatePhoneAndCardBlock() {
    FraudScore score = scorer.score(FraudSignals.builder()
        .fullName("Ivan Petrov").duplicatePhone(true).duplicateLoyaltyCard(true).build());

    assertEquals(1.0, score.value(), 1e-9);
    assertEquals(Verdict.BLOCK, score.verdict());
    assertEquals(2, score.reasons().size());
  }

  @Test
  void fastRegistrationWithSuspiciousSingleWordName() {
    FraudScore score = scorer.score(FraudSignals.builder()
        .registrationTime(Duration.ofSeconds(4))
        .fullName("Bot")
        .build());

    assertEquals(0.7, score.value(), 1e-9);
    assertEquals(Verdict.FLAG, score.verdict());
    assertEquals(java.util.List.of(
        "registration completed in 4s",
        "name has fewer than two words",
        "suspicious name pattern: bot"), score.reasons());
  }

  @Test
  void onlyFirstSuspiciousPatternCounts() {
    FraudScore score = scorer.score(FraudSignals.builder().fullName("Test Admin").build());

    assertEquals(0.3, score.value(), 1e-9);
    assertEquals(1, score.reasons().size());
  }

  @Test
  void emptyNameCountsAsTooFewWords() {
    FraudScore score = scorer.score(FraudSignals.builder().fullName("").build());

    assertEquals(0.1, score.value(), 1e-9);
    assertTrue(score.reasons().contains("name has fewer than two words"));
  }

  @Test
  void velocitySignals() {
    FraudScore score = scorer.score(FraudSignals.builder()
        .fullName("Ivan Petrov").recentAttempts(3).actionsLastHour(6).build());

    assertEquals(0.7, score.value(), 1e-9);
    assertTrue(score.reasons().contains("3 recent registration attempts"));
    assertTrue(score.reasons().contains("6 actions in the last hour"));
  }

  @Test
  void thresholdsAreExclusiveBelow() {
    FraudScore score = scorer.score(FraudSignals.builder()
        .fullName("Ivan Petrov").recentAttempts(2).actionsLastHour(5).build());

    assertEquals(Verdict.PASS, score.verdict());
  }

  @Test
  void scoreIsClampedToOne() {
    FraudScore score = scorer.score(FraudSignals.builder()
        .registrationTime(Duration.ofSeconds(1))
        .duplicatePhone(true)
        .duplicateLoyaltyCard(true)
        .recentAttempts(10)
        .actionsLastHour(50)
        .fullName("qwerty")
        .build());

    assertEquals(1.0, score.value());
    assertEquals(Verdict.BLOCK, score.verdict());
    assertEquals(7, score.reasons().size());
  }

  @Test
  void alreadyBlockedShortCircuits() {
    FraudScore score = scorer.score(FraudSignals.builder().alreadyBlocked(true).build());

    assertEquals(1.0, score.value());
    assertEquals(Verdict.BLOCK, score.verdict());
    assertEquals(java.util.List.of("user already blocked"), score.reasons());
  }

  @Test
  void scoreOutsideRangeIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new FraudScore(1.5, Verdict.BLOCK, java.util.List.of()));
  }

  @Test
  void weightsSummingToBlockThresholdBlock() {
    FraudScore score = scorer.score(FraudSignals.builder()
        .registrationTime(Duration.ofSeconds(3))
        .recentAttempts(3)
        .fullName("Ivan")
        .build());

    assertEquals(0.8, score.value());
    assertEquals(Verdict.BLOCK, score.verdict());
    assertEquals(3, score.reasons().size());
  }

  @Test
  void weightsSummingToFlagThresholdFlag() {
    FraudScore score = scorer.score(FraudSignals.builder()
        .recentAttempts(3)
        .fullName("Ivan")
        .build());

    assertEquals(0.5, score.value());
    assertEquals(Verdict.FLAG, score.verdict());
  }
}
