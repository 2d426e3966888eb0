package raffle.fraud;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores a registration attempt from its {@link FraudSignals}.
 *
 * <p>Pure and stateless: the same signals always produce the same score. Weights:
 * <ul>
 *   <li>already blocked: score is {@code 1.0}</li>
 *   <li>registration faster than 15 seconds: +0.3</li>
 *   <li>duplicate phone: +0.5; duplicate loyalty card: +0.5</li>
 *   <li>more than 2 recent attempts: +0.4</li>
 *   <li>name with fewer than two words: +0.1; suspicious name pattern: +0.3</li>
 *   <li>more than 5 actions in the last hour: +0.3</li>
 * </ul>
 * The sum is clamped to {@code [0, 1]}; {@code >= 0.8} blocks and {@code >= 0.5} flags.
 */
public final class FraudScorer {
  // Weights and thresholds in hundredths so sums compare exactly
  static final int BLOCK_THRESHOLD = 80;
  static final int FLAG_THRESHOLD = 50;
  static final int MAX_POINTS = 100;

  static final Duration MIN_REGISTRATION_TIME = Duration.ofSeconds(15);
  static final int MAX_RECENT_ATTEMPTS = 2;
  static final int MAX_ACTIONS_PER_HOUR = 5;
  static final List<String> SUSPICIOUS_NAME_PATTERNS =
      List.of("test", "qwerty", "asdf", "123", "admin", "bot");

  public FraudScore score(FraudSignals signals) {
    if (signals.alreadyBlocked()) {
      return new FraudScore(1.0, Verdict.BLOCK, List.of("user already blocked"));
    }

    int points = 0;
    List<String> reasons = new ArrayList<>();

    if (signals.registrationTime().compareTo(MIN_REGISTRATION_TIME) < 0) {
      points += 30;
      reasons.add("registration completed in " + signals.registrationTime().toSeconds() + "s");
    }
    if (signals.duplicatePhone()) {
      points += 50;
      reasons.add("duplicate phone");
    }
    if (signals.duplicateLoyaltyCard()) {
      points += 50;
      reasons.add("duplicate loyalty card");
    }
    if (signals.recentAttempts() > MAX_RECENT_ATTEMPTS) {
      points += 40;
      reasons.add(signals.recentAttempts() + " recent registration attempts");
    }

    String name = signals.fullName().strip();
    if (name.isEmpty() || name.split("\\s+").length < 2) {
      points += 10;
      reasons.add("name has fewer than two words");
    }
    String lower = name.toLowerCase(Locale.ROOT);
    for (String pattern : SUSPICIOUS_NAME_PATTERNS) {
      if (lower.contains(pattern)) {
        points += 30;
        reasons.add("suspicious name pattern: " + pattern);
        break;
      }
    }

    if (signals.actionsLastHour() > MAX_ACTIONS_PER_HOUR) {
      points += 30;
      reasons.add(signals.actionsLastHour() + " actions in the last hour");
    }

    int clamped = Math.max(0, Math.min(MAX_POINTS, points));
    return new FraudScore(clamped / (double) MAX_POINTS, Verdict.forPoints(clamped), reasons);
  }
}
