package raffle.fraud;

import java.util.List;

/**
 * Score in {@code [0, 1]}, its verdict, and the heuristics that contributed.
 */
public record FraudScore(double value, Verdict verdict, List<String> reasons) {

  public FraudScore {
    if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
      throw new IllegalArgumentException("score must be within [0, 1], got: " + value);
    }
    reasons = List.copyOf(reasons);
  }

  public boolean isSuspicious() {
    return verdict != Verdict.PASS;
  }
}
