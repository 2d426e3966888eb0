package raffle.fraud;

/**
 * Decision derived from a fraud score.
 */
public enum Verdict {
  PASS,
  FLAG,
  BLOCK;

  static Verdict forPoints(int points) {
    if (points >= FraudScorer.BLOCK_THRESHOLD) {
      return BLOCK;
    }
    if (points >= FraudScorer.FLAG_THRESHOLD) {
      return FLAG;
    }
    return PASS;
  }
}
