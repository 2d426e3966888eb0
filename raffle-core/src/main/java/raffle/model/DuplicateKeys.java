package raffle.model;

/**
 * Counts of existing participants sharing a phone number or loyalty card.
 */
public record DuplicateKeys(int phoneMatches, int loyaltyCardMatches) {

  public boolean phoneTaken() {
    return phoneMatches > 0;
  }

  public boolean loyaltyCardTaken() {
    return loyaltyCardMatches > 0;
  }
}
