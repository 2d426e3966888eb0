package raffle.model;

/**
 * Delivery state of one recipient within a broadcast job.
 */
public enum RecipientStatus {
  PENDING("pending"),
  DELIVERED("delivered"),
  FAILED("failed");

  private final String code;

  RecipientStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static RecipientStatus fromCode(String code) {
    for (RecipientStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown recipient status: " + code);
  }
}
