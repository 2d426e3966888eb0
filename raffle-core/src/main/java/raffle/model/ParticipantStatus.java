package raffle.model;

/**
 * Moderation status of a participant.
 *
 * <p>Allowed transitions: {@code PENDING -> APPROVED}, {@code PENDING -> REJECTED} and
 * {@code REJECTED -> PENDING} (resubmission). {@code APPROVED} is final.
 */
public enum ParticipantStatus {
  PENDING("pending"),
  APPROVED("approved"),
  REJECTED("rejected");

  private final String code;

  ParticipantStatus(String code) {
    this.code = code;
  }

  /** Lower-case value stored in the {@code status} column. */
  public String code() {
    return code;
  }

  public boolean canTransitionTo(ParticipantStatus target) {
    return switch (this) {
      case PENDING -> target == APPROVED || target == REJECTED;
      case REJECTED -> target == PENDING;
      case APPROVED -> false;
    };
  }

  public static ParticipantStatus fromCode(String code) {
    for (ParticipantStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown participant status: " + code);
  }
}
