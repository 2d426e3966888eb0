package raffle.model;

/**
 * Broadcast job lifecycle: {@code PENDING -> SENDING -> DONE | DONE_WITH_ERRORS | CANCELLED}.
 * A pending job may also be cancelled directly.
 */
public enum JobStatus {
  PENDING("pending"),
  SENDING("sending"),
  DONE("done"),
  DONE_WITH_ERRORS("done_with_errors"),
  CANCELLED("cancelled");

  private final String code;

  JobStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public boolean isTerminal() {
    return this == DONE || this == DONE_WITH_ERRORS || this == CANCELLED;
  }

  public static JobStatus fromCode(String code) {
    for (JobStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status: " + code);
  }
}
