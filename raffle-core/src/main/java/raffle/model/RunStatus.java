package raffle.model;

/**
 * Lifecycle of a lottery run: {@code RUNNING -> COMPLETED} or {@code RUNNING -> FAILED}.
 * A failed run may be started again.
 */
public enum RunStatus {
  RUNNING("running"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String code;

  RunStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static RunStatus fromCode(String code) {
    for (RunStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown run status: " + code);
  }
}
