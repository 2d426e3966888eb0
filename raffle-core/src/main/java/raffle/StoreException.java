package raffle;

/**
 * Unchecked exception raised by {@link StoreResult#orElseThrow()} on a failed result.
 */
public final class StoreException extends RuntimeException {
  private final StoreError error;

  public StoreException(StoreError error) {
    super(error.kind() + ": " + error.message(), error.cause());
    this.error = error;
  }

  public StoreError error() {
    return error;
  }

  public ErrorKind kind() {
    return error.kind();
  }
}
