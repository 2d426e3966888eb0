package raffle.cache;

/**
 * Thrown to a caller that waited longer than the single-flight timeout for another caller's
 * load of the same key.
 */
public class SingleFlightTimeoutException extends RuntimeException {
  public SingleFlightTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
