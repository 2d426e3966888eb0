package raffle.jdbc;

import java.sql.SQLTransientConnectionException;

/**
 * Thrown by {@link ConnectionPool#acquire} when no connection (or the write gate) became
 * available within the acquisition timeout.
 */
public final class ResourceExhaustedException extends SQLTransientConnectionException {

  public ResourceExhaustedException(String message) {
    super(message);
  }

  public ResourceExhaustedException(String message, Throwable cause) {
    super(message, cause);
  }
}
