package raffle.jdbc;

/**
 * Unchecked exception for datastore states that must stop all further writes: a corrupted or
 * unsupported database file, or a schema that does not match the code.
 */
public final class DatastoreFatalException extends RuntimeException {
  public DatastoreFatalException(String message, Throwable cause) {
    super(message, cause);
  }
}
