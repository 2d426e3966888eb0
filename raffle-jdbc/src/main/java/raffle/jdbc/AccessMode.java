package raffle.jdbc;

/**
 * Kind of connection scope requested from a {@link ConnectionPool}.
 */
public enum AccessMode {
  /** Runs alongside other readers and the writer. */
  READ,
  /** Passes the single-writer gate first. */
  WRITE
}
