package raffle.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A pooled connection lent for one scope.
 *
 * <p>Closing rolls back uncommitted work, restores auto-commit, returns the connection to the
 * pool and, for {@link AccessMode#WRITE} scopes, releases the write gate. Closing twice is a
 * no-op.
 */
public final class ScopedConnection implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ScopedConnection.class.getName());

  private final Connection connection;
  private final AccessMode mode;
  private final Runnable onRelease;
  private final AtomicBoolean closed = new AtomicBoolean();

  ScopedConnection(Connection connection, AccessMode mode, Runnable onRelease) {
    this.connection = connection;
    this.mode = mode;
    this.onRelease = onRelease;
  }

  public Connection connection() {
    if (closed.get()) {
      throw new IllegalStateException("Connection scope already closed");
    }
    return connection;
  }

  public AccessMode mode() {
    return mode;
  }

  @Override
  public void close() throws SQLException {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      if (!connection.getAutoCommit()) {
        try {
          connection.rollback();
        } catch (SQLException e) {
          logger.log(Level.WARNING, "Rollback on scope close failed", e);
        }
        connection.setAutoCommit(true);
      }
    } finally {
      try {
        connection.close();
      } finally {
        onRelease.run();
      }
    }
  }
}
