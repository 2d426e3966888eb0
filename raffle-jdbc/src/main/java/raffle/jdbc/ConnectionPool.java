package raffle.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import raffle.ErrorKind;
import raffle.StoreResult;
import raffle.broadcast.ExponentialBackoffRetryPolicy;
import raffle.broadcast.RetryPolicy;
import raffle.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded pool of connections to one embedded H2 database with a single-writer gate.
 *
 * <p>All connections are opened eagerly. Any number of {@link AccessMode#READ} scopes run
 * concurrently; {@link AccessMode#WRITE} scopes additionally pass a fair semaphore, so at most
 * one write transaction is open at a time and writers are admitted in arrival order. Each wait
 * (for the gate and for a connection) is bounded by {@link PoolSettings#acquireTimeout()}.
 *
 * <p>{@link #read}, {@link #write} and {@link #transact} retry work that fails with a busy or
 * otherwise transient error up to {@link PoolSettings#busyRetryAttempts()} times with
 * exponential backoff. An error classified {@link ErrorKind#FATAL} halts the pool: the
 * triggering call and every later write throw {@link DatastoreFatalException}.
 */
public final class ConnectionPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectionPool.class.getName());

  private final PoolSettings settings;
  private final HikariDataSource dataSource;
  private final Semaphore writeGate = new Semaphore(1, true);
  private final RetryPolicy busyBackoff;
  private final MetricsExporter metrics;
  private final AtomicReference<Throwable> fatal = new AtomicReference<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  private ConnectionPool(PoolSettings settings, HikariDataSource dataSource,
      MetricsExporter metrics) {
    this.settings = settings;
    this.dataSource = dataSource;
    this.metrics = metrics;
    this.busyBackoff = new ExponentialBackoffRetryPolicy(
        settings.busyRetryBaseDelay().toMillis(), settings.busyRetryMaxDelay().toMillis());
  }

  public static ConnectionPool open(PoolSettings settings) {
    return open(settings, MetricsExporter.NOOP);
  }

  /**
   * Opens every connection of the pool.
   *
   * @throws DatastoreFatalException if the database cannot be opened
   */
  public static ConnectionPool open(PoolSettings settings, MetricsExporter metrics) {
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(metrics, "metrics");
    HikariConfig config = new HikariConfig();
    config.setPoolName(settings.poolName());
    config.setJdbcUrl(settings.jdbcUrl());
    config.setUsername(settings.username());
    config.setPassword(settings.password());
    config.setMaximumPoolSize(settings.poolSize());
    config.setMinimumIdle(settings.poolSize());
    config.setConnectionTimeout(settings.acquireTimeout().toMillis());
    config.setConnectionInitSql("SET LOCK_TIMEOUT " + settings.busyTimeout().toMillis());
    config.setAutoCommit(true);
    HikariDataSource dataSource;
    try {
      dataSource = new HikariDataSource(config);
    } catch (RuntimeException e) {
      throw new DatastoreFatalException("Failed to open database " + settings.jdbcUrl(), e);
    }
    logger.info("Opened connection pool " + settings);
    return new ConnectionPool(settings, dataSource, metrics);
  }

  /**
   * Borrows a connection for one scope. The caller must close the returned scope.
   *
   * @throws ResourceExhaustedException if the write gate or a connection did not become
   *     available within the acquisition timeout
   * @throws DatastoreFatalException if {@code mode} is {@link AccessMode#WRITE} and the pool
   *     has been halted
   */
  public ScopedConnection acquire(AccessMode mode) throws SQLException {
    Objects.requireNonNull(mode, "mode");
    if (closed.get()) {
      throw new IllegalStateException("Connection pool is closed");
    }
    long timeoutMs = settings.acquireTimeout().toMillis();
    if (mode == AccessMode.READ) {
      return new ScopedConnection(borrow(), mode, () -> {});
    }
    checkNotHalted();
    boolean gated;
    try {
      gated = writeGate.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ResourceExhaustedException("Interrupted while waiting for the write gate", e);
    }
    if (!gated) {
      throw new ResourceExhaustedException(
          "Write gate not available within " + timeoutMs + "ms");
    }
    Connection conn;
    try {
      checkNotHalted();
      conn = borrow();
    } catch (SQLException | RuntimeException e) {
      writeGate.release();
      throw e;
    }
    return new ScopedConnection(conn, mode, writeGate::release);
  }

  /** Runs {@code work} on a read scope. */
  public <T> StoreResult<T> read(SqlWork<T> work) {
    return execute(AccessMode.READ, conn -> StoreResult.ok(work.run(conn)));
  }

  /** Runs {@code work} as one committed write transaction. */
  public <T> StoreResult<T> write(SqlWork<T> work) {
    return execute(AccessMode.WRITE, conn -> StoreResult.ok(work.run(conn)));
  }

  /**
   * Runs {@code work} as one write transaction that commits only when it returns an
   * {@link StoreResult.Ok}; a returned {@link StoreResult.Failure} rolls back.
   */
  public <T> StoreResult<T> transact(SqlWork<StoreResult<T>> work) {
    return execute(AccessMode.WRITE, work);
  }

  public boolean isHalted() {
    return fatal.get() != null;
  }

  public PoolSettings settings() {
    return settings;
  }

  public int activeConnections() {
    HikariPoolMXBean bean = dataSource.getHikariPoolMXBean();
    return bean == null ? 0 : bean.getActiveConnections();
  }

  public int totalConnections() {
    HikariPoolMXBean bean = dataSource.getHikariPoolMXBean();
    return bean == null ? 0 : bean.getTotalConnections();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    dataSource.close();
    logger.info("Closed connection pool " + settings.poolName());
  }

  /**
   * Halts the pool: later writes throw {@link DatastoreFatalException}.
   *
   * @return the exception for the caller to throw
   */
  DatastoreFatalException halt(String reason, Throwable cause) {
    DatastoreFatalException ex = new DatastoreFatalException(reason, cause);
    if (fatal.compareAndSet(null, ex)) {
      logger.log(Level.SEVERE, "Datastore halted: " + reason, cause);
    }
    return ex;
  }

  private <T> StoreResult<T> execute(AccessMode mode, SqlWork<StoreResult<T>> work) {
    Objects.requireNonNull(work, "work");
    int retries = 0;
    while (true) {
      StoreResult<T> result = attempt(mode, work);
      if (!(result instanceof StoreResult.Failure<T> failure)
          || failure.kind() != ErrorKind.TRANSIENT) {
        return result;
      }
      if (retries >= settings.busyRetryAttempts()) {
        logger.warning("Giving up after " + (retries + 1) + " attempts: "
            + failure.cause().message());
        return StoreResult.failure(ErrorKind.TRANSIENT, "database busy", failure.cause().cause());
      }
      retries++;
      metrics.incrementBusyRetry();
      try {
        Thread.sleep(busyBackoff.computeDelayMs(retries));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return StoreResult.failure(ErrorKind.TRANSIENT, "interrupted during busy retry", e);
      }
    }
  }

  private <T> StoreResult<T> attempt(AccessMode mode, SqlWork<StoreResult<T>> work) {
    try (ScopedConnection scope = acquire(mode)) {
      Connection conn = scope.connection();
      if (mode == AccessMode.READ) {
        return Objects.requireNonNull(work.run(conn), "work result");
      }
      conn.setAutoCommit(false);
      StoreResult<T> result = Objects.requireNonNull(work.run(conn), "work result");
      if (result.isOk()) {
        conn.commit();
      } else {
        conn.rollback();
      }
      return result;
    } catch (ResourceExhaustedException e) {
      return StoreResult.failure(ErrorKind.RESOURCE_EXHAUSTED, e.getMessage(), e);
    } catch (SQLException e) {
      ErrorKind kind = SqlErrors.classify(e);
      if (kind == ErrorKind.FATAL) {
        throw halt(SqlErrors.describe(e), e);
      }
      return StoreResult.failure(kind, SqlErrors.describe(e), e);
    }
  }

  private Connection borrow() throws SQLException {
    try {
      return dataSource.getConnection();
    } catch (SQLTransientConnectionException e) {
      throw new ResourceExhaustedException(
          "No connection available within " + settings.acquireTimeout().toMillis() + "ms", e);
    }
  }

  private void checkNotHalted() {
    Throwable cause = fatal.get();
    if (cause != null) {
      throw new DatastoreFatalException("Datastore halted after a fatal error: "
          + cause.getMessage(), cause);
    }
  }
}
