package raffle.jdbc;

import raffle.StoreResult;
import raffle.event.EventDispatcher;
import raffle.spi.InvalidationHook;
import raffle.spi.MetricsExporter;
import raffle.spi.Repositories;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * An opened, migrated database together with the repositories over it.
 *
 * <pre>{@code
 * try (RaffleDatabase db = RaffleDatabase.builder()
 *     .settings(PoolSettings.builder().databaseFile(Path.of("data/raffle")).build())
 *     .invalidation(cache)
 *     .open()) {
 *   db.repositories().participants().insert(record);
 * }
 * }</pre>
 */
public final class RaffleDatabase implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RaffleDatabase.class.getName());

  private final ConnectionPool pool;
  private final Repositories repositories;
  private final int schemaVersion;

  private RaffleDatabase(ConnectionPool pool, Repositories repositories, int schemaVersion) {
    this.pool = pool;
    this.repositories = repositories;
    this.schemaVersion = schemaVersion;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ConnectionPool pool() {
    return pool;
  }

  public Repositories repositories() {
    return repositories;
  }

  public int schemaVersion() {
    return schemaVersion;
  }

  @Override
  public void close() {
    pool.close();
  }

  /** Builder for {@link RaffleDatabase}. */
  public static final class Builder {
    private PoolSettings settings;
    private InvalidationHook invalidation = InvalidationHook.NONE;
    private EventDispatcher events = EventDispatcher.NONE;
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private Clock clock = Clock.systemUTC();
    private Duration registrationStateMaxAge = Duration.ofHours(24);

    private Builder() {}

    /** Required. */
    public Builder settings(PoolSettings settings) {
      this.settings = settings;
      return this;
    }

    /** Receives post-commit invalidations, normally the {@code CacheTier}. */
    public Builder invalidation(InvalidationHook invalidation) {
      this.invalidation = Objects.requireNonNull(invalidation, "invalidation");
      return this;
    }

    public Builder events(EventDispatcher events) {
      this.events = Objects.requireNonNull(events, "events");
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Builder registrationStateMaxAge(Duration maxAge) {
      this.registrationStateMaxAge = Objects.requireNonNull(maxAge, "maxAge");
      return this;
    }

    /**
     * Opens the pool, applies pending migrations and fails lottery runs left running by a
     * previous process so their run ids can be drawn again. The pool is closed again if
     * migration fails.
     */
    public RaffleDatabase open() {
      Objects.requireNonNull(settings, "settings");
      ConnectionPool pool = ConnectionPool.open(settings, metrics);
      try {
        SchemaMigrator migrator = new SchemaMigrator(pool, clock);
        int applied = migrator.migrate();
        int version = migrator.currentVersion();
        logger.info("Database at schema version " + version + " (" + applied + " applied)");
        Repositories repositories = JdbcRepositories.create(
            pool, invalidation, events, clock, registrationStateMaxAge);
        StoreResult<Integer> interrupted = repositories.lotteryRuns().failInterrupted();
        if (interrupted instanceof StoreResult.Failure<Integer> f) {
          logger.warning("Could not fail interrupted lottery runs: " + f.cause().message());
        } else if (interrupted.orElseThrow() > 0) {
          logger.info("Marked " + interrupted.orElseThrow() + " interrupted lottery run(s) failed");
        }
        return new RaffleDatabase(pool, repositories, version);
      } catch (RuntimeException e) {
        pool.close();
        throw e;
      }
    }
  }
}
