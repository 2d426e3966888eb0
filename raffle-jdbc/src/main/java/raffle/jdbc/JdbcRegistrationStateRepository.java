package raffle.jdbc;

import raffle.ErrorKind;
import raffle.StoreResult;
import raffle.model.RegistrationState;
import raffle.spi.RegistrationStateRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link RegistrationStateRepository} backed by the {@code registration_states} table.
 */
public final class JdbcRegistrationStateRepository implements RegistrationStateRepository {
  private static final Logger logger =
      Logger.getLogger(JdbcRegistrationStateRepository.class.getName());

  private final ConnectionPool pool;
  private final Clock clock;
  private final Duration maxAge;

  /**
   * @param maxAge saved states older than this are treated as abandoned
   */
  public JdbcRegistrationStateRepository(ConnectionPool pool, Clock clock, Duration maxAge) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.maxAge = Objects.requireNonNull(maxAge, "maxAge");
    if (maxAge.isNegative() || maxAge.isZero()) {
      throw new IllegalArgumentException("maxAge must be > 0, got: " + maxAge);
    }
  }

  @Override
  public StoreResult<RegistrationState> save(long externalId, String payload) {
    if (payload == null) {
      return StoreResult.failure(ErrorKind.VALIDATION, "payload must not be null");
    }
    Instant now = clock.instant();
    return pool.write(conn -> {
      JdbcTemplate.update(conn,
          "MERGE INTO registration_states (external_id, payload, updated_at) "
              + "KEY (external_id) VALUES (?, ?, ?)",
          externalId, payload, now);
      return new RegistrationState(externalId, payload, now);
    });
  }

  @Override
  public StoreResult<Optional<RegistrationState>> load(long externalId) {
    StoreResult<Optional<RegistrationState>> found = pool.read(conn -> JdbcTemplate.queryOne(conn,
        "SELECT external_id, payload, updated_at FROM registration_states WHERE external_id = ?",
        rs -> new RegistrationState(rs.getLong(1), rs.getString(2),
            JdbcTemplate.instant(rs, "updated_at")),
        externalId));
    if (!(found instanceof StoreResult.Ok<Optional<RegistrationState>> ok)
        || ok.value().isEmpty()) {
      return found;
    }
    Instant cutoff = clock.instant().minus(maxAge);
    if (!ok.value().get().updatedAt().isBefore(cutoff)) {
      return found;
    }
    StoreResult<Integer> deleted = pool.write(conn -> JdbcTemplate.update(conn,
        "DELETE FROM registration_states WHERE external_id = ? AND updated_at < ?",
        externalId, cutoff));
    if (deleted instanceof StoreResult.Failure<Integer> failure) {
      return StoreResult.failure(failure.cause());
    }
    logger.fine("Discarded stale registration state of user " + externalId);
    return StoreResult.ok(Optional.empty());
  }

  @Override
  public StoreResult<Boolean> clear(long externalId) {
    return pool.write(conn -> JdbcTemplate.update(conn,
        "DELETE FROM registration_states WHERE external_id = ?", externalId) > 0);
  }

  @Override
  public StoreResult<Integer> evictStale(Duration maxAge) {
    Objects.requireNonNull(maxAge, "maxAge");
    Instant cutoff = clock.instant().minus(maxAge);
    StoreResult<Integer> result = pool.write(conn -> JdbcTemplate.update(conn,
        "DELETE FROM registration_states WHERE updated_at < ?", cutoff));
    if (result instanceof StoreResult.Ok<Integer> ok && ok.value() > 0) {
      logger.info("Evicted " + ok.value() + " stale registration states");
    }
    return result;
  }
}
