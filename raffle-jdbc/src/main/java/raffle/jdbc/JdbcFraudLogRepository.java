package raffle.jdbc;

import raffle.ErrorKind;
import raffle.StoreResult;
import raffle.fraud.FraudScore;
import raffle.fraud.Verdict;
import raffle.model.FraudLogEntry;
import raffle.spi.FraudLogRepository;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * {@link FraudLogRepository} backed by the {@code fraud_log} table. Reasons are stored one per
 * line.
 */
public final class JdbcFraudLogRepository implements FraudLogRepository {
  private static final int MAX_REASONS_LENGTH = 4000;

  private static final JdbcTemplate.RowMapper<FraudLogEntry> ROW_MAPPER = rs -> new FraudLogEntry(
      rs.getLong("id"),
      rs.getLong("external_id"),
      rs.getDouble("score"),
      Verdict.valueOf(rs.getString("verdict")),
      splitReasons(rs.getString("reasons")),
      JdbcTemplate.instant(rs, "detected_at"));

  private final ConnectionPool pool;
  private final Clock clock;

  public JdbcFraudLogRepository(ConnectionPool pool, Clock clock) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public StoreResult<Long> record(long externalId, FraudScore score) {
    Objects.requireNonNull(score, "score");
    String reasons = String.join("\n", score.reasons());
    if (reasons.length() > MAX_REASONS_LENGTH) {
      reasons = reasons.substring(0, MAX_REASONS_LENGTH);
    }
    String stored = reasons;
    return pool.write(conn -> JdbcTemplate.insertReturningKey(conn,
        "INSERT INTO fraud_log (external_id, score, verdict, reasons, detected_at) "
            + "VALUES (?, ?, ?, ?, ?)",
        externalId, score.value(), score.verdict().name(), stored, clock.instant()));
  }

  @Override
  public StoreResult<List<FraudLogEntry>> recent(long externalId, int limit) {
    if (limit <= 0) {
      return StoreResult.failure(ErrorKind.VALIDATION, "limit must be > 0, got: " + limit);
    }
    return pool.read(conn -> JdbcTemplate.query(conn,
        "SELECT id, external_id, score, verdict, reasons, detected_at FROM fraud_log "
            + "WHERE external_id = ? ORDER BY id DESC LIMIT ?",
        ROW_MAPPER, externalId, limit));
  }

  private static List<String> splitReasons(String reasons) {
    if (reasons == null || reasons.isEmpty()) {
      return List.of();
    }
    return Arrays.asList(reasons.split("\n"));
  }
}
