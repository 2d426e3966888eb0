package raffle.jdbc;

import raffle.ErrorKind;
import raffle.StoreResult;
import raffle.model.BeginResult;
import raffle.model.LotteryRun;
import raffle.model.ParticipantSnapshot;
import raffle.model.RunAttempt;
import raffle.model.RunStatus;
import raffle.model.Winner;
import raffle.spi.CacheKeys;
import raffle.spi.InvalidationHook;
import raffle.spi.LotteryRunRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link LotteryRunRepository} backed by the {@code lottery_runs} and {@code winners} tables.
 *
 * <p>The run row doubles as the in-progress marker: its primary key guarantees at most one
 * row per run id, and {@link #begin} only re-arms a row that is {@code failed}. Each start also
 * appends a row to {@code lottery_run_attempts}, which is never rewritten except to record the
 * attempt's outcome.
 */
public final class JdbcLotteryRunRepository implements LotteryRunRepository {
  private static final int MAX_REASON_LENGTH = 1000;
  static final String INTERRUPTED_REASON = "interrupted before completion";

  private static final String COLUMNS = "run_id, seed, requested_count, status, snapshot_size, "
      + "snapshot_digest, created_at, executed_at";

  private static final JdbcTemplate.RowMapper<LotteryRun> RUN_MAPPER = rs -> new LotteryRun(
      rs.getString("run_id"),
      rs.getString("seed"),
      rs.getInt("requested_count"),
      RunStatus.fromCode(rs.getString("status")),
      rs.getInt("snapshot_size"),
      rs.getString("snapshot_digest"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "executed_at"));

  private static final JdbcTemplate.RowMapper<RunAttempt> ATTEMPT_MAPPER = rs -> new RunAttempt(
      rs.getString("run_id"),
      rs.getInt("attempt"),
      rs.getString("seed"),
      rs.getInt("requested_count"),
      rs.getInt("snapshot_size"),
      rs.getString("snapshot_digest"),
      RunStatus.fromCode(rs.getString("outcome")),
      rs.getString("failure_reason"),
      JdbcTemplate.instant(rs, "started_at"),
      JdbcTemplate.instant(rs, "finished_at"));

  private static final JdbcTemplate.RowMapper<Winner> WINNER_MAPPER = rs -> new Winner(
      rs.getString("run_id"),
      rs.getLong("participant_id"),
      rs.getInt("position"),
      rs.getString("prize_description"),
      rs.getBoolean("claimed"));

  private final ConnectionPool pool;
  private final InvalidationHook invalidation;
  private final Clock clock;

  public JdbcLotteryRunRepository(ConnectionPool pool, InvalidationHook invalidation,
      Clock clock) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.invalidation = Objects.requireNonNull(invalidation, "invalidation");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public StoreResult<BeginResult> begin(String runId, String seed, int requestedCount,
      ParticipantSnapshot snapshot) {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(seed, "seed");
    Objects.requireNonNull(snapshot, "snapshot");
    StoreResult<BeginResult> result = pool.transact(conn -> {
      Optional<RunStatus> existing = JdbcTemplate.queryOne(conn,
          "SELECT status FROM lottery_runs WHERE run_id = ? FOR UPDATE",
          rs -> RunStatus.fromCode(rs.getString(1)), runId);
      Instant now = clock.instant();
      if (existing.isEmpty()) {
        JdbcTemplate.update(conn,
            "INSERT INTO lottery_runs (run_id, seed, requested_count, status, snapshot_size, "
                + "snapshot_digest, created_at) VALUES (?, ?, ?, 'running', ?, ?, ?)",
            runId, seed, requestedCount, snapshot.size(), snapshot.digest(), now);
        appendAttempt(conn, runId, 1, seed, requestedCount, snapshot, now);
        return StoreResult.ok(BeginResult.STARTED);
      }
      switch (existing.get()) {
        case RUNNING:
          return StoreResult.ok(BeginResult.RUNNING);
        case COMPLETED:
          return StoreResult.ok(BeginResult.COMPLETED);
        default:
          int previous = JdbcTemplate.queryOne(conn,
              "SELECT COALESCE(MAX(attempt), 0) FROM lottery_run_attempts WHERE run_id = ?",
              rs -> rs.getInt(1), runId).orElse(0);
          JdbcTemplate.update(conn,
              "UPDATE lottery_runs SET seed = ?, requested_count = ?, status = 'running', "
                  + "snapshot_size = ?, snapshot_digest = ?, failure_reason = NULL, "
                  + "executed_at = NULL WHERE run_id = ?",
              seed, requestedCount, snapshot.size(), snapshot.digest(), runId);
          appendAttempt(conn, runId, previous + 1, seed, requestedCount, snapshot, now);
          return StoreResult.ok(BeginResult.STARTED);
      }
    });
    if (result instanceof StoreResult.Failure<BeginResult> failure
        && failure.kind() == ErrorKind.CONFLICT) {
      // lost the insert race to another writer
      return StoreResult.ok(BeginResult.RUNNING);
    }
    if (result.isOk()) {
      invalidation.invalidate(CacheKeys.RECENT_RUNS);
    }
    return result;
  }

  @Override
  public StoreResult<Integer> complete(String runId, List<Winner> winners) {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(winners, "winners");
    StoreResult<Integer> result = pool.transact(conn -> {
      Optional<RunStatus> status = JdbcTemplate.queryOne(conn,
          "SELECT status FROM lottery_runs WHERE run_id = ? FOR UPDATE",
          rs -> RunStatus.fromCode(rs.getString(1)), runId);
      if (status.isEmpty() || status.get() != RunStatus.RUNNING) {
        return StoreResult.failure(ErrorKind.VALIDATION, "run " + runId + " is not running");
      }
      try (PreparedStatement ps = conn.prepareStatement(
          "INSERT INTO winners (run_id, participant_id, position, prize_description, claimed) "
              + "VALUES (?, ?, ?, ?, FALSE)")) {
        for (Winner winner : winners) {
          JdbcTemplate.bindParams(ps, runId, winner.participantId(), winner.position(),
              winner.prizeDescription() == null ? "" : winner.prizeDescription());
          ps.executeUpdate();
        }
      }
      Instant now = clock.instant();
      JdbcTemplate.update(conn,
          "UPDATE lottery_runs SET status = 'completed', executed_at = ? WHERE run_id = ?",
          now, runId);
      closeAttempt(conn, runId, RunStatus.COMPLETED, null, now);
      return StoreResult.ok(winners.size());
    });
    if (result.isOk()) {
      invalidation.invalidate(CacheKeys.RECENT_RUNS);
    }
    return result;
  }

  @Override
  public StoreResult<Boolean> markFailed(String runId, String reason) {
    String truncated = truncate(reason);
    StoreResult<Boolean> result = pool.write(conn -> {
      boolean failed = JdbcTemplate.update(conn,
          "UPDATE lottery_runs SET status = 'failed', failure_reason = ? "
              + "WHERE run_id = ? AND status = 'running'",
          truncated, runId) == 1;
      if (failed) {
        closeAttempt(conn, runId, RunStatus.FAILED, truncated, clock.instant());
      }
      return failed;
    });
    if (result.isOk()) {
      invalidation.invalidate(CacheKeys.RECENT_RUNS);
    }
    return result;
  }

  @Override
  public StoreResult<Integer> failInterrupted() {
    StoreResult<Integer> result = pool.write(conn -> {
      int failed = JdbcTemplate.update(conn,
          "UPDATE lottery_runs SET status = 'failed', failure_reason = ? WHERE status = 'running'",
          INTERRUPTED_REASON);
      if (failed > 0) {
        JdbcTemplate.update(conn,
            "UPDATE lottery_run_attempts SET outcome = 'failed', failure_reason = ?, "
                + "finished_at = ? WHERE outcome = 'running'",
            INTERRUPTED_REASON, clock.instant());
      }
      return failed;
    });
    if (result instanceof StoreResult.Ok<Integer> ok && ok.value() > 0) {
      invalidation.invalidate(CacheKeys.RECENT_RUNS);
    }
    return result;
  }

  @Override
  public StoreResult<List<RunAttempt>> attempts(String runId) {
    return pool.read(conn -> JdbcTemplate.query(conn,
        "SELECT run_id, attempt, seed, requested_count, snapshot_size, snapshot_digest, outcome, "
            + "failure_reason, started_at, finished_at FROM lottery_run_attempts "
            + "WHERE run_id = ? ORDER BY attempt",
        ATTEMPT_MAPPER, runId));
  }

  @Override
  public StoreResult<Optional<LotteryRun>> find(String runId) {
    return pool.read(conn -> JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM lottery_runs WHERE run_id = ?", RUN_MAPPER, runId));
  }

  @Override
  public StoreResult<List<Winner>> winners(String runId) {
    return pool.read(conn -> JdbcTemplate.query(conn,
        "SELECT run_id, participant_id, position, prize_description, claimed "
            + "FROM winners WHERE run_id = ? ORDER BY position",
        WINNER_MAPPER, runId));
  }

  @Override
  public StoreResult<List<LotteryRun>> recent(int limit) {
    if (limit <= 0) {
      return StoreResult.failure(ErrorKind.VALIDATION, "limit must be > 0, got: " + limit);
    }
    return pool.read(conn -> JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM lottery_runs ORDER BY created_at DESC, run_id DESC LIMIT ?",
        RUN_MAPPER, limit));
  }

  @Override
  public StoreResult<Boolean> markClaimed(String runId, long participantId) {
    return pool.write(conn -> JdbcTemplate.update(conn,
        "UPDATE winners SET claimed = TRUE "
            + "WHERE run_id = ? AND participant_id = ? AND claimed = FALSE",
        runId, participantId) == 1);
  }

  private static void appendAttempt(Connection conn, String runId, int attempt, String seed,
      int requestedCount, ParticipantSnapshot snapshot, Instant startedAt) throws SQLException {
    JdbcTemplate.update(conn,
        "INSERT INTO lottery_run_attempts (run_id, attempt, seed, requested_count, snapshot_size, "
            + "snapshot_digest, outcome, started_at) VALUES (?, ?, ?, ?, ?, ?, 'running', ?)",
        runId, attempt, seed, requestedCount, snapshot.size(), snapshot.digest(), startedAt);
  }

  private static void closeAttempt(Connection conn, String runId, RunStatus outcome,
      String reason, Instant finishedAt) throws SQLException {
    JdbcTemplate.update(conn,
        "UPDATE lottery_run_attempts SET outcome = ?, failure_reason = ?, finished_at = ? "
            + "WHERE run_id = ? AND outcome = 'running'",
        outcome.code(), reason, finishedAt, runId);
  }

  private static String truncate(String reason) {
    if (reason == null) {
      return null;
    }
    return reason.length() <= MAX_REASON_LENGTH ? reason : reason.substring(0, MAX_REASON_LENGTH);
  }
}
