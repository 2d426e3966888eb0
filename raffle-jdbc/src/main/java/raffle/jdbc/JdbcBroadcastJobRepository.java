package raffle.jdbc;

import raffle.ErrorKind;
import raffle.StoreResult;
import raffle.model.BroadcastJob;
import raffle.model.CancelResult;
import raffle.model.JobProgress;
import raffle.model.JobStatus;
import raffle.model.MediaAttachment;
import raffle.model.MediaType;
import raffle.model.RecipientStatus;
import raffle.model.RecipientTask;
import raffle.spi.BroadcastJobRepository;
import raffle.spi.CacheKeys;
import raffle.spi.InvalidationHook;

import java.sql.PreparedStatement;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link BroadcastJobRepository} backed by the {@code broadcast_jobs} and
 * {@code broadcast_recipients} tables.
 *
 * <p>Recipient rows move {@code pending -> delivered | failed} only through guarded updates
 * ({@code WHERE status = 'pending'}), so a recipient is marked delivered at most once.
 */
public final class JdbcBroadcastJobRepository implements BroadcastJobRepository {
  private static final int MAX_ERROR_LENGTH = 1000;

  private static final JdbcTemplate.RowMapper<BroadcastJob> JOB_MAPPER = rs -> new BroadcastJob(
      rs.getString("job_id"),
      rs.getString("payload"),
      rs.getString("media_ref") == null ? null : new MediaAttachment(rs.getString("media_ref"),
          MediaType.fromCode(rs.getString("media_type")), rs.getString("media_caption")),
      JobStatus.fromCode(rs.getString("status")),
      rs.getInt("total_recipients"),
      JdbcTemplate.instant(rs, "created_at"));

  private static final JdbcTemplate.RowMapper<RecipientTask> TASK_MAPPER =
      rs -> new RecipientTask(rs.getInt("position"), rs.getString("recipient"),
          rs.getInt("attempts"));

  private final ConnectionPool pool;
  private final InvalidationHook invalidation;
  private final Clock clock;

  public JdbcBroadcastJobRepository(ConnectionPool pool, InvalidationHook invalidation,
      Clock clock) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.invalidation = Objects.requireNonNull(invalidation, "invalidation");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public StoreResult<BroadcastJob> create(String jobId, String payload, MediaAttachment media,
      List<String> recipients) {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(recipients, "recipients");
    Instant now = clock.instant();
    StoreResult<BroadcastJob> result = pool.write(conn -> {
      JdbcTemplate.update(conn,
          "INSERT INTO broadcast_jobs (job_id, payload, media_ref, media_type, media_caption, "
              + "status, total_recipients, created_at) VALUES (?, ?, ?, ?, ?, 'pending', ?, ?)",
          jobId, payload,
          media == null ? null : media.reference(),
          media == null ? null : media.type().code(),
          media == null ? null : media.caption(),
          recipients.size(), now);
      try (PreparedStatement ps = conn.prepareStatement(
          "INSERT INTO broadcast_recipients (job_id, position, recipient) VALUES (?, ?, ?)")) {
        for (int i = 0; i < recipients.size(); i++) {
          JdbcTemplate.bindParams(ps, jobId, i, recipients.get(i));
          ps.executeUpdate();
        }
      }
      return new BroadcastJob(jobId, payload, media, JobStatus.PENDING, recipients.size(), now);
    });
    if (result.isOk()) {
      invalidation.invalidate(CacheKeys.broadcastProgress(jobId));
    }
    return result;
  }

  @Override
  public StoreResult<Optional<BroadcastJob>> claimNextPending() {
    StoreResult<Optional<BroadcastJob>> result = pool.write(conn -> {
      Optional<BroadcastJob> next = JdbcTemplate.queryOne(conn,
          "SELECT job_id, payload, media_ref, media_type, media_caption, status, total_recipients, "
              + "created_at FROM broadcast_jobs "
              + "WHERE status = 'pending' ORDER BY created_at, job_id LIMIT 1",
          JOB_MAPPER);
      if (next.isEmpty()) {
        return Optional.<BroadcastJob>empty();
      }
      BroadcastJob job = next.get();
      int claimed = JdbcTemplate.update(conn,
          "UPDATE broadcast_jobs SET status = 'sending', started_at = COALESCE(started_at, ?) "
              + "WHERE job_id = ? AND status = 'pending'",
          clock.instant(), job.jobId());
      if (claimed == 0) {
        return Optional.<BroadcastJob>empty();
      }
      return Optional.of(new BroadcastJob(job.jobId(), job.payload(), job.media(), JobStatus.SENDING,
          job.totalRecipients(), job.createdAt()));
    });
    if (result instanceof StoreResult.Ok<Optional<BroadcastJob>> ok && ok.value().isPresent()) {
      invalidation.invalidate(CacheKeys.broadcastProgress(ok.value().get().jobId()));
    }
    return result;
  }

  @Override
  public StoreResult<List<RecipientTask>> pendingRecipients(String jobId) {
    return pool.read(conn -> JdbcTemplate.query(conn,
        "SELECT position, recipient, attempts FROM broadcast_recipients "
            + "WHERE job_id = ? AND status = 'pending' ORDER BY position",
        TASK_MAPPER, jobId));
  }

  @Override
  public StoreResult<Boolean> markDelivered(String jobId, int position) {
    StoreResult<Boolean> result = pool.write(conn -> JdbcTemplate.update(conn,
        "UPDATE broadcast_recipients SET status = 'delivered', delivered_at = ? "
            + "WHERE job_id = ? AND position = ? AND status = 'pending'",
        clock.instant(), jobId, position) == 1);
    if (result.isOk()) {
      invalidation.invalidate(CacheKeys.broadcastProgress(jobId));
    }
    return result;
  }

  @Override
  public StoreResult<RecipientStatus> recordFailure(String jobId, int position, String error,
      int maxAttempts) {
    if (maxAttempts <= 0) {
      return StoreResult.failure(ErrorKind.VALIDATION,
          "maxAttempts must be > 0, got: " + maxAttempts);
    }
    StoreResult<RecipientStatus> result = pool.transact(conn -> {
      JdbcTemplate.update(conn,
          "UPDATE broadcast_recipients SET attempts = attempts + 1, last_error = ?, "
              + "status = CASE WHEN attempts + 1 >= ? THEN 'failed' ELSE 'pending' END "
              + "WHERE job_id = ? AND position = ? AND status = 'pending'",
          truncate(error), maxAttempts, jobId, position);
      Optional<RecipientStatus> status = JdbcTemplate.queryOne(conn,
          "SELECT status FROM broadcast_recipients WHERE job_id = ? AND position = ?",
          rs -> RecipientStatus.fromCode(rs.getString(1)), jobId, position);
      if (status.isEmpty()) {
        return StoreResult.failure(ErrorKind.VALIDATION,
            "unknown recipient " + position + " of job " + jobId);
      }
      return StoreResult.ok(status.get());
    });
    if (result.isOk()) {
      invalidation.invalidate(CacheKeys.broadcastProgress(jobId));
    }
    return result;
  }

  @Override
  public StoreResult<Boolean> isCancelRequested(String jobId) {
    return pool.read(conn -> JdbcTemplate.queryOne(conn,
        "SELECT cancel_requested FROM broadcast_jobs WHERE job_id = ?",
        rs -> rs.getBoolean(1), jobId).orElse(false));
  }

  @Override
  public StoreResult<CancelResult> requestCancel(String jobId) {
    StoreResult<CancelResult> result = pool.write(conn -> {
      Optional<JobStatus> status = JdbcTemplate.queryOne(conn,
          "SELECT status FROM broadcast_jobs WHERE job_id = ? FOR UPDATE",
          rs -> JobStatus.fromCode(rs.getString(1)), jobId);
      if (status.isEmpty()) {
        return CancelResult.NOT_FOUND;
      }
      if (status.get().isTerminal()) {
        return CancelResult.ALREADY_TERMINAL;
      }
      if (status.get() == JobStatus.PENDING) {
        JdbcTemplate.update(conn,
            "UPDATE broadcast_jobs SET status = 'cancelled', cancel_requested = TRUE, "
                + "finished_at = ? WHERE job_id = ?",
            clock.instant(), jobId);
        return CancelResult.CANCELLED;
      }
      JdbcTemplate.update(conn,
          "UPDATE broadcast_jobs SET cancel_requested = TRUE WHERE job_id = ?", jobId);
      return CancelResult.REQUESTED;
    });
    if (result.isOk()) {
      invalidation.invalidate(CacheKeys.broadcastProgress(jobId));
    }
    return result;
  }

  @Override
  public StoreResult<Boolean> finish(String jobId, JobStatus terminal) {
    if (terminal == null || !terminal.isTerminal()) {
      throw new IllegalArgumentException("terminal status required, got: " + terminal);
    }
    StoreResult<Boolean> result = pool.write(conn -> JdbcTemplate.update(conn,
        "UPDATE broadcast_jobs SET status = ?, finished_at = ? "
            + "WHERE job_id = ? AND status = 'sending'",
        terminal.code(), clock.instant(), jobId) == 1);
    if (result.isOk()) {
      invalidation.invalidate(CacheKeys.broadcastProgress(jobId));
    }
    return result;
  }

  @Override
  public StoreResult<Boolean> release(String jobId) {
    StoreResult<Boolean> result = pool.write(conn -> JdbcTemplate.update(conn,
        "UPDATE broadcast_jobs SET status = 'pending' WHERE job_id = ? AND status = 'sending'",
        jobId) == 1);
    if (result.isOk()) {
      invalidation.invalidate(CacheKeys.broadcastProgress(jobId));
    }
    return result;
  }

  @Override
  public StoreResult<Optional<JobProgress>> progress(String jobId) {
    return pool.read(conn -> {
      Optional<BroadcastJobRow> job = JdbcTemplate.queryOne(conn,
          "SELECT status, total_recipients, cancel_requested FROM broadcast_jobs WHERE job_id = ?",
          rs -> new BroadcastJobRow(JobStatus.fromCode(rs.getString(1)), rs.getInt(2),
              rs.getBoolean(3)),
          jobId);
      if (job.isEmpty()) {
        return Optional.<JobProgress>empty();
      }
      Map<RecipientStatus, Integer> counts = new EnumMap<>(RecipientStatus.class);
      for (Map.Entry<RecipientStatus, Integer> row : JdbcTemplate.query(conn,
          "SELECT status, COUNT(*) FROM broadcast_recipients WHERE job_id = ? GROUP BY status",
          rs -> Map.entry(RecipientStatus.fromCode(rs.getString(1)), rs.getInt(2)), jobId)) {
        counts.put(row.getKey(), row.getValue());
      }
      BroadcastJobRow row = job.get();
      return Optional.of(new JobProgress(jobId, row.status(), row.total(),
          counts.getOrDefault(RecipientStatus.DELIVERED, 0),
          counts.getOrDefault(RecipientStatus.FAILED, 0),
          counts.getOrDefault(RecipientStatus.PENDING, 0),
          row.cancelRequested()));
    });
  }

  @Override
  public StoreResult<Integer> requeueInterrupted() {
    StoreResult<List<String>> result = pool.write(conn -> {
      List<String> interrupted = JdbcTemplate.query(conn,
          "SELECT job_id FROM broadcast_jobs WHERE status = 'sending' FOR UPDATE",
          rs -> rs.getString(1));
      JdbcTemplate.update(conn,
          "UPDATE broadcast_jobs SET status = 'pending' WHERE status = 'sending'");
      return interrupted;
    });
    if (result instanceof StoreResult.Ok<List<String>> ok) {
      ok.value().forEach(jobId -> invalidation.invalidate(CacheKeys.broadcastProgress(jobId)));
    }
    return result.map(List::size);
  }

  private static String truncate(String error) {
    if (error == null) {
      return null;
    }
    return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
  }

  private record BroadcastJobRow(JobStatus status, int total, boolean cancelRequested) {}
}
