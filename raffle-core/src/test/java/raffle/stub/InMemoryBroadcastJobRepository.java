package raffle.stub;

import raffle.StoreResult;
import raffle.model.BroadcastJob;
import raffle.model.CancelResult;
import raffle.model.JobProgress;
import raffle.model.JobStatus;
import raffle.model.MediaAttachment;
import raffle.model.RecipientStatus;
import raffle.model.RecipientTask;
import raffle.spi.BroadcastJobRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * BroadcastJobRepository held in memory for unit tests that don't need real JDBC.
 */
public class InMemoryBroadcastJobRepository implements BroadcastJobRepository {

  static final class Row {
    final String recipient;
    RecipientStatus status = RecipientStatus.PENDING;
    int attempts;
    int deliveries;

    Row(String recipient) {
      this.recipient = recipient;
    }
  }

  static final class Job {
    final String jobId;
    final String payload;
    final MediaAttachment media;
    final Instant createdAt = Instant.now();
    final List<Row> rows = new ArrayList<>();
    JobStatus status = JobStatus.PENDING;
    boolean cancelRequested;

    Job(String jobId, String payload, MediaAttachment media) {
      this.jobId = jobId;
      this.payload = payload;
      this.media = media;
    }

    BroadcastJob toJob() {
      return new BroadcastJob(jobId, payload, media, status, rows.size(), createdAt);
    }
  }

  private final Map<String, Job> jobs = new LinkedHashMap<>();
  public final AtomicInteger releaseCount = new AtomicInteger();

  @Override
  public synchronized StoreResult<BroadcastJob> create(String jobId, String payload,
      MediaAttachment media, List<String> recipients) {
    Job job = new Job(jobId, payload, media);
    for (String r : recipients) {
      job.rows.add(new Row(r));
    }
    jobs.put(jobId, job);
    return StoreResult.ok(job.toJob());
  }

  @Override
  public synchronized StoreResult<Optional<BroadcastJob>> claimNextPending() {
    for (Job job : jobs.values()) {
      if (job.status == JobStatus.PENDING) {
        job.status = JobStatus.SENDING;
        return StoreResult.ok(Optional.of(job.toJob()));
      }
    }
    return StoreResult.ok(Optional.empty());
  }

  @Override
  public synchronized StoreResult<List<RecipientTask>> pendingRecipients(String jobId) {
    List<RecipientTask> tasks = new ArrayList<>();
    List<Row> rows = jobs.get(jobId).rows;
    for (int i = 0; i < rows.size(); i++) {
      Row row = rows.get(i);
      if (row.status == RecipientStatus.PENDING) {
        tasks.add(new RecipientTask(i, row.recipient, row.attempts));
      }
    }
    return StoreResult.ok(tasks);
  }

  @Override
  public synchronized StoreResult<Boolean> markDelivered(String jobId, int position) {
    Row row = jobs.get(jobId).rows.get(position);
    if (row.status != RecipientStatus.PENDING) {
      return StoreResult.ok(false);
    }
    row.status = RecipientStatus.DELIVERED;
    row.deliveries++;
    return StoreResult.ok(true);
  }

  @Override
  public synchronized StoreResult<RecipientStatus> recordFailure(String jobId, int position,
      String error, int maxAttempts) {
    Row row = jobs.get(jobId).rows.get(position);
    if (row.status == RecipientStatus.PENDING) {
      row.attempts++;
      if (row.attempts >= maxAttempts) {
        row.status = RecipientStatus.FAILED;
      }
    }
    return StoreResult.ok(row.status);
  }

  @Override
  public synchronized StoreResult<Boolean> isCancelRequested(String jobId) {
    Job job = jobs.get(jobId);
    return StoreResult.ok(job != null && job.cancelRequested);
  }

  @Override
  public synchronized StoreResult<CancelResult> requestCancel(String jobId) {
    Job job = jobs.get(jobId);
    if (job == null) {
      return StoreResult.ok(CancelResult.NOT_FOUND);
    }
    if (job.status.isTerminal()) {
      return StoreResult.ok(CancelResult.ALREADY_TERMINAL);
    }
    if (job.status == JobStatus.PENDING) {
      job.status = JobStatus.CANCELLED;
      return StoreResult.ok(CancelResult.CANCELLED);
    }
    job.cancelRequested = true;
    return StoreResult.ok(CancelResult.REQUESTED);
  }

  @Override
  public synchronized StoreResult<Boolean> finish(String jobId, JobStatus terminal) {
    Job job = jobs.get(jobId);
    if (job.status != JobStatus.SENDING) {
      return StoreResult.ok(false);
    }
    job.status = terminal;
    return StoreResult.ok(true);
  }

  @Override
  public synchronized StoreResult<Boolean> release(String jobId) {
    releaseCount.incrementAndGet();
    Job job = jobs.get(jobId);
    if (job == null || job.status != JobStatus.SENDING) {
      return StoreResult.ok(false);
    }
    job.status = JobStatus.PENDING;
    return StoreResult.ok(true);
  }

  @Override
  public synchronized StoreResult<Optional<JobProgress>> progress(String jobId) {
    Job job = jobs.get(jobId);
    if (job == null) {
      return StoreResult.ok(Optional.empty());
    }
    int delivered = 0;
    int failed = 0;
    int pending = 0;
    for (Row row : job.rows) {
      switch (row.status) {
        case DELIVERED -> delivered++;
        case FAILED -> failed++;
        case PENDING -> pending++;
      }
    }
    return StoreResult.ok(Optional.of(new JobProgress(jobId, job.status, job.rows.size(),
        delivered, failed, pending, job.cancelRequested)));
  }

  @Override
  public synchronized StoreResult<Integer> requeueInterrupted() {
    int count = 0;
    for (Job job : jobs.values()) {
      if (job.status == JobStatus.SENDING) {
        job.status = JobStatus.PENDING;
        count++;
      }
    }
    return StoreResult.ok(count);
  }

  /** Test helper: how many times the recipient at {@code position} was marked delivered. */
  public synchronized int deliveries(String jobId, int position) {
    return jobs.get(jobId).rows.get(position).deliveries;
  }

  /** Test helper: forces a job into {@code SENDING} as if a worker crashed mid-job. */
  public synchronized void markSending(String jobId) {
    jobs.get(jobId).status = JobStatus.SENDING;
  }
}
