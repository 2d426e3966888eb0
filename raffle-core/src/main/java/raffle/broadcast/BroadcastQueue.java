package raffle.broadcast;

import com.github.f4b6a3.ulid.UlidCreator;
import raffle.ErrorKind;
import raffle.StoreError;
import raffle.StoreResult;
import raffle.event.EventDispatcher;
import raffle.event.RaffleEvent;
import raffle.model.BroadcastJob;
import raffle.model.CancelResult;
import raffle.model.JobProgress;
import raffle.model.JobStatus;
import raffle.model.MediaAttachment;
import raffle.model.RecipientStatus;
import raffle.model.RecipientTask;
import raffle.spi.BroadcastJobRepository;
import raffle.spi.DeliveryChannel;
import raffle.spi.DeliveryOutcome;
import raffle.spi.MetricsExporter;
import raffle.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable, rate-limited broadcast dispatcher.
 *
 * <p>{@link #enqueue} persists a job with its ordered recipient list. A scheduled poller claims
 * pending jobs and hands them to a fixed pool of worker threads. Each worker sends its job's
 * pending recipients in batches of {@code batchSize}:
 * <ul>
 *   <li>every send first takes a permit from the shared {@link RateLimiter}</li>
 *   <li>failures are counted per recipient; survivors are retried in later rounds after a
 *       {@link RetryPolicy} backoff until {@code maxAttempts} is reached</li>
 *   <li>a {@link DeliveryOutcome.Throttled} outcome pauses the shared limiter and retries the
 *       same recipient without counting the attempt</li>
 *   <li>a cancellation request is observed between batches</li>
 * </ul>
 * A recipient is marked delivered at most once. Jobs interrupted by a crash or shutdown are
 * requeued by {@link #start()} and resume with their undelivered recipients.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe; {@link #start()} and
 * {@link #close()} are synchronized.
 */
public final class BroadcastQueue implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BroadcastQueue.class.getName());

  private final BroadcastJobRepository jobs;
  private final DeliveryChannel channel;
  private final RateLimiter rateLimiter;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final int batchSize;
  private final Duration throttleCooldown;
  private final int workerCount;
  private final long pollIntervalMs;
  private final long drainTimeoutMs;
  private final EventDispatcher events;
  private final MetricsExporter metrics;
  private final Clock clock;

  private final ExecutorService workers;
  private final AtomicInteger activeJobs = new AtomicInteger();
  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  private BroadcastQueue(Builder builder) {
    this.jobs = Objects.requireNonNull(builder.jobs, "jobs");
    this.channel = Objects.requireNonNull(builder.channel, "channel");
    this.rateLimiter = builder.rateLimiter != null
        ? builder.rateLimiter : new TokenBucketRateLimiter(30, 1);
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1000, 8000);
    this.events = builder.events != null ? builder.events : EventDispatcher.NONE;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.throttleCooldown = builder.throttleCooldown != null ? builder.throttleCooldown : Duration.ofSeconds(1);

    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    if (builder.workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1");
    }
    if (builder.pollIntervalMs <= 0) {
      throw new IllegalArgumentException("pollIntervalMs must be > 0");
    }
    if (throttleCooldown.isNegative()) {
      throw new IllegalArgumentException("throttleCooldown must be >= 0");
    }
    this.maxAttempts = builder.maxAttempts;
    this.batchSize = builder.batchSize;
    this.workerCount = builder.workerCount;
    this.pollIntervalMs = builder.pollIntervalMs;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("raffle-broadcast-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Persists a text-only broadcast job.
   *
   * @param message    the message body
   * @param recipients recipient addresses in send order
   * @return the new job id (a ULID), or a {@link ErrorKind#VALIDATION} failure for a blank
   *     message, an empty recipient list or a blank recipient
   */
  public StoreResult<String> enqueue(String message, List<String> recipients) {
    return enqueue(message, null, recipients);
  }

  /**
   * Persists a broadcast job that sends {@code media} to every recipient. The message may be
   * blank when the attachment carries its own caption.
   *
   * @param media the attachment, or {@code null} for a text-only job
   */
  public StoreResult<String> enqueue(String message, MediaAttachment media, List<String> recipients) {
    String text = message == null ? "" : message;
    if (media == null && text.isBlank()) {
      return StoreResult.failure(ErrorKind.VALIDATION, "message must not be blank");
    }
    if (media != null && media.captionOr(text).isBlank()) {
      return StoreResult.failure(ErrorKind.VALIDATION, "media needs a caption or a message");
    }
    if (recipients == null || recipients.isEmpty()) {
      return StoreResult.failure(ErrorKind.VALIDATION, "recipients must not be empty");
    }
    for (int i = 0; i < recipients.size(); i++) {
      String recipient = recipients.get(i);
      if (recipient == null || recipient.isBlank()) {
        return StoreResult.failure(ErrorKind.VALIDATION, "recipient[" + i + "] is blank");
      }
    }
    String jobId = UlidCreator.getMonotonicUlid().toString();
    StoreResult<String> created =
        jobs.create(jobId, text, media, List.copyOf(recipients)).map(BroadcastJob::jobId);
    if (created.isOk()) {
      logger.fine("Broadcast " + jobId + " enqueued for " + recipients.size() + " recipients"
          + (media != null ? " with " + media.type().code() : ""));
      wakeUp();
    }
    return created;
  }

  public StoreResult<Optional<JobProgress>> getStatus(String jobId) {
    return jobs.progress(jobId);
  }

  /**
   * Cancels a job. A pending job is cancelled at once; a sending job stops at its next batch
   * boundary.
   *
   * @return {@code false} when the job is unknown or already finished
   */
  public StoreResult<Boolean> cancel(String jobId) {
    return jobs.requestCancel(jobId).map(result -> {
      if (result == CancelResult.REQUESTED) {
        logger.info("Cancellation requested for broadcast " + jobId);
      }
      return result == CancelResult.CANCELLED || result == CancelResult.REQUESTED;
    });
  }

  /**
   * Requeues jobs interrupted by a previous shutdown and starts the polling schedule.
   * Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("BroadcastQueue has been closed");
    }
    if (pollTask != null) {
      return;
    }
    StoreResult<Integer> requeued = jobs.requeueInterrupted();
    if (requeued instanceof StoreResult.Failure<Integer> f) {
      logger.warning("Could not requeue interrupted broadcasts: " + f.cause().message());
    } else if (requeued.orElseThrow() > 0) {
      logger.info("Requeued " + requeued.orElseThrow() + " interrupted broadcast job(s)");
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("raffle-broadcast-poller-"));
    pollTask = scheduler.scheduleWithFixedDelay(this::pollOnce, 0, pollIntervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Claims pending jobs while workers are free and hands them to the worker pool. Called by the
   * scheduler, but may also be invoked directly.
   *
   * @return the number of jobs handed to workers
   */
  public int pollOnce() {
    if (closed) {
      return 0;
    }
    int handed = 0;
    try {
      while (activeJobs.get() < workerCount) {
        Optional<BroadcastJob> claimed = claimNext();
        if (claimed.isEmpty()) {
          break;
        }
        BroadcastJob job = claimed.get();
        activeJobs.incrementAndGet();
        try {
          workers.execute(() -> {
            try {
              processJob(job);
            } finally {
              activeJobs.decrementAndGet();
            }
          });
          handed++;
        } catch (RejectedExecutionException e) {
          activeJobs.decrementAndGet();
          release(job.jobId());
          break;
        }
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Broadcast poll cycle failed", t);
    }
    return handed;
  }

  /**
   * Processes every pending job on the calling thread until none is left.
   *
   * @return the number of jobs processed
   */
  public int drainPending() {
    int processed = 0;
    while (!closed) {
      Optional<BroadcastJob> claimed = claimNext();
      if (claimed.isEmpty()) {
        break;
      }
      processJob(claimed.get());
      processed++;
    }
    return processed;
  }

  private Optional<BroadcastJob> claimNext() {
    StoreResult<Optional<BroadcastJob>> claimed = jobs.claimNextPending();
    if (claimed instanceof StoreResult.Failure<Optional<BroadcastJob>> f) {
      logger.warning("Failed to claim pending broadcast: " + f.cause().message());
      return Optional.empty();
    }
    return claimed.orElseThrow();
  }

  private void wakeUp() {
    ScheduledExecutorService current;
    synchronized (this) {
      current = pollTask != null ? scheduler : null;
    }
    if (current == null || closed) {
      return;
    }
    try {
      current.execute(this::pollOnce);
    } catch (RejectedExecutionException e) {
      logger.fine("Poller already stopped; job stays pending");
    }
  }

  private void processJob(BroadcastJob job) {
    try {
      sendJob(job);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Broadcast " + job.jobId() + " failed unexpectedly", e);
      release(job.jobId());
    }
  }

  private void sendJob(BroadcastJob job) {
    String jobId = job.jobId();
    StoreResult<List<RecipientTask>> pendingResult = jobs.pendingRecipients(jobId);
    if (pendingResult instanceof StoreResult.Failure<List<RecipientTask>> f) {
      logger.warning("Broadcast " + jobId + " could not load recipients: " + f.cause().message());
      release(jobId);
      return;
    }
    List<RecipientTask> pending = pendingResult.orElseThrow();
    logger.info("Broadcast " + jobId + " sending to " + pending.size() + " of "
        + job.totalRecipients() + " recipients");

    boolean cancelled = false;
    for (int from = 0; from < pending.size(); from += batchSize) {
      if (isCancelRequested(jobId)) {
        cancelled = true;
        break;
      }
      if (closed) {
        release(jobId);
        return;
      }
      List<RecipientTask> batch = pending.subList(from, Math.min(from + batchSize, pending.size()));
      if (!sendBatch(job, batch)) {
        release(jobId);
        return;
      }
    }
    if (pending.isEmpty() && isCancelRequested(jobId)) {
      cancelled = true;
    }
    finish(jobId, cancelled);
  }

  /**
   * Sends one batch in rounds until every recipient is delivered or exhausted.
   *
   * @return {@code false} if interrupted, closed, or a recipient result could not be stored
   *     before the batch finished
   */
  private boolean sendBatch(BroadcastJob job, List<RecipientTask> batch) {
    List<RecipientTask> remaining = batch;
    int round = 0;
    while (!remaining.isEmpty()) {
      List<RecipientTask> retry = new ArrayList<>();
      int i = 0;
      while (i < remaining.size()) {
        RecipientTask task = remaining.get(i);
        try {
          rateLimiter.acquire();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return false;
        }
        DeliveryOutcome outcome = send(task.recipient(), job);
        if (outcome instanceof DeliveryOutcome.Throttled throttled) {
          Duration pause = throttled.retryAfter().compareTo(throttleCooldown) > 0
              ? throttled.retryAfter() : throttleCooldown;
          metrics.incrementDeliveryThrottled();
          logger.warning("Broadcast " + job.jobId() + " throttled; pausing all sends for "
              + pause.toMillis() + " ms");
          rateLimiter.pause(pause);
          if (closed) {
            return false;
          }
          continue;
        }
        if (outcome instanceof DeliveryOutcome.Failed failed) {
          StoreResult<RecipientStatus> recorded =
              jobs.recordFailure(job.jobId(), task.position(), failed.reason(), maxAttempts);
          if (recorded instanceof StoreResult.Failure<RecipientStatus> f) {
            logger.warning("Broadcast " + job.jobId() + " could not record failure for "
                + task.recipient() + "; requeueing job: " + f.cause().message());
            return false;
          }
          RecipientTask next = afterFailure(job.jobId(), task, failed.reason(), recorded.orElseThrow());
          if (next != null) {
            retry.add(next);
          }
        } else if (!markDelivered(job.jobId(), task)) {
          return false;
        }
        i++;
      }
      if (retry.isEmpty()) {
        break;
      }
      round++;
      long delayMs = retryPolicy.computeDelayMs(round);
      if (delayMs > 0) {
        try {
          Thread.sleep(delayMs);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return false;
        }
      }
      if (closed) {
        return false;
      }
      remaining = retry;
    }
    return true;
  }

  private DeliveryOutcome send(String recipient, BroadcastJob job) {
    try {
      DeliveryOutcome outcome = job.media() != null
          ? channel.send(recipient, job.payload(), job.media())
          : channel.send(recipient, job.payload());
      return outcome != null ? outcome : DeliveryOutcome.failed("channel returned no outcome");
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Send to " + recipient + " threw", e);
      return DeliveryOutcome.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
    }
  }

  /**
   * @return {@code false} if the delivery could not be recorded
   */
  private boolean markDelivered(String jobId, RecipientTask task) {
    StoreResult<Boolean> marked = jobs.markDelivered(jobId, task.position());
    if (marked instanceof StoreResult.Failure<Boolean> f) {
      logger.log(Level.SEVERE, "Broadcast " + jobId + " delivered to " + task.recipient()
          + " but could not record it; requeueing job", f.cause().cause());
      return false;
    }
    if (marked.orElseThrow()) {
      metrics.incrementDeliverySuccess();
      logger.fine("Broadcast " + jobId + " delivered to " + task.recipient());
    }
    return true;
  }

  /**
   * @return the task to retry, or {@code null} once the recipient is exhausted
   */
  private RecipientTask afterFailure(String jobId, RecipientTask task, String reason,
      RecipientStatus status) {
    RecipientTask next = new RecipientTask(task.position(), task.recipient(), task.attempts() + 1);
    if (status != RecipientStatus.PENDING) {
      metrics.incrementDeliveryFailed();
      logger.warning("Broadcast " + jobId + " gave up on " + task.recipient() + " after "
          + next.attempts() + " attempt(s): " + reason);
      return null;
    }
    metrics.incrementDeliveryRetry();
    return next;
  }

  private boolean isCancelRequested(String jobId) {
    StoreResult<Boolean> requested = jobs.isCancelRequested(jobId);
    if (requested instanceof StoreResult.Failure<Boolean> f) {
      logger.warning("Broadcast " + jobId + " could not read cancel flag: " + f.cause().message());
      return false;
    }
    return requested.orElseThrow();
  }

  private void finish(String jobId, boolean cancelled) {
    StoreResult<Optional<JobProgress>> progressResult = jobs.progress(jobId);
    if (progressResult instanceof StoreResult.Failure<Optional<JobProgress>> f) {
      logger.warning("Broadcast " + jobId + " could not read progress: " + f.cause().message());
      release(jobId);
      return;
    }
    Optional<JobProgress> progress = progressResult.orElseThrow();
    int delivered = progress.map(JobProgress::delivered).orElse(0);
    int failed = progress.map(JobProgress::failed).orElse(0);
    int pending = progress.map(JobProgress::pending).orElse(0);

    if (!cancelled && pending > 0) {
      logger.warning("Broadcast " + jobId + " still has " + pending
          + " undelivered recipient(s); requeueing");
      release(jobId);
      return;
    }
    JobStatus terminal;
    if (cancelled) {
      terminal = JobStatus.CANCELLED;
    } else if (failed > 0) {
      terminal = JobStatus.DONE_WITH_ERRORS;
    } else {
      terminal = JobStatus.DONE;
    }
    StoreResult<Boolean> finished = jobs.finish(jobId, terminal);
    if (!finished.isOk()) {
      logger.warning("Broadcast " + jobId + " could not be marked " + terminal.code() + ": "
          + finished.error().map(StoreError::message).orElse(""));
      return;
    }
    metrics.incrementBroadcastFinished();
    logger.info("Broadcast " + jobId + " finished " + terminal.code()
        + " (delivered=" + delivered + ", failed=" + failed + ", pending=" + pending + ")");
    events.publish(new RaffleEvent.BroadcastFinished(jobId, terminal, delivered, failed, clock.instant()));
  }

  private void release(String jobId) {
    StoreResult<Boolean> released = jobs.release(jobId);
    if (!released.isOk()) {
      logger.warning("Broadcast " + jobId + " could not be requeued: "
          + released.error().map(StoreError::message).orElse(""));
    } else {
      logger.info("Broadcast " + jobId + " interrupted; requeued");
    }
  }

  /**
   * Stops polling, lets workers finish their current batch within the drain timeout and
   * returns unfinished jobs to pending.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.warning("Drain timeout exceeded; interrupting " + activeJobs.get() + " broadcast worker(s)");
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link BroadcastQueue}. */
  public static final class Builder {
    private BroadcastJobRepository jobs;
    private DeliveryChannel channel;
    private RateLimiter rateLimiter;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 3;
    private int batchSize = 30;
    private Duration throttleCooldown;
    private int workerCount = 2;
    private long pollIntervalMs = 1000;
    private long drainTimeoutMs = 5000;
    private EventDispatcher events;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the repository jobs and recipient state are persisted in.
     *
     * <p><b>Required.</b>
     *
     * @param jobs the broadcast job repository
     * @return this builder
     */
    public Builder jobRepository(BroadcastJobRepository jobs) {
      this.jobs = jobs;
      return this;
    }

    /**
     * Sets the transport messages are sent through.
     *
     * <p><b>Required.</b>
     *
     * @param channel the delivery channel
     * @return this builder
     */
    public Builder deliveryChannel(DeliveryChannel channel) {
      this.channel = channel;
      return this;
    }

    /**
     * Sets the limiter shared by all workers.
     *
     * <p>Optional. Defaults to a {@link TokenBucketRateLimiter} of 30 sends per second.
     *
     * @param rateLimiter the rate limiter
     * @return this builder
     */
    public Builder rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    /**
     * Sets the backoff between retry rounds within a batch.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
     * {@code baseDelayMs=1000} and {@code maxDelayMs=8000}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the attempts per recipient before it is marked failed.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param maxAttempts attempts per recipient
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Optional. Defaults to {@code 30}. Must be &ge; 1.
     *
     * @param batchSize recipients per batch
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the minimum pause applied when the channel reports throttling.
     *
     * <p>Optional. Defaults to 1 second.
     *
     * @param throttleCooldown minimum pause
     * @return this builder
     */
    public Builder throttleCooldown(Duration throttleCooldown) {
      this.throttleCooldown = throttleCooldown;
      return this;
    }

    /**
     * Sets how many jobs are processed concurrently.
     *
     * <p>Optional. Defaults to {@code 2}. Must be &ge; 1.
     *
     * @param workerCount number of worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Optional. Defaults to {@code 1000} ms. Must be &gt; 0.
     *
     * @param pollIntervalMs delay between poll cycles
     * @return this builder
     */
    public Builder pollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
      return this;
    }

    /**
     * Sets the maximum time to wait for workers during {@link BroadcastQueue#close()}.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public Builder events(EventDispatcher events) {
      this.events = events;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the queue and its worker pool. Polling begins with {@link BroadcastQueue#start()}.
     *
     * @throws NullPointerException if {@code jobRepository} or {@code deliveryChannel} is null
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public BroadcastQueue build() {
      return new BroadcastQueue(this);
    }
  }
}
