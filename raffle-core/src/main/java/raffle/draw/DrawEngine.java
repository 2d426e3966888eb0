package raffle.draw;

import raffle.ErrorKind;
import raffle.StoreError;
import raffle.StoreResult;
import raffle.event.EventDispatcher;
import raffle.event.RaffleEvent;
import raffle.model.BeginResult;
import raffle.model.LotteryRun;
import raffle.model.ParticipantSnapshot;
import raffle.model.RunStatus;
import raffle.model.Winner;
import raffle.spi.LotteryRunRepository;
import raffle.spi.MetricsExporter;
import raffle.spi.ParticipantRepository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs verifiable prize draws over a snapshot of approved participants.
 *
 * <p>A draw:
 * <ol>
 *   <li>claims the run id in process (concurrent callers get {@link DrawOutcome.AlreadyRunning})</li>
 *   <li>reads an immutable snapshot of approved participants</li>
 *   <li>generates a seed and persists it with the snapshot digest before selecting, so the run
 *       is claimed across processes and auditable even if selection fails</li>
 *   <li>selects winners with {@link WinnerSelector} and commits them with the run status</li>
 * </ol>
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class DrawEngine {
  private static final Logger logger = Logger.getLogger(DrawEngine.class.getName());

  private final ParticipantRepository participants;
  private final LotteryRunRepository runs;
  private final SeedGenerator seedGenerator;
  private final EventDispatcher events;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final ConcurrentMap<String, Thread> inProgress = new ConcurrentHashMap<>();

  private DrawEngine(Builder builder) {
    this.participants = Objects.requireNonNull(builder.participants, "participants");
    this.runs = Objects.requireNonNull(builder.runs, "runs");
    this.seedGenerator = builder.seedGenerator != null ? builder.seedGenerator : new SeedGenerator();
    this.events = builder.events != null ? builder.events : EventDispatcher.NONE;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  public DrawOutcome runDraw(String runId, int winnerCount) {
    return runDraw(runId, winnerCount, List.of());
  }

  /**
   * Runs the draw for {@code runId}.
   *
   * @param runId       run identifier; at most one execution per id ever completes
   * @param winnerCount winners wanted; {@code 0} returns an empty completed outcome and
   *                    persists nothing
   * @param prizes      prize descriptions by position; positions beyond the list get an
   *                    empty description
   */
  public DrawOutcome runDraw(String runId, int winnerCount, List<String> prizes) {
    Objects.requireNonNull(prizes, "prizes");
    if (runId == null || runId.isBlank()) {
      return new DrawOutcome.Rejected(runId, StoreError.validation("runId must not be blank"));
    }
    if (winnerCount < 0) {
      return new DrawOutcome.Rejected(runId,
          StoreError.validation("winnerCount must be >= 0, got: " + winnerCount));
    }
    if (winnerCount == 0) {
      return new DrawOutcome.Completed(runId, "", List.of(), false);
    }

    if (inProgress.putIfAbsent(runId, Thread.currentThread()) != null) {
      metrics.incrementDrawRejected();
      return new DrawOutcome.AlreadyRunning(runId);
    }
    try {
      return execute(runId, winnerCount, prizes);
    } finally {
      inProgress.remove(runId);
    }
  }

  private DrawOutcome execute(String runId, int winnerCount, List<String> prizes) {
    StoreResult<ParticipantSnapshot> snapshotResult = participants.getApprovedSnapshot();
    if (snapshotResult instanceof StoreResult.Failure<ParticipantSnapshot> f) {
      return new DrawOutcome.Rejected(runId, f.cause());
    }
    ParticipantSnapshot snapshot = snapshotResult.orElseThrow();
    if (snapshot.isEmpty()) {
      logger.info("Draw " + runId + " skipped: no approved participants");
      return new DrawOutcome.InsufficientParticipants(runId);
    }

    String seed = seedGenerator.generate();
    StoreResult<BeginResult> begin = runs.begin(runId, seed, winnerCount, snapshot);
    if (begin instanceof StoreResult.Failure<BeginResult> f) {
      return new DrawOutcome.Rejected(runId, f.cause());
    }
    switch (begin.orElseThrow()) {
      case RUNNING -> {
        metrics.incrementDrawRejected();
        return new DrawOutcome.AlreadyRunning(runId);
      }
      case COMPLETED -> {
        metrics.incrementDrawRejected();
        return new DrawOutcome.AlreadyCompleted(runId);
      }
      case STARTED -> {
        // fall through to selection
      }
    }

    List<Winner> winners;
    try {
      List<Long> selected = WinnerSelector.select(snapshot.participantIds(), seed, winnerCount);
      winners = toWinners(runId, selected, prizes);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Winner selection failed for run " + runId, e);
      markFailed(runId, e.getMessage());
      return new DrawOutcome.Rejected(runId, new StoreError(ErrorKind.FATAL, "selection failed", e));
    }

    StoreResult<Integer> committed = runs.complete(runId, winners);
    if (committed instanceof StoreResult.Failure<Integer> f) {
      logger.warning("Draw " + runId + " could not commit winners: " + f.cause().message());
      markFailed(runId, f.cause().message());
      return new DrawOutcome.Rejected(runId, f.cause());
    }

    boolean underFilled = winnerCount > snapshot.size();
    metrics.incrementDrawCompleted();
    logger.info("Draw " + runId + " completed: " + winners.size() + " of " + winnerCount
        + " winners from " + snapshot.size() + " participants, seed=" + seed);
    events.publish(new RaffleEvent.DrawCompleted(runId, seed, winners, clock.instant()));
    return new DrawOutcome.Completed(runId, seed, winners, underFilled);
  }

  private void markFailed(String runId, String reason) {
    StoreResult<Boolean> marked = runs.markFailed(runId, reason == null ? "unknown" : reason);
    if (!marked.isOk()) {
      logger.warning("Failed to mark run " + runId + " as failed: "
          + marked.error().map(StoreError::message).orElse(""));
    }
  }

  private static List<Winner> toWinners(String runId, List<Long> selected, List<String> prizes) {
    List<Winner> winners = new ArrayList<>(selected.size());
    for (int i = 0; i < selected.size(); i++) {
      String prize = i < prizes.size() && prizes.get(i) != null ? prizes.get(i) : "";
      winners.add(new Winner(runId, selected.get(i), i + 1, prize, false));
    }
    return winners;
  }

  /**
   * Re-derives a completed run's winners from its persisted seed and the given snapshot.
   *
   * @return {@code true} when the snapshot digest matches and the recomputed winners equal
   *     the stored ones, in order
   */
  public StoreResult<Boolean> verify(String runId, ParticipantSnapshot snapshot) {
    StoreResult<Optional<LotteryRun>> found = runs.find(runId);
    if (found instanceof StoreResult.Failure<Optional<LotteryRun>> f) {
      return StoreResult.failure(f.cause());
    }
    Optional<LotteryRun> run = found.orElseThrow();
    if (run.isEmpty()) {
      return StoreResult.failure(ErrorKind.VALIDATION, "unknown run: " + runId);
    }
    if (run.get().status() != RunStatus.COMPLETED) {
      return StoreResult.failure(ErrorKind.VALIDATION,
          "run " + runId + " is " + run.get().status().code());
    }
    if (!run.get().snapshotDigest().equals(snapshot.digest())) {
      return StoreResult.ok(false);
    }
    List<Long> expected = WinnerSelector.select(
        snapshot.participantIds(), run.get().seed(), run.get().requestedCount());
    return runs.winners(runId).map(stored ->
        stored.stream().map(Winner::participantId).toList().equals(expected));
  }

  /** Whether a draw for {@code runId} is executing in this process. */
  public boolean isRunning(String runId) {
    return inProgress.containsKey(runId);
  }

  /** Builder for {@link DrawEngine}. */
  public static final class Builder {
    private ParticipantRepository participants;
    private LotteryRunRepository runs;
    private SeedGenerator seedGenerator;
    private EventDispatcher events;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the repository the approved snapshot is read from.
     *
     * <p><b>Required.</b>
     *
     * @param participants the participant repository
     * @return this builder
     */
    public Builder participants(ParticipantRepository participants) {
      this.participants = participants;
      return this;
    }

    /**
     * Sets the repository runs and winners are persisted in.
     *
     * <p><b>Required.</b>
     *
     * @param runs the lottery run repository
     * @return this builder
     */
    public Builder runs(LotteryRunRepository runs) {
      this.runs = runs;
      return this;
    }

    /**
     * Optional. Defaults to a {@link SeedGenerator} over the system clock and
     * {@link java.security.SecureRandom}.
     *
     * @param seedGenerator the seed source
     * @return this builder
     */
    public Builder seedGenerator(SeedGenerator seedGenerator) {
      this.seedGenerator = seedGenerator;
      return this;
    }

    /**
     * Optional. Defaults to {@link EventDispatcher#NONE}.
     *
     * @param events dispatcher receiving {@link RaffleEvent.DrawCompleted}
     * @return this builder
     */
    public Builder events(EventDispatcher events) {
      this.events = events;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * @throws NullPointerException if {@code participants} or {@code runs} is null
     */
    public DrawEngine build() {
      return new DrawEngine(this);
    }
  }
}
