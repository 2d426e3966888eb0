package raffle;

import raffle.broadcast.BroadcastQueue;
import raffle.broadcast.ExponentialBackoffRetryPolicy;
import raffle.broadcast.TokenBucketRateLimiter;
import raffle.cache.CacheTier;
import raffle.cache.CachedReads;
import raffle.cache.Tier;
import raffle.draw.DrawEngine;
import raffle.event.EventDispatcher;
import raffle.event.RaffleEvent;
import raffle.fraud.FraudScore;
import raffle.fraud.FraudScorer;
import raffle.fraud.FraudSignals;
import raffle.spi.DeliveryChannel;
import raffle.spi.MetricsExporter;
import raffle.spi.Repositories;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link DrawEngine}, an optional {@link BroadcastQueue},
 * {@link CachedReads} and a {@link FraudScorer} over one set of {@link Repositories} into a
 * single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * CacheTier cache = Raffle.cacheTier(config, metrics);
 * RaffleDatabase db = RaffleDatabase.builder()
 *     .settings(settings)
 *     .invalidation(cache)
 *     .events(events)
 *     .open();
 * try (Raffle raffle = Raffle.builder()
 *     .config(config)
 *     .repositories(db.repositories())
 *     .cache(cache)
 *     .deliveryChannel(channel)
 *     .events(events)
 *     .closeOnShutdown(db)
 *     .build()) {
 *   raffle.start();
 *   raffle.drawEngine().runDraw("spring-2026", 3);
 * }
 * }</pre>
 *
 * <p>The cache handed to the builder should be the {@code InvalidationHook} the repositories
 * were built with; otherwise cached reads are only bounded by their time-to-live.
 */
public final class Raffle implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Raffle.class.getName());

  private final Repositories repositories;
  private final CacheTier cache;
  private final CachedReads reads;
  private final DrawEngine drawEngine;
  private final BroadcastQueue broadcastQueue;
  private final FraudScorer fraudScorer;
  private final EventDispatcher events;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final List<AutoCloseable> closeables;
  private final AtomicBoolean closed = new AtomicBoolean();

  private Raffle(Builder builder, CacheTier cache, BroadcastQueue broadcastQueue,
      DrawEngine drawEngine) {
    this.repositories = builder.repositories;
    this.cache = cache;
    this.reads = new CachedReads(cache, repositories.participants(), repositories.lotteryRuns(),
        repositories.broadcastJobs());
    this.drawEngine = drawEngine;
    this.broadcastQueue = broadcastQueue;
    this.fraudScorer = new FraudScorer();
    this.events = builder.events;
    this.metrics = builder.metrics;
    this.clock = builder.clock;
    this.closeables = List.copyOf(builder.closeables);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a {@link CacheTier} from the cache knobs of {@code config}.
   *
   * @param config  tier time-to-lives, size bounds and single-flight timeout
   * @param metrics receives hit/miss counters, may be {@code null}
   * @return a new cache
   */
  public static CacheTier cacheTier(RaffleConfig config, MetricsExporter metrics) {
    return CacheTier.builder()
        .tier(Tier.HOT, Duration.ofSeconds(config.getCacheHotTtlSeconds()),
            config.getCacheHotMaxSize())
        .tier(Tier.WARM, Duration.ofSeconds(config.getCacheWarmTtlSeconds()),
            config.getCacheWarmMaxSize())
        .tier(Tier.COLD, Duration.ofSeconds(config.getCacheColdTtlSeconds()),
            config.getCacheColdMaxSize())
        .singleFlightTimeout(Duration.ofMillis(config.getCacheSingleFlightTimeoutMs()))
        .metrics(metrics)
        .build();
  }

  /** Re-queues interrupted broadcast jobs and starts polling. No-op without a channel. */
  public void start() {
    if (closed.get()) {
      throw new IllegalStateException("Raffle is closed");
    }
    if (broadcastQueue != null) {
      broadcastQueue.start();
    }
  }

  public Repositories repositories() {
    return repositories;
  }

  public CacheTier cache() {
    return cache;
  }

  public CachedReads reads() {
    return reads;
  }

  public DrawEngine drawEngine() {
    return drawEngine;
  }

  /** Empty when no {@link DeliveryChannel} was configured. */
  public Optional<BroadcastQueue> broadcastQueue() {
    return Optional.ofNullable(broadcastQueue);
  }

  public FraudScorer fraudScorer() {
    return fraudScorer;
  }

  public EventDispatcher events() {
    return events;
  }

  /**
   * Scores a registration attempt. Suspicious scores are written to the fraud log before
   * the {@link RaffleEvent.RegistrationScored} event is published.
   *
   * @return the score, or the fraud log failure
   */
  public StoreResult<FraudScore> scoreRegistration(long externalId, FraudSignals signals) {
    Objects.requireNonNull(signals, "signals");
    FraudScore score = fraudScorer.score(signals);
    if (score.isSuspicious()) {
      StoreResult<Long> logged = repositories.fraudLog().record(externalId, score);
      if (logged instanceof StoreResult.Failure<Long> failure) {
        logger.log(Level.WARNING, "Failed to record fraud score for user " + externalId
            + ": " + failure.cause().message());
        return StoreResult.failure(failure.cause());
      }
      logger.info("Registration of user " + externalId + " scored " + score.verdict()
          + " (" + String.join(", ", score.reasons()) + ")");
    }
    events.publish(new RaffleEvent.RegistrationScored(externalId, score, clock.instant()));
    return StoreResult.ok(score);
  }

  /**
   * Shuts down the broadcast queue, the metrics exporter if closeable, then every resource
   * registered with {@link Builder#closeOnShutdown} in reverse registration order.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    if (broadcastQueue != null) {
      try {
        broadcastQueue.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    List<AutoCloseable> toClose = new ArrayList<>();
    if (metrics instanceof AutoCloseable closeable) {
      toClose.add(closeable);
    }
    for (int i = closeables.size() - 1; i >= 0; i--) {
      toClose.add(closeables.get(i));
    }
    for (AutoCloseable closeable : toClose) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Raffle}. */
  public static final class Builder {
    private RaffleConfig config = new RaffleConfig();
    private Repositories repositories;
    private CacheTier cache;
    private DeliveryChannel deliveryChannel;
    private EventDispatcher events = EventDispatcher.NONE;
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private Clock clock = Clock.systemUTC();
    private final List<AutoCloseable> closeables = new ArrayList<>();
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the tuning knobs.
     *
     * <p>Optional. Defaults to {@code new RaffleConfig()}.
     */
    public Builder config(RaffleConfig config) {
      this.config = Objects.requireNonNull(config, "config");
      return this;
    }

    /** Required. */
    public Builder repositories(Repositories repositories) {
      this.repositories = repositories;
      return this;
    }

    /**
     * Sets the read cache.
     *
     * <p>Optional. Defaults to {@link Raffle#cacheTier(RaffleConfig, MetricsExporter)}.
     */
    public Builder cache(CacheTier cache) {
      this.cache = cache;
      return this;
    }

    /**
     * Sets the transport for broadcasts.
     *
     * <p>Optional. Without a channel no {@link BroadcastQueue} is created.
     */
    public Builder deliveryChannel(DeliveryChannel deliveryChannel) {
      this.deliveryChannel = deliveryChannel;
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

    /** Registers a resource closed after the components, in reverse registration order. */
    public Builder closeOnShutdown(AutoCloseable closeable) {
      closeables.add(Objects.requireNonNull(closeable, "closeable"));
      return this;
    }

    public Raffle build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(repositories, "repositories");
      CacheTier cacheTier = cache != null ? cache : cacheTier(config, metrics);

      DrawEngine drawEngine = DrawEngine.builder()
          .participants(repositories.participants())
          .runs(repositories.lotteryRuns())
          .events(events)
          .metrics(metrics)
          .clock(clock)
          .build();

      BroadcastQueue queue = null;
      if (deliveryChannel != null) {
        queue = BroadcastQueue.builder()
            .jobRepository(repositories.broadcastJobs())
            .deliveryChannel(deliveryChannel)
            .rateLimiter(new TokenBucketRateLimiter(
                config.getBroadcastPermitsPerSecond(), config.getBroadcastBurst()))
            .retryPolicy(new ExponentialBackoffRetryPolicy(
                config.getBroadcastRetryBaseDelayMs(), config.getBroadcastRetryMaxDelayMs()))
            .maxAttempts(config.getBroadcastMaxAttempts())
            .batchSize(config.getBroadcastBatchSize())
            .throttleCooldown(Duration.ofMillis(config.getBroadcastThrottleCooldownMs()))
            .workerCount(config.getBroadcastWorkers())
            .pollIntervalMs(config.getBroadcastPollIntervalMs())
            .drainTimeoutMs(config.getBroadcastDrainTimeoutMs())
            .events(events)
            .metrics(metrics)
            .clock(clock)
            .build();
      }
      return new Raffle(this, cacheTier, queue, drawEngine);
    }
  }
}
