package raffle.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import raffle.spi.InvalidationHook;
import raffle.spi.MetricsExporter;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Three-tier in-memory read cache with single-flight loading.
 *
 * <p>Each {@link Tier} is a Caffeine cache with its own time-to-live (from write) and size
 * bound; when a tier is full the entry least likely to be reused is evicted. On a miss only one
 * caller per key runs the loader; concurrent callers for the same key wait on the same future
 * and observe the same value or the same exception. A failed load caches nothing, and
 * {@code null} values are returned but not cached.
 *
 * <p>{@link #invalidate(String)} marks an in-flight load of the key stale: callers already
 * waiting, and callers arriving before it finishes, still share that one load, but its result is
 * not stored, so a load that started before a write cannot repopulate the cache with the old
 * value.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class CacheTier implements InvalidationHook {
  private static final Logger logger = Logger.getLogger(CacheTier.class.getName());

  private final Map<Tier, Cache<String, Object>> tiers;
  private final ConcurrentHashMap<String, Flight> inFlight = new ConcurrentHashMap<>();
  private final Duration singleFlightTimeout;
  private final MetricsExporter metrics;

  private CacheTier(Builder builder) {
    Ticker ticker = builder.ticker != null ? builder.ticker : Ticker.systemTicker();
    this.singleFlightTimeout = builder.singleFlightTimeout;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (singleFlightTimeout.isNegative() || singleFlightTimeout.isZero()) {
      throw new IllegalArgumentException("singleFlightTimeout must be positive");
    }

    Map<Tier, Cache<String, Object>> caches = new EnumMap<>(Tier.class);
    for (Tier tier : Tier.values()) {
      Duration ttl = builder.ttls.getOrDefault(tier, tier.defaultTtl());
      long maximumSize = builder.maximumSizes.getOrDefault(tier, tier.defaultMaximumSize());
      if (ttl.isNegative() || ttl.isZero()) {
        throw new IllegalArgumentException(tier + " ttl must be positive");
      }
      if (maximumSize < 1) {
        throw new IllegalArgumentException(tier + " maximumSize must be >= 1");
      }
      caches.put(tier, Caffeine.newBuilder()
          .expireAfterWrite(ttl)
          .maximumSize(maximumSize)
          .ticker(ticker)
          .executor(Runnable::run)
          .build());
    }
    this.tiers = caches;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the cached value for {@code key} in {@code tier}, loading it on a miss.
   *
   * @param loader computes the value; its exceptions propagate to every waiting caller
   * @throws SingleFlightTimeoutException if another caller's load took longer than the
   *     single-flight timeout
   */
  @SuppressWarnings("unchecked")
  public <V> V getOrLoad(String key, Tier tier, Supplier<? extends V> loader) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(tier, "tier");
    Objects.requireNonNull(loader, "loader");
    Cache<String, Object> cache = tiers.get(tier);

    Object cached = cache.getIfPresent(key);
    if (cached != null) {
      metrics.incrementCacheHit(tier.metricName());
      return (V) cached;
    }
    metrics.incrementCacheMiss(tier.metricName());

    Flight candidate = new Flight();
    Flight flight = inFlight.putIfAbsent(key, candidate);
    if (flight == null) {
      return (V) lead(key, cache, candidate, loader);
    }
    return (V) await(key, flight.future);
  }

  private Object lead(String key, Cache<String, Object> cache, Flight flight,
      Supplier<?> loader) {
    CompletableFuture<Object> future = flight.future;
    try {
      // a previous leader may have stored the value between our miss and our claim
      Object value = cache.getIfPresent(key);
      if (value == null) {
        value = loader.get();
      }
      Object loaded = value;
      if (loaded != null) {
        // invalidate() marks the flight under the same bin lock before clearing the tiers
        inFlight.computeIfPresent(key, (k, current) -> {
          if (current == flight && !current.stale) {
            cache.put(k, loaded);
          }
          return current;
        });
      }
      future.complete(loaded);
      return loaded;
    } catch (RuntimeException | Error e) {
      metrics.incrementCacheLoadFailure();
      future.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(key, flight);
    }
  }

  private Object await(String key, CompletableFuture<Object> future) {
    try {
      return future.get(singleFlightTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      throw new SingleFlightTimeoutException("single-flight timeout for key=" + key, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CompletionException("interrupted waiting for key=" + key, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) {
        throw re;
      }
      if (cause instanceof Error err) {
        throw err;
      }
      throw new CompletionException(cause);
    }
  }

  /** Returns the cached value without loading, or {@code null}. */
  @SuppressWarnings("unchecked")
  public <V> V getIfPresent(String key, Tier tier) {
    return (V) tiers.get(tier).getIfPresent(key);
  }

  /**
   * Removes {@code key} from every tier and keeps any in-flight load of it from being stored.
   */
  @Override
  public void invalidate(String key) {
    inFlight.computeIfPresent(key, CacheTier::markStale);
    for (Cache<String, Object> cache : tiers.values()) {
      cache.invalidate(key);
    }
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest("Invalidated " + key);
    }
  }

  public void invalidateAll() {
    inFlight.replaceAll(CacheTier::markStale);
    for (Cache<String, Object> cache : tiers.values()) {
      cache.invalidateAll();
    }
  }

  private static Flight markStale(String key, Flight flight) {
    flight.stale = true;
    return flight;
  }

  /** A load in progress; {@code stale} is only touched inside {@code inFlight} bin locks. */
  private static final class Flight {
    final CompletableFuture<Object> future = new CompletableFuture<>();
    boolean stale;
  }

  /** Approximate number of entries in a tier. */
  public long estimatedSize(Tier tier) {
    Cache<String, Object> cache = tiers.get(tier);
    cache.cleanUp();
    return cache.estimatedSize();
  }

  /** Builder for {@link CacheTier}. */
  public static final class Builder {
    private final Map<Tier, Duration> ttls = new EnumMap<>(Tier.class);
    private final Map<Tier, Long> maximumSizes = new EnumMap<>(Tier.class);
    private Ticker ticker;
    private Duration singleFlightTimeout = Duration.ofSeconds(5);
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Overrides a tier's time-to-live and size bound.
     *
     * <p>Optional. Unset tiers use {@link Tier#defaultTtl()} and
     * {@link Tier#defaultMaximumSize()}.
     *
     * @param tier        the tier
     * @param ttl         time-to-live from write, must be positive
     * @param maximumSize maximum entries, must be &ge; 1
     * @return this builder
     */
    public Builder tier(Tier tier, Duration ttl, long maximumSize) {
      ttls.put(Objects.requireNonNull(tier, "tier"), Objects.requireNonNull(ttl, "ttl"));
      maximumSizes.put(tier, maximumSize);
      return this;
    }

    /**
     * Sets the time source for expiry.
     *
     * <p>Optional. Defaults to {@link Ticker#systemTicker()}.
     *
     * @param ticker the ticker
     * @return this builder
     */
    public Builder ticker(Ticker ticker) {
      this.ticker = ticker;
      return this;
    }

    /**
     * Sets how long a caller waits for another caller's load of the same key.
     *
     * <p>Optional. Defaults to 5 seconds.
     *
     * @param singleFlightTimeout the wait bound
     * @return this builder
     */
    public Builder singleFlightTimeout(Duration singleFlightTimeout) {
      this.singleFlightTimeout = Objects.requireNonNull(singleFlightTimeout, "singleFlightTimeout");
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public CacheTier build() {
      return new CacheTier(this);
    }
  }
}
