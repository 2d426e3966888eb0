package raffle.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import raffle.cache.Tier;
import raffle.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters with a {@link MeterRegistry} for export to Prometheus, Grafana,
 * Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code raffle.draw.completed}: draws that committed winners</li>
 *   <li>{@code raffle.draw.rejected}: draws refused as already running or completed</li>
 *   <li>{@code raffle.delivery.success}: recipients delivered</li>
 *   <li>{@code raffle.delivery.retry}: failed sends that will be retried</li>
 *   <li>{@code raffle.delivery.failed}: recipients that exhausted their attempts</li>
 *   <li>{@code raffle.delivery.throttled}: throttle signals from the channel</li>
 *   <li>{@code raffle.broadcast.finished}: broadcast jobs reaching a terminal status</li>
 *   <li>{@code raffle.cache.hit} and {@code raffle.cache.miss}, tagged {@code tier}</li>
 *   <li>{@code raffle.cache.load.failure}: cache loads that threw</li>
 *   <li>{@code raffle.datastore.busy.retry}: units of work retried on a busy datastore</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter drawCompleted;
  private final Counter drawRejected;
  private final Counter deliverySuccess;
  private final Counter deliveryRetry;
  private final Counter deliveryFailed;
  private final Counter deliveryThrottled;
  private final Counter broadcastFinished;
  private final Counter cacheLoadFailure;
  private final Counter busyRetry;
  private final Map<String, Counter> cacheHits = new ConcurrentHashMap<>();
  private final Map<String, Counter> cacheMisses = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "raffle"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "raffle");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "spring.raffle"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.drawCompleted = Counter.builder(namePrefix + ".draw.completed")
        .description("Draws that committed winners")
        .register(registry);
    this.drawRejected = Counter.builder(namePrefix + ".draw.rejected")
        .description("Draws refused because the run was already running or completed")
        .register(registry);
    this.deliverySuccess = Counter.builder(namePrefix + ".delivery.success")
        .description("Recipients delivered successfully")
        .register(registry);
    this.deliveryRetry = Counter.builder(namePrefix + ".delivery.retry")
        .description("Failed sends that will be retried")
        .register(registry);
    this.deliveryFailed = Counter.builder(namePrefix + ".delivery.failed")
        .description("Recipients that exhausted their attempts")
        .register(registry);
    this.deliveryThrottled = Counter.builder(namePrefix + ".delivery.throttled")
        .description("Throttle signals received from the delivery channel")
        .register(registry);
    this.broadcastFinished = Counter.builder(namePrefix + ".broadcast.finished")
        .description("Broadcast jobs that reached a terminal status")
        .register(registry);
    this.cacheLoadFailure = Counter.builder(namePrefix + ".cache.load.failure")
        .description("Cache loads that failed")
        .register(registry);
    this.busyRetry = Counter.builder(namePrefix + ".datastore.busy.retry")
        .description("Units of work retried because the datastore was busy")
        .register(registry);
    for (Tier tier : Tier.values()) {
      cacheCounter(cacheHits, ".cache.hit", tier.metricName());
      cacheCounter(cacheMisses, ".cache.miss", tier.metricName());
    }
  }

  @Override
  public void incrementDrawCompleted() {
    if (closed) return;
    drawCompleted.increment();
  }

  @Override
  public void incrementDrawRejected() {
    if (closed) return;
    drawRejected.increment();
  }

  @Override
  public void incrementDeliverySuccess() {
    if (closed) return;
    deliverySuccess.increment();
  }

  @Override
  public void incrementDeliveryRetry() {
    if (closed) return;
    deliveryRetry.increment();
  }

  @Override
  public void incrementDeliveryFailed() {
    if (closed) return;
    deliveryFailed.increment();
  }

  @Override
  public void incrementDeliveryThrottled() {
    if (closed) return;
    deliveryThrottled.increment();
  }

  @Override
  public void incrementBroadcastFinished() {
    if (closed) return;
    broadcastFinished.increment();
  }

  @Override
  public void incrementCacheHit(String tier) {
    if (closed) return;
    cacheCounter(cacheHits, ".cache.hit", tier).increment();
  }

  @Override
  public void incrementCacheMiss(String tier) {
    if (closed) return;
    cacheCounter(cacheMisses, ".cache.miss", tier).increment();
  }

  @Override
  public void incrementCacheLoadFailure() {
    if (closed) return;
    cacheLoadFailure.increment();
  }

  @Override
  public void incrementBusyRetry() {
    if (closed) return;
    busyRetry.increment();
  }

  private Counter cacheCounter(Map<String, Counter> counters, String suffix, String tier) {
    return counters.computeIfAbsent(tier, t -> Counter.builder(namePrefix + suffix)
        .description(suffix.endsWith("hit") ? "Cache hits" : "Cache misses")
        .tag("tier", t)
        .register(registry));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link raffle.Raffle} is closed).
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(drawCompleted, drawRejected, deliverySuccess,
        deliveryRetry, deliveryFailed, deliveryThrottled, broadcastFinished, cacheLoadFailure,
        busyRetry));
    meters.addAll(cacheHits.values());
    meters.addAll(cacheMisses.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
