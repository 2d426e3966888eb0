package raffle.cache;

import java.time.Duration;
import java.util.Locale;

/**
 * Cache tiers by volatility. Defaults: HOT 30 s / 1000 entries, WARM 5 min / 500 entries,
 * COLD 1 h / 200 entries.
 */
public enum Tier {
  HOT(Duration.ofSeconds(30), 1000),
  WARM(Duration.ofMinutes(5), 500),
  COLD(Duration.ofHours(1), 200);

  private final Duration defaultTtl;
  private final long defaultMaximumSize;

  Tier(Duration defaultTtl, long defaultMaximumSize) {
    this.defaultTtl = defaultTtl;
    this.defaultMaximumSize = defaultMaximumSize;
  }

  public Duration defaultTtl() {
    return defaultTtl;
  }

  public long defaultMaximumSize() {
    return defaultMaximumSize;
  }

  /** Lower-case name used as the {@code tier} tag on cache metrics. */
  public String metricName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
