package raffle.broadcast;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}.
 *
 * <p>With jitter enabled the delay is scaled by a random factor in {@code [0.5, 1.5)} and
 * capped again. Used between broadcast retry rounds and between busy-datastore retries.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final boolean jitter;

  /**
   * Creates a jittered policy.
   *
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, true);
  }

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, boolean jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException(
          "maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs + " < " + baseDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int attempt) {
    if (attempt <= 0) {
      return 0L;
    }
    long delay;
    if (attempt >= 63 || (1L << (attempt - 1)) > maxDelayMs / baseDelayMs) {
      delay = maxDelayMs;
    } else {
      delay = Math.min(maxDelayMs, baseDelayMs * (1L << (attempt - 1)));
    }
    if (!jitter) {
      return delay;
    }
    double factor = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, Math.max(0L, (long) (delay * factor)));
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }
}
