package raffle.broadcast;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Token bucket holding up to {@code burst} permits, refilled at {@code permitsPerSecond}.
 *
 * <p>Callers reserve a permit under the lock and sleep outside it, so waiting callers queue in
 * reservation order. Over any window of length {@code t} at most
 * {@code burst + permitsPerSecond * t} permits are granted. {@link #pause} moves the earliest
 * grant time forward for everyone.
 */
public final class TokenBucketRateLimiter implements RateLimiter {

  /** Sleeps for a number of nanoseconds. */
  @FunctionalInterface
  public interface Sleeper {
    Sleeper SYSTEM = TimeUnit.NANOSECONDS::sleep;

    void sleepNanos(long nanos) throws InterruptedException;
  }

  private final double permitsPerSecond;
  private final int burst;
  private final long nanosPerPermit;
  private final LongSupplier nanoTime;
  private final Sleeper sleeper;

  private double tokens;
  private long refilledAt;
  private long pausedUntil;

  public TokenBucketRateLimiter(double permitsPerSecond, int burst) {
    this(permitsPerSecond, burst, System::nanoTime, Sleeper.SYSTEM);
  }

  public TokenBucketRateLimiter(double permitsPerSecond, int burst, LongSupplier nanoTime, Sleeper sleeper) {
    if (!(permitsPerSecond > 0.0) || Double.isInfinite(permitsPerSecond)) {
      throw new IllegalArgumentException("permitsPerSecond must be > 0, got: " + permitsPerSecond);
    }
    if (burst < 1) {
      throw new IllegalArgumentException("burst must be >= 1, got: " + burst);
    }
    this.permitsPerSecond = permitsPerSecond;
    this.burst = burst;
    this.nanosPerPermit = Math.max(1L, (long) (TimeUnit.SECONDS.toNanos(1) / permitsPerSecond));
    this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.tokens = burst;
    this.refilledAt = nanoTime.getAsLong();
    this.pausedUntil = refilledAt;
  }

  @Override
  public void acquire() throws InterruptedException {
    long waitNanos = reserve();
    if (waitNanos > 0) {
      sleeper.sleepNanos(waitNanos);
    }
    // a pause may have started while this caller slept on its reservation
    long remaining;
    while ((remaining = pauseRemaining()) > 0) {
      sleeper.sleepNanos(remaining);
    }
  }

  /**
   * Takes one permit and returns how long the caller must wait before using it.
   */
  synchronized long reserve() {
    long now = nanoTime.getAsLong();
    long start = Math.max(now, pausedUntil);
    if (start > refilledAt) {
      tokens = Math.min(burst, tokens + (double) (start - refilledAt) / nanosPerPermit);
      refilledAt = start;
    }
    tokens -= 1.0;
    long wait = start - now;
    if (tokens < 0) {
      wait += (long) Math.ceil(-tokens * nanosPerPermit);
    }
    return wait;
  }

  @Override
  public synchronized void pause(Duration duration) {
    Objects.requireNonNull(duration, "duration");
    if (duration.isNegative() || duration.isZero()) {
      return;
    }
    long now = nanoTime.getAsLong();
    if (now > refilledAt) {
      tokens = Math.min(burst, tokens + (double) (now - refilledAt) / nanosPerPermit);
      refilledAt = now;
    }
    pausedUntil = Math.max(pausedUntil, now + duration.toNanos());
    // no permits accumulate while paused
    refilledAt = Math.max(refilledAt, pausedUntil);
  }

  synchronized long pauseRemaining() {
    return Math.max(0L, pausedUntil - nanoTime.getAsLong());
  }

  public double permitsPerSecond() {
    return permitsPerSecond;
  }

  public int burst() {
    return burst;
  }
}
