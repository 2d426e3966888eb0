package raffle.broadcast;

/**
 * Strategy for computing the pause before the next retry round.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /** Policy that retries immediately. */
  RetryPolicy IMMEDIATE = attempt -> 0L;

  /**
   * Computes the delay in milliseconds before the given retry.
   *
   * @param attempt the retry number (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempt);
}
