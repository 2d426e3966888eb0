package raffle.broadcast;

import java.time.Duration;

/**
 * Shared send-rate ceiling for all broadcast workers.
 */
public interface RateLimiter {

  /**
   * Blocks until a send is permitted.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  void acquire() throws InterruptedException;

  /**
   * Withholds all permits for at least {@code duration}, for every caller. Overlapping
   * pauses extend to the latest end.
   */
  void pause(Duration duration);
}
