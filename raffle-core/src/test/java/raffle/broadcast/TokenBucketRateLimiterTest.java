package raffle.broadcast;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketRateLimiterTest {
  private static final long MILLI = 1_000_000L;

  private final AtomicLong clock = new AtomicLong();

  private TokenBucketRateLimiter limiter(double permitsPerSecond, int burst) {
    return new TokenBucketRateLimiter(permitsPerSecond, burst, clock::get, clock::addAndGet);
  }

  @Test
  void spacesPermitsAtTheConfiguredRate() throws InterruptedException {
    TokenBucketRateLimiter limiter = limiter(10, 1);

    for (int i = 0; i < 21; i++) {
      limiter.acquire();
    }

    assertEquals(2_000 * MILLI, clock.get());
  }

  @Test
  void burstIsGrantedImmediately() throws InterruptedException {
    TokenBucketRateLimiter limiter = limiter(10, 5);

    for (int i = 0; i < 5; i++) {
      limiter.acquire();
    }
    assertEquals(0, clock.get());

    limiter.acquire();
    assertEquals(100 * MILLI, clock.get());
  }

  @Test
  void idleTimeRefillsUpToBurstOnly() throws InterruptedException {
    TokenBucketRateLimiter limiter = limiter(10, 2);
    limiter.acquire();
    limiter.acquire();

    clock.addAndGet(10_000 * MILLI);
    long before = clock.get();
    limiter.acquire();
    limiter.acquire();
    assertEquals(before, clock.get());

    limiter.acquire();
    assertEquals(before + 100 * MILLI, clock.get());
  }

  @Test
  void grantsNeverExceedBurstPlusRateOverAnyWindow() throws InterruptedException {
    double rate = 20;
    int burst = 3;
    TokenBucketRateLimiter limiter = limiter(rate, burst);
    List<Long> grants = new ArrayList<>();

    for (int i = 0; i < 60; i++) {
      if (i % 17 == 0) {
        clock.addAndGet(130 * MILLI);
      }
      limiter.acquire();
      grants.add(clock.get());
    }

    for (int i = 0; i < grants.size(); i++) {
      for (int j = i; j < grants.size(); j++) {
        double windowSeconds = (grants.get(j) - grants.get(i)) / 1e9;
        int granted = j - i + 1;
        assertTrue(granted <= burst + rate * windowSeconds + 1e-6,
            granted + " grants in " + windowSeconds + "s");
      }
    }
  }

  @Test
  void pauseWithholdsPermitsForEveryone() throws InterruptedException {
    TokenBucketRateLimiter limiter = limiter(10, 2);
    limiter.acquire();

    limiter.pause(Duration.ofSeconds(1));
    assertEquals(1_000 * MILLI, limiter.pauseRemaining());

    limiter.acquire();
    assertEquals(1_000 * MILLI, clock.get());
    assertEquals(0, limiter.pauseRemaining());
  }

  @Test
  void permitsDoNotAccumulateDuringPause() throws InterruptedException {
    TokenBucketRateLimiter limiter = limiter(10, 5);
    for (int i = 0; i < 5; i++) {
      limiter.acquire();
    }

    limiter.pause(Duration.ofSeconds(3));
    limiter.acquire();

    assertEquals(3_100 * MILLI, clock.get());
  }

  @Test
  void overlappingPausesExtendToLatestEnd() {
    TokenBucketRateLimiter limiter = limiter(10, 1);

    limiter.pause(Duration.ofSeconds(2));
    limiter.pause(Duration.ofMillis(500));

    assertEquals(2_000 * MILLI, limiter.pauseRemaining());
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> limiter(0, 1));
    assertThrows(IllegalArgumentException.class, () -> limiter(10, 0));
    assertThrows(IllegalArgumentException.class, () -> limiter(Double.POSITIVE_INFINITY, 1));
  }
}
