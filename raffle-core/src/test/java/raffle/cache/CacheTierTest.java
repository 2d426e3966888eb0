package raffle.cache;

import org.junit.jupiter.api.Test;
import raffle.stub.RecordingMetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class CacheTierTest {

  private final AtomicLong ticker = new AtomicLong();
  private final RecordingMetricsExporter metrics = new RecordingMetricsExporter();

  private CacheTier cache() {
    return CacheTier.builder().ticker(ticker::get).metrics(metrics).build();
  }

  @Test
  void secondReadIsServedFromCache() {
    CacheTier cache = cache();
    AtomicInteger loads = new AtomicInteger();

    for (int i = 0; i < 2; i++) {
      assertEquals("v", cache.getOrLoad("k", Tier.HOT, () -> {
        loads.incrementAndGet();
        return "v";
      }));
    }

    assertEquals(1, loads.get());
    assertEquals(1, metrics.cacheHits.get());
    assertEquals(1, metrics.cacheMisses.get());
  }

  @Test
  void concurrentMissesLoadOnce() throws Exception {
    CacheTier cache = cache();
    AtomicInteger loads = new AtomicInteger();
    CountDownLatch loaderStarted = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(10);
    try {
      Future<String> leader = pool.submit(() -> cache.getOrLoad("snapshot", Tier.WARM, () -> {
        loads.incrementAndGet();
        loaderStarted.countDown();
        await(release);
        return "loaded";
      }));
      assertTrue(loaderStarted.await(5, TimeUnit.SECONDS));

      List<Future<String>> waiters = new ArrayList<>();
      for (int i = 0; i < 9; i++) {
        waiters.add(pool.submit(() -> cache.getOrLoad("snapshot", Tier.WARM, () -> {
          loads.incrementAndGet();
          return "other";
        })));
      }
      Thread.sleep(100);
      release.countDown();

      assertEquals("loaded", leader.get(5, TimeUnit.SECONDS));
      for (Future<String> waiter : waiters) {
        assertEquals("loaded", waiter.get(5, TimeUnit.SECONDS));
      }
      assertEquals(1, loads.get());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void waitersObserveLeaderFailure() throws Exception {
    CacheTier cache = cache();
    CountDownLatch loaderStarted = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<Object> leader = pool.submit(() -> cache.getOrLoad("k", Tier.HOT, () -> {
        loaderStarted.countDown();
        await(release);
        throw new IllegalStateException("database busy");
      }));
      assertTrue(loaderStarted.await(5, TimeUnit.SECONDS));
      Future<Object> waiter = pool.submit(() -> cache.getOrLoad("k", Tier.HOT, () -> "unused"));
      Thread.sleep(100);
      release.countDown();

      Exception leaderError = assertThrows(Exception.class, () -> leader.get(5, TimeUnit.SECONDS));
      Exception waiterError = assertThrows(Exception.class, () -> waiter.get(5, TimeUnit.SECONDS));
      assertInstanceOf(IllegalStateException.class, leaderError.getCause());
      assertInstanceOf(IllegalStateException.class, waiterError.getCause());
      assertEquals("database busy", waiterError.getCause().getMessage());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void failedLoadIsNotCached() {
    CacheTier cache = cache();

    assertThrows(IllegalStateException.class, () -> cache.getOrLoad("k", Tier.HOT, () -> {
      throw new IllegalStateException("boom");
    }));
    assertNull(cache.getIfPresent("k", Tier.HOT));
    assertEquals("ok", cache.getOrLoad("k", Tier.HOT, () -> "ok"));
    assertEquals(1, metrics.cacheLoadFailures.get());
  }

  @Test
  void nullValuesAreNotCached() {
    CacheTier cache = cache();
    AtomicInteger loads = new AtomicInteger();

    assertNull(cache.getOrLoad("k", Tier.HOT, () -> {
      loads.incrementAndGet();
      return null;
    }));
    cache.getOrLoad("k", Tier.HOT, () -> {
      loads.incrementAndGet();
      return null;
    });

    assertEquals(2, loads.get());
  }

  @Test
  void entriesExpireAfterTierTtl() {
    CacheTier cache = cache();
    cache.getOrLoad("k", Tier.HOT, () -> "first");

    ticker.addAndGet(Duration.ofSeconds(29).toNanos());
    assertEquals("first", cache.getOrLoad("k", Tier.HOT, () -> "second"));

    ticker.addAndGet(Duration.ofSeconds(2).toNanos());
    assertEquals("second", cache.getOrLoad("k", Tier.HOT, () -> "second"));
  }

  @Test
  void tiersHaveIndependentTtls() {
    CacheTier cache = cache();
    cache.getOrLoad("k", Tier.HOT, () -> "hot");
    cache.getOrLoad("k", Tier.WARM, () -> "warm");

    ticker.addAndGet(Duration.ofMinutes(1).toNanos());

    assertNull(cache.getIfPresent("k", Tier.HOT));
    assertEquals("warm", cache.getIfPresent("k", Tier.WARM));
  }

  @Test
  void invalidateRemovesFromEveryTier() {
    CacheTier cache = cache();
    cache.getOrLoad("k", Tier.HOT, () -> "hot");
    cache.getOrLoad("k", Tier.COLD, () -> "cold");

    cache.invalidate("k");

    assertNull(cache.getIfPresent("k", Tier.HOT));
    assertNull(cache.getIfPresent("k", Tier.COLD));
  }

  @Test
  void invalidateDuringLoadDiscardsStaleValue() throws Exception {
    CacheTier cache = cache();
    CountDownLatch loaderStarted = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      Future<String> stale = pool.submit(() -> cache.getOrLoad("k", Tier.HOT, () -> {
        loaderStarted.countDown();
        await(release);
        return "before-write";
      }));
      assertTrue(loaderStarted.await(5, TimeUnit.SECONDS));

      cache.invalidate("k");
      release.countDown();

      assertEquals("before-write", stale.get(5, TimeUnit.SECONDS));
      assertNull(cache.getIfPresent("k", Tier.HOT));
      assertEquals("after-write", cache.getOrLoad("k", Tier.HOT, () -> "after-write"));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void invalidateDuringLoadKeepsOneLoaderPerKey() throws Exception {
    CacheTier cache = cache();
    AtomicInteger loads = new AtomicInteger();
    CountDownLatch loaderStarted = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<String> leader = pool.submit(() -> cache.getOrLoad("k", Tier.HOT, () -> {
        loads.incrementAndGet();
        loaderStarted.countDown();
        await(release);
        return "before-write";
      }));
      assertTrue(loaderStarted.await(5, TimeUnit.SECONDS));

      cache.invalidate("k");
      Future<String> joiner = pool.submit(() -> cache.getOrLoad("k", Tier.HOT, () -> {
        loads.incrementAndGet();
        return "second-loader";
      }));
      Thread.sleep(100);
      release.countDown();

      assertEquals("before-write", leader.get(5, TimeUnit.SECONDS));
      assertEquals("before-write", joiner.get(5, TimeUnit.SECONDS));
      assertEquals(1, loads.get());
      assertNull(cache.getIfPresent("k", Tier.HOT));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void sizeBoundIsEnforced() {
    CacheTier cache = CacheTier.builder().tier(Tier.HOT, Duration.ofMinutes(1), 10).build();

    for (int i = 0; i < 100; i++) {
      int n = i;
      cache.getOrLoad("k" + i, Tier.HOT, () -> n);
    }

    assertTrue(cache.estimatedSize(Tier.HOT) <= 10, "size " + cache.estimatedSize(Tier.HOT));
  }

  @Test
  void slowLeaderTimesOutWaiters() throws Exception {
    CacheTier cache = CacheTier.builder().singleFlightTimeout(Duration.ofMillis(100)).build();
    CountDownLatch loaderStarted = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      pool.submit(() -> cache.getOrLoad("k", Tier.HOT, () -> {
        loaderStarted.countDown();
        await(release);
        return "late";
      }));
      assertTrue(loaderStarted.await(5, TimeUnit.SECONDS));

      assertThrows(SingleFlightTimeoutException.class,
          () -> cache.getOrLoad("k", Tier.HOT, () -> "unused"));
    } finally {
      release.countDown();
      pool.shutdownNow();
    }
  }

  @Test
  void rejectsInvalidTierSettings() {
    assertThrows(IllegalArgumentException.class,
        () -> CacheTier.builder().tier(Tier.HOT, Duration.ZERO, 10).build());
    assertThrows(IllegalArgumentException.class,
        () -> CacheTier.builder().tier(Tier.HOT, Duration.ofSeconds(1), 0).build());
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
