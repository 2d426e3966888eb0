package raffle;

public final class RaffleConfig {
  private int broadcastBatchSize = 30;
  private double broadcastPermitsPerSecond = 30.0;
  private int broadcastBurst = 1;
  private int broadcastMaxAttempts = 3;
  private long broadcastRetryBaseDelayMs = 1000L;
  private long broadcastRetryMaxDelayMs = 8000L;
  private long broadcastThrottleCooldownMs = 1000L;
  private int broadcastWorkers = 2;
  private long broadcastPollIntervalMs = 1000L;
  private long broadcastDrainTimeoutMs = 5000L;

  private long cacheHotTtlSeconds = 30L;
  private long cacheHotMaxSize = 1000L;
  private long cacheWarmTtlSeconds = 300L;
  private long cacheWarmMaxSize = 500L;
  private long cacheColdTtlSeconds = 3600L;
  private long cacheColdMaxSize = 200L;
  private long cacheSingleFlightTimeoutMs = 5000L;

  public int getBroadcastBatchSize() {
    return broadcastBatchSize;
  }

  public RaffleConfig setBroadcastBatchSize(int broadcastBatchSize) {
    this.broadcastBatchSize = broadcastBatchSize;
    return this;
  }

  public double getBroadcastPermitsPerSecond() {
    return broadcastPermitsPerSecond;
  }

  public RaffleConfig setBroadcastPermitsPerSecond(double broadcastPermitsPerSecond) {
    this.broadcastPermitsPerSecond = broadcastPermitsPerSecond;
    return this;
  }

  public int getBroadcastBurst() {
    return broadcastBurst;
  }

  public RaffleConfig setBroadcastBurst(int broadcastBurst) {
    this.broadcastBurst = broadcastBurst;
    return this;
  }

  public int getBroadcastMaxAttempts() {
    return broadcastMaxAttempts;
  }

  public RaffleConfig setBroadcastMaxAttempts(int broadcastMaxAttempts) {
    this.broadcastMaxAttempts = broadcastMaxAttempts;
    return this;
  }

  public long getBroadcastRetryBaseDelayMs() {
    return broadcastRetryBaseDelayMs;
  }

  public RaffleConfig setBroadcastRetryBaseDelayMs(long broadcastRetryBaseDelayMs) {
    this.broadcastRetryBaseDelayMs = broadcastRetryBaseDelayMs;
    return this;
  }

  public long getBroadcastRetryMaxDelayMs() {
    return broadcastRetryMaxDelayMs;
  }

  public RaffleConfig setBroadcastRetryMaxDelayMs(long broadcastRetryMaxDelayMs) {
    this.broadcastRetryMaxDelayMs = broadcastRetryMaxDelayMs;
    return this;
  }

  public long getBroadcastThrottleCooldownMs() {
    return broadcastThrottleCooldownMs;
  }

  public RaffleConfig setBroadcastThrottleCooldownMs(long broadcastThrottleCooldownMs) {
    this.broadcastThrottleCooldownMs = broadcastThrottleCooldownMs;
    return this;
  }

  public int getBroadcastWorkers() {
    return broadcastWorkers;
  }

  public RaffleConfig setBroadcastWorkers(int broadcastWorkers) {
    this.broadcastWorkers = broadcastWorkers;
    return this;
  }

  public long getBroadcastPollIntervalMs() {
    return broadcastPollIntervalMs;
  }

  public RaffleConfig setBroadcastPollIntervalMs(long broadcastPollIntervalMs) {
    this.broadcastPollIntervalMs = broadcastPollIntervalMs;
    return this;
  }

  public long getBroadcastDrainTimeoutMs() {
    return broadcastDrainTimeoutMs;
  }

  public RaffleConfig setBroadcastDrainTimeoutMs(long broadcastDrainTimeoutMs) {
    this.broadcastDrainTimeoutMs = broadcastDrainTimeoutMs;
    return this;
  }

  public long getCacheHotTtlSeconds() {
    return cacheHotTtlSeconds;
  }

  public RaffleConfig setCacheHotTtlSeconds(long cacheHotTtlSeconds) {
    this.cacheHotTtlSeconds = cacheHotTtlSeconds;
    return this;
  }

  public long getCacheHotMaxSize() {
    return cacheHotMaxSize;
  }

  public RaffleConfig setCacheHotMaxSize(long cacheHotMaxSize) {
    this.cacheHotMaxSize = cacheHotMaxSize;
    return this;
  }

  public long getCacheWarmTtlSeconds() {
    return cacheWarmTtlSeconds;
  }

  public RaffleConfig setCacheWarmTtlSeconds(long cacheWarmTtlSeconds) {
    this.cacheWarmTtlSeconds = cacheWarmTtlSeconds;
    return this;
  }

  public long getCacheWarmMaxSize() {
    return cacheWarmMaxSize;
  }

  public RaffleConfig setCacheWarmMaxSize(long cacheWarmMaxSize) {
    this.cacheWarmMaxSize = cacheWarmMaxSize;
    return this;
  }

  public long getCacheColdTtlSeconds() {
    return cacheColdTtlSeconds;
  }

  public RaffleConfig setCacheColdTtlSeconds(long cacheColdTtlSeconds) {
    this.cacheColdTtlSeconds = cacheColdTtlSeconds;
    return this;
  }

  public long getCacheColdMaxSize() {
    return cacheColdMaxSize;
  }

  public RaffleConfig setCacheColdMaxSize(long cacheColdMaxSize) {
    this.cacheColdMaxSize = cacheColdMaxSize;
    return this;
  }

  public long getCacheSingleFlightTimeoutMs() {
    return cacheSingleFlightTimeoutMs;
  }

  public RaffleConfig setCacheSingleFlightTimeoutMs(long cacheSingleFlightTimeoutMs) {
    this.cacheSingleFlightTimeoutMs = cacheSingleFlightTimeoutMs;
    return this;
  }
}
