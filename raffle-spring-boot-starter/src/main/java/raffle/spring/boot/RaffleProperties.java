package raffle.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the raffle core.
 *
 * @see RaffleAutoConfiguration
 */
@ConfigurationProperties(prefix = "raffle")
public class RaffleProperties {

    private final Database database = new Database();
    private final Cache cache = new Cache();
    private final Broadcast broadcast = new Broadcast();
    private final RegistrationState registrationState = new RegistrationState();
    private final Metrics metrics = new Metrics();

    public Database getDatabase() {
        return database;
    }

    public Cache getCache() {
        return cache;
    }

    public Broadcast getBroadcast() {
        return broadcast;
    }

    public RegistrationState getRegistrationState() {
        return registrationState;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Database {
        /**
         * JDBC URL of the H2 database. Takes precedence over {@code path}.
         */
        private String url;

        /**
         * Path of an H2 database file, used when no URL is set.
         */
        private String path;

        private String username = "sa";
        private String password = "";
        private int poolSize = 20;
        private Duration acquireTimeout = Duration.ofSeconds(10);

        /**
         * How long a statement waits on a row lock before the database reports busy.
         */
        private Duration busyTimeout = Duration.ofSeconds(5);

        private int busyRetryAttempts = 3;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public Duration getAcquireTimeout() {
            return acquireTimeout;
        }

        public void setAcquireTimeout(Duration acquireTimeout) {
            this.acquireTimeout = acquireTimeout;
        }

        public Duration getBusyTimeout() {
            return busyTimeout;
        }

        public void setBusyTimeout(Duration busyTimeout) {
            this.busyTimeout = busyTimeout;
        }

        public int getBusyRetryAttempts() {
            return busyRetryAttempts;
        }

        public void setBusyRetryAttempts(int busyRetryAttempts) {
            this.busyRetryAttempts = busyRetryAttempts;
        }
    }

    public static class Cache {
        private final TierSettings hot = new TierSettings(Duration.ofSeconds(30), 1000);
        private final TierSettings warm = new TierSettings(Duration.ofMinutes(5), 500);
        private final TierSettings cold = new TierSettings(Duration.ofHours(1), 200);

        /**
         * How long a caller waits for another caller's in-flight load of the same key.
         */
        private Duration singleFlightTimeout = Duration.ofSeconds(5);

        public TierSettings getHot() {
            return hot;
        }

        public TierSettings getWarm() {
            return warm;
        }

        public TierSettings getCold() {
            return cold;
        }

        public Duration getSingleFlightTimeout() {
            return singleFlightTimeout;
        }

        public void setSingleFlightTimeout(Duration singleFlightTimeout) {
            this.singleFlightTimeout = singleFlightTimeout;
        }
    }

    public static class TierSettings {
        private Duration ttl;
        private long maxSize;

        public TierSettings() {
        }

        TierSettings(Duration ttl, long maxSize) {
            this.ttl = ttl;
            this.maxSize = maxSize;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public long getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(long maxSize) {
            this.maxSize = maxSize;
        }
    }

    public static class Broadcast {
        private int batchSize = 30;
        private double permitsPerSecond = 30.0;
        private int burst = 1;
        private int maxAttempts = 3;
        private long retryBaseDelayMs = 1000;
        private long retryMaxDelayMs = 8000;
        private long throttleCooldownMs = 1000;
        private int workerCount = 2;
        private long pollIntervalMs = 1000;
        private long drainTimeoutMs = 5000;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public double getPermitsPerSecond() {
            return permitsPerSecond;
        }

        public void setPermitsPerSecond(double permitsPerSecond) {
            this.permitsPerSecond = permitsPerSecond;
        }

        public int getBurst() {
            return burst;
        }

        public void setBurst(int burst) {
            this.burst = burst;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getRetryBaseDelayMs() {
            return retryBaseDelayMs;
        }

        public void setRetryBaseDelayMs(long retryBaseDelayMs) {
            this.retryBaseDelayMs = retryBaseDelayMs;
        }

        public long getRetryMaxDelayMs() {
            return retryMaxDelayMs;
        }

        public void setRetryMaxDelayMs(long retryMaxDelayMs) {
            this.retryMaxDelayMs = retryMaxDelayMs;
        }

        public long getThrottleCooldownMs() {
            return throttleCooldownMs;
        }

        public void setThrottleCooldownMs(long throttleCooldownMs) {
            this.throttleCooldownMs = throttleCooldownMs;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class RegistrationState {
        /**
         * Saved registration progress older than this is discarded on load.
         */
        private Duration maxAge = Duration.ofHours(24);

        public Duration getMaxAge() {
            return maxAge;
        }

        public void setMaxAge(Duration maxAge) {
            this.maxAge = maxAge;
        }
    }

    public static class Metrics {
        /**
         * Whether to register Micrometer counters when a MeterRegistry is present.
         */
        private boolean enabled = true;

        /**
         * Prefix for all meter names.
         */
        private String namePrefix = "raffle";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
