package raffle.jdbc;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings for a {@link ConnectionPool}.
 *
 * <pre>{@code
 * PoolSettings settings = PoolSettings.builder()
 *     .databaseFile(Path.of("data/raffle"))
 *     .poolSize(20)
 *     .acquireTimeout(Duration.ofSeconds(10))
 *     .build();
 * }</pre>
 */
public final class PoolSettings {
  private final String jdbcUrl;
  private final String username;
  private final String password;
  private final String poolName;
  private final int poolSize;
  private final Duration acquireTimeout;
  private final Duration busyTimeout;
  private final int busyRetryAttempts;
  private final Duration busyRetryBaseDelay;
  private final Duration busyRetryMaxDelay;

  private PoolSettings(Builder builder) {
    this.jdbcUrl = builder.jdbcUrl;
    this.username = builder.username;
    this.password = builder.password;
    this.poolName = builder.poolName;
    this.poolSize = builder.poolSize;
    this.acquireTimeout = builder.acquireTimeout;
    this.busyTimeout = builder.busyTimeout;
    this.busyRetryAttempts = builder.busyRetryAttempts;
    this.busyRetryBaseDelay = builder.busyRetryBaseDelay;
    this.busyRetryMaxDelay = builder.busyRetryMaxDelay;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** H2 URL of an embedded database stored at {@code path} (H2 appends {@code .mv.db}). */
  public static String fileUrl(Path path) {
    return "jdbc:h2:file:" + path.toAbsolutePath();
  }

  public String jdbcUrl() {
    return jdbcUrl;
  }

  public String username() {
    return username;
  }

  public String password() {
    return password;
  }

  public String poolName() {
    return poolName;
  }

  public int poolSize() {
    return poolSize;
  }

  public Duration acquireTimeout() {
    return acquireTimeout;
  }

  /** How long a statement waits on a row or table lock before failing as busy. */
  public Duration busyTimeout() {
    return busyTimeout;
  }

  public int busyRetryAttempts() {
    return busyRetryAttempts;
  }

  public Duration busyRetryBaseDelay() {
    return busyRetryBaseDelay;
  }

  public Duration busyRetryMaxDelay() {
    return busyRetryMaxDelay;
  }

  @Override
  public String toString() {
    return "PoolSettings{url=" + jdbcUrl + ", poolSize=" + poolSize
        + ", acquireTimeout=" + acquireTimeout + ", busyTimeout=" + busyTimeout
        + ", busyRetryAttempts=" + busyRetryAttempts + "}";
  }

  /** Builder for {@link PoolSettings}. */
  public static final class Builder {
    private String jdbcUrl;
    private String username = "sa";
    private String password = "";
    private String poolName = "raffle-pool";
    private int poolSize = 20;
    private Duration acquireTimeout = Duration.ofSeconds(10);
    private Duration busyTimeout = Duration.ofSeconds(5);
    private int busyRetryAttempts = 3;
    private Duration busyRetryBaseDelay = Duration.ofMillis(50);
    private Duration busyRetryMaxDelay = Duration.ofSeconds(1);

    private Builder() {}

    /** Required, unless {@link #databaseFile(Path)} is used. */
    public Builder jdbcUrl(String jdbcUrl) {
      this.jdbcUrl = jdbcUrl;
      return this;
    }

    public Builder databaseFile(Path path) {
      this.jdbcUrl = fileUrl(Objects.requireNonNull(path, "path"));
      return this;
    }

    public Builder username(String username) {
      this.username = Objects.requireNonNull(username, "username");
      return this;
    }

    public Builder password(String password) {
      this.password = Objects.requireNonNull(password, "password");
      return this;
    }

    public Builder poolName(String poolName) {
      this.poolName = Objects.requireNonNull(poolName, "poolName");
      return this;
    }

    /** Number of connections opened eagerly and kept. Defaults to 20. */
    public Builder poolSize(int poolSize) {
      this.poolSize = poolSize;
      return this;
    }

    /** Upper bound on each wait for a connection or the write gate. Defaults to 10 seconds. */
    public Builder acquireTimeout(Duration acquireTimeout) {
      this.acquireTimeout = Objects.requireNonNull(acquireTimeout, "acquireTimeout");
      return this;
    }

    /** Lock wait before a statement fails as busy. Defaults to 5 seconds. */
    public Builder busyTimeout(Duration busyTimeout) {
      this.busyTimeout = Objects.requireNonNull(busyTimeout, "busyTimeout");
      return this;
    }

    /** Internal retries of a busy unit of work. Defaults to 3. */
    public Builder busyRetryAttempts(int busyRetryAttempts) {
      this.busyRetryAttempts = busyRetryAttempts;
      return this;
    }

    public Builder busyRetryBackoff(Duration baseDelay, Duration maxDelay) {
      this.busyRetryBaseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
      this.busyRetryMaxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
      return this;
    }

    public PoolSettings build() {
      if (jdbcUrl == null || jdbcUrl.isBlank()) {
        throw new IllegalArgumentException("jdbcUrl must not be empty");
      }
      if (poolSize <= 0) {
        throw new IllegalArgumentException("poolSize must be > 0, got: " + poolSize);
      }
      if (acquireTimeout.toMillis() < 250) {
        throw new IllegalArgumentException(
            "acquireTimeout must be >= 250ms, got: " + acquireTimeout);
      }
      if (busyTimeout.isNegative()) {
        throw new IllegalArgumentException("busyTimeout must be >= 0, got: " + busyTimeout);
      }
      if (busyRetryAttempts < 0) {
        throw new IllegalArgumentException(
            "busyRetryAttempts must be >= 0, got: " + busyRetryAttempts);
      }
      if (busyRetryBaseDelay.toMillis() <= 0
          || busyRetryMaxDelay.compareTo(busyRetryBaseDelay) < 0) {
        throw new IllegalArgumentException("busy retry backoff must satisfy 0 < base <= max, got: "
            + busyRetryBaseDelay + ", " + busyRetryMaxDelay);
      }
      return new PoolSettings(this);
    }
  }
}
