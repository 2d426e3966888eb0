package raffle.jdbc;

import raffle.model.ParticipantRecord;

import java.time.Duration;
import java.util.UUID;

/**
 * Private in-memory databases for tests.
 */
final class TestDatabases {

  static PoolSettings.Builder memory(int poolSize) {
    return PoolSettings.builder()
        .jdbcUrl("jdbc:h2:mem:raffle_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
        .poolSize(poolSize)
        .acquireTimeout(Duration.ofSeconds(2))
        .busyTimeout(Duration.ofMillis(500))
        .busyRetryBackoff(Duration.ofMillis(1), Duration.ofMillis(5));
  }

  static PoolSettings memory() {
    return memory(5).build();
  }

  /** A record passing every field rule, unique per {@code n}. */
  static ParticipantRecord record(long n) {
    return new ParticipantRecord(n, "Anna Ivanova", String.format("+7900%07d", n),
        String.format("LC%06d", n), "photo/" + n + ".jpg");
  }

  private TestDatabases() {}
}
