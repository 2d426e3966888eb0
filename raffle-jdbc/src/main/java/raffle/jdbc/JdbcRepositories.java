package raffle.jdbc;

import raffle.event.EventDispatcher;
import raffle.spi.InvalidationHook;
import raffle.spi.Repositories;

import java.time.Clock;
import java.time.Duration;

/**
 * Factory for the JDBC implementations of every repository over one pool.
 */
public final class JdbcRepositories {

  public static Repositories create(ConnectionPool pool, InvalidationHook invalidation,
      EventDispatcher events, Clock clock, Duration registrationStateMaxAge) {
    return new Repositories(
        new JdbcParticipantRepository(pool, invalidation, events, clock),
        new JdbcLotteryRunRepository(pool, invalidation, clock),
        new JdbcBroadcastJobRepository(pool, invalidation, clock),
        new JdbcRegistrationStateRepository(pool, clock, registrationStateMaxAge),
        new JdbcFraudLogRepository(pool, clock));
  }

  private JdbcRepositories() {}
}
