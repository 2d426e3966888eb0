package raffle.spi;

import raffle.StoreResult;
import raffle.model.RegistrationState;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable storage for in-progress registrations.
 */
public interface RegistrationStateRepository {

  StoreResult<RegistrationState> save(long externalId, String payload);

  /**
   * Loads the saved state. Entries older than the configured maximum age are deleted and
   * reported as absent.
   */
  StoreResult<Optional<RegistrationState>> load(long externalId);

  StoreResult<Boolean> clear(long externalId);

  StoreResult<Integer> evictStale(Duration maxAge);
}
