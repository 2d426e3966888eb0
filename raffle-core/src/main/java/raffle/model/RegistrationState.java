package raffle.model;

import java.time.Instant;

/**
 * Persisted in-progress registration of a user, so a restart does not lose it.
 *
 * @param externalId the messaging-platform user id
 * @param payload    opaque serialized dialogue state owned by the caller
 * @param updatedAt  last time the state was saved
 */
public record RegistrationState(long externalId, String payload, Instant updatedAt) {
}
