package raffle.model;

import java.time.Instant;

/**
 * A stored participant row.
 */
public record Participant(
    long id,
    long externalId,
    String fullName,
    String phone,
    String loyaltyCard,
    String photoRef,
    ParticipantStatus status,
    String adminNote,
    Instant createdAt,
    Instant updatedAt) {
}
