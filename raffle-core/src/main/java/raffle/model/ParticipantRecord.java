package raffle.model;

/**
 * Registration data submitted for a participant, before it is stored.
 *
 * @param externalId  the messaging-platform user id
 * @param fullName    full name as in the identity document
 * @param phone       phone number, unique across participants
 * @param loyaltyCard loyalty card number, unique across participants
 * @param photoRef    reference to the uploaded receipt photo, may be {@code null}
 */
public record ParticipantRecord(
    long externalId,
    String fullName,
    String phone,
    String loyaltyCard,
    String photoRef) {
}
