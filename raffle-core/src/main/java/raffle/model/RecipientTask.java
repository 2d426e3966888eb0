package raffle.model;

/**
 * A recipient still awaiting delivery.
 *
 * @param position  index of the recipient in the job's original list
 * @param recipient the recipient address
 * @param attempts  failed attempts recorded so far
 */
public record RecipientTask(int position, String recipient, int attempts) {
}
