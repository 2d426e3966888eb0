package raffle.spi;

import raffle.model.MediaAttachment;

/**
 * Outbound messaging capability used by the broadcast queue.
 *
 * <p>Implementations report failures as {@link DeliveryOutcome} values. A
 * {@link RuntimeException} thrown from {@link #send} is treated as
 * {@link DeliveryOutcome.Failed}.
 */
@FunctionalInterface
public interface DeliveryChannel {

  DeliveryOutcome send(String recipient, String message);

  /**
   * Sends a message with an attached file. Channels without media support inherit this default,
   * which sends the caption (or the message when there is none) as plain text.
   */
  default DeliveryOutcome send(String recipient, String message, MediaAttachment media) {
    return send(recipient, media.captionOr(message));
  }
}
