package raffle.model;

import java.util.Objects;

/**
 * A file sent with a broadcast message.
 *
 * @param reference where the channel finds the file (a path, URL or transport file id)
 * @param type      how the channel should present it
 * @param caption   text shown with the media, or {@code null} to use the message body
 */
public record MediaAttachment(String reference, MediaType type, String caption) {

  /** Longest caption most transports accept alongside media. */
  public static final int MAX_CAPTION_LENGTH = 1024;

  public MediaAttachment {
    Objects.requireNonNull(type, "type");
    if (reference == null || reference.isBlank()) {
      throw new IllegalArgumentException("reference must not be blank");
    }
  }

  public static MediaAttachment of(String reference, MediaType type) {
    return new MediaAttachment(reference, type, null);
  }

  /**
   * @return the caption, or {@code message} when no caption was given
   */
  public String captionOr(String message) {
    return caption != null && !caption.isBlank() ? caption : message;
  }
}
