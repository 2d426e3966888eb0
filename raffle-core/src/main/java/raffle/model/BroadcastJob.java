package raffle.model;

import java.time.Instant;
import java.util.Optional;

/**
 * A stored broadcast job. {@code media} is {@code null} for text-only broadcasts.
 */
public record BroadcastJob(
    String jobId,
    String payload,
    MediaAttachment media,
    JobStatus status,
    int totalRecipients,
    Instant createdAt) {

  public Optional<MediaAttachment> attachment() {
    return Optional.ofNullable(media);
  }
}
