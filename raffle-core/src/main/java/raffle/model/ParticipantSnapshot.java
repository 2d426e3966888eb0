package raffle.model;

import raffle.util.Hashing;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered list of approved participant ids taken at a single point in time.
 *
 * <p>Later approvals or rejections never change an existing snapshot. The {@link #digest()}
 * identifies the exact population a draw ran against.
 */
public final class ParticipantSnapshot {
  private final List<Long> participantIds;
  private final Instant takenAt;

  public ParticipantSnapshot(List<Long> participantIds, Instant takenAt) {
    this.participantIds = List.copyOf(participantIds);
    this.takenAt = Objects.requireNonNull(takenAt, "takenAt");
  }

  public List<Long> participantIds() {
    return participantIds;
  }

  public Instant takenAt() {
    return takenAt;
  }

  public int size() {
    return participantIds.size();
  }

  public boolean isEmpty() {
    return participantIds.isEmpty();
  }

  /**
   * SHA-256 over the comma-joined ids in snapshot order, as lower-case hex.
   */
  public String digest() {
    StringBuilder sb = new StringBuilder(participantIds.size() * 8);
    for (int i = 0; i < participantIds.size(); i++) {
      if (i > 0) sb.append(',');
      sb.append(participantIds.get(i));
    }
    return Hashing.sha256Hex(sb.toString());
  }

  @Override
  public String toString() {
    return "ParticipantSnapshot{size=" + participantIds.size() + ", takenAt=" + takenAt + "}";
  }
}
