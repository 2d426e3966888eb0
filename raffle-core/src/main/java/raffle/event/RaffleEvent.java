package raffle.event;

import raffle.fraud.FraudScore;
import raffle.model.JobStatus;
import raffle.model.ParticipantStatus;
import raffle.model.Winner;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One-way notification emitted by a component after a state change has committed.
 *
 * <p>Variants:
 * <ul>
 *   <li>{@link DrawCompleted}: a run committed its winners</li>
 *   <li>{@link ParticipantStatusChanged}: a moderator moved a participant</li>
 *   <li>{@link BroadcastFinished}: a broadcast job reached a terminal status</li>
 *   <li>{@link RegistrationScored}: a registration was scored for fraud</li>
 * </ul>
 */
public sealed interface RaffleEvent {

  EventType type();

  Instant occurredAt();

  record DrawCompleted(String runId, String seed, List<Winner> winners, Instant occurredAt)
      implements RaffleEvent {
    public DrawCompleted {
      Objects.requireNonNull(runId, "runId");
      winners = List.copyOf(winners);
    }

    @Override
    public EventType type() {
      return EventType.DRAW_COMPLETED;
    }
  }

  record ParticipantStatusChanged(long externalId, ParticipantStatus from, ParticipantStatus to,
      String note, Instant occurredAt) implements RaffleEvent {
    @Override
    public EventType type() {
      return EventType.PARTICIPANT_STATUS_CHANGED;
    }
  }

  record BroadcastFinished(String jobId, JobStatus status, int delivered, int failed,
      Instant occurredAt) implements RaffleEvent {
    @Override
    public EventType type() {
      return EventType.BROADCAST_FINISHED;
    }
  }

  record RegistrationScored(long externalId, FraudScore score, Instant occurredAt)
      implements RaffleEvent {
    @Override
    public EventType type() {
      return EventType.REGISTRATION_SCORED;
    }
  }
}
