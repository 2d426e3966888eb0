package raffle.event;

/**
 * Key of each {@link RaffleEvent} variant in the dispatch table.
 */
public enum EventType {
  DRAW_COMPLETED,
  PARTICIPANT_STATUS_CHANGED,
  BROADCAST_FINISHED,
  REGISTRATION_SCORED
}
