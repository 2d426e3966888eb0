package raffle.model;

/**
 * Result of a cancellation request on a broadcast job.
 */
public enum CancelResult {
  /** The job had not started and is now cancelled. */
  CANCELLED,
  /** The job is sending; it stops at the next batch boundary. */
  REQUESTED,
  /** The job had already finished. */
  ALREADY_TERMINAL,
  NOT_FOUND
}
