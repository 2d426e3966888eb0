package raffle.model;

/**
 * Result of registering the start of a run.
 */
public enum BeginResult {
  /** The run marker was created (or a failed run re-armed); the caller owns the run. */
  STARTED,
  /** Another execution holds the run. */
  RUNNING,
  /** The run already has committed winners. */
  COMPLETED
}
