package raffle;

/**
 * Classification of a failed datastore or validation operation.
 *
 * <p>Callers branch on the kind rather than on exception types: {@link #TRANSIENT} and
 * {@link #RESOURCE_EXHAUSTED} may be retried by the caller, the others may not.
 */
public enum ErrorKind {
  /** Input rejected before or by the datastore (bad field, disallowed transition, unknown id). */
  VALIDATION,
  /** Uniqueness violated (duplicate phone, loyalty card or external id). */
  CONFLICT,
  /** No connection (or write slot) became available within the acquisition timeout. */
  RESOURCE_EXHAUSTED,
  /** Busy or otherwise temporary datastore condition that survived the internal retries. */
  TRANSIENT,
  /** Corruption or schema mismatch; the datastore refuses further writes. */
  FATAL;

  public boolean isRetriable() {
    return this == TRANSIENT || this == RESOURCE_EXHAUSTED;
  }
}
