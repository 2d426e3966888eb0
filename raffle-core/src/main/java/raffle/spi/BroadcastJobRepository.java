package raffle.spi;

import raffle.StoreResult;
import raffle.model.BroadcastJob;
import raffle.model.CancelResult;
import raffle.model.JobProgress;
import raffle.model.JobStatus;
import raffle.model.MediaAttachment;
import raffle.model.RecipientStatus;
import raffle.model.RecipientTask;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for broadcast jobs and their per-recipient delivery state.
 */
public interface BroadcastJobRepository {

  default StoreResult<BroadcastJob> create(String jobId, String payload, List<String> recipients) {
    return create(jobId, payload, null, recipients);
  }

  /**
   * Stores a pending job with its ordered recipients.
   *
   * @param media attachment sent with every message, or {@code null}
   */
  StoreResult<BroadcastJob> create(String jobId, String payload, MediaAttachment media,
      List<String> recipients);

  /**
   * Atomically moves the oldest {@code PENDING} job to {@code SENDING} and returns it.
   */
  StoreResult<Optional<BroadcastJob>> claimNextPending();

  /** Recipients of a job not yet delivered or permanently failed, in list order. */
  StoreResult<List<RecipientTask>> pendingRecipients(String jobId);

  /**
   * Marks a pending recipient delivered.
   *
   * @return {@code false} if the recipient was not pending
   */
  StoreResult<Boolean> markDelivered(String jobId, int position);

  /**
   * Counts one failed attempt; the recipient becomes {@code FAILED} once it reaches
   * {@code maxAttempts}.
   *
   * @return the recipient status after the update
   */
  StoreResult<RecipientStatus> recordFailure(String jobId, int position, String error, int maxAttempts);

  StoreResult<Boolean> isCancelRequested(String jobId);

  StoreResult<CancelResult> requestCancel(String jobId);

  /** Moves a {@code SENDING} job to a terminal status. */
  StoreResult<Boolean> finish(String jobId, JobStatus terminal);

  /** Returns a {@code SENDING} job to {@code PENDING}, keeping delivered recipients. */
  StoreResult<Boolean> release(String jobId);

  StoreResult<Optional<JobProgress>> progress(String jobId);

  /**
   * Returns every job left in {@code SENDING} (by a crash or shutdown) to {@code PENDING}.
   *
   * @return the number of jobs requeued
   */
  StoreResult<Integer> requeueInterrupted();
}
