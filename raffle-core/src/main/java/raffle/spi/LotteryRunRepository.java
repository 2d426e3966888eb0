package raffle.spi;

import raffle.StoreResult;
import raffle.model.BeginResult;
import raffle.model.LotteryRun;
import raffle.model.ParticipantSnapshot;
import raffle.model.RunAttempt;
import raffle.model.Winner;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for lottery runs and their winners.
 */
public interface LotteryRunRepository {

  /**
   * Records the start of a run with its seed and the population it draws from. At most one
   * caller gets {@link BeginResult#STARTED} for a run id; a failed run may be started again.
   * Every start appends a {@link RunAttempt}, so earlier seeds stay on record.
   */
  StoreResult<BeginResult> begin(String runId, String seed, int requestedCount, ParticipantSnapshot snapshot);

  /**
   * Stores the winners and marks the run completed in one transaction.
   *
   * @return the number of winners stored
   */
  StoreResult<Integer> complete(String runId, List<Winner> winners);

  StoreResult<Boolean> markFailed(String runId, String reason);

  /**
   * Marks every {@code RUNNING} run failed. Called at startup: a run still running then was
   * interrupted by a crash and would otherwise block its run id forever. Seeds are kept.
   *
   * @return the number of runs failed
   */
  StoreResult<Integer> failInterrupted();

  /** Every attempt of a run, oldest first; empty for an unknown run. */
  StoreResult<List<RunAttempt>> attempts(String runId);

  StoreResult<Optional<LotteryRun>> find(String runId);

  /** Winners of a run ordered by position. */
  StoreResult<List<Winner>> winners(String runId);

  /** Most recent runs first. */
  StoreResult<List<LotteryRun>> recent(int limit);

  /**
   * Flags a winner's prize as claimed.
   *
   * @return {@code false} if the prize was already claimed or the winner does not exist
   */
  StoreResult<Boolean> markClaimed(String runId, long participantId);
}
