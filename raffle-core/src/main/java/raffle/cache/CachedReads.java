package raffle.cache;

import raffle.StoreException;
import raffle.StoreResult;
import raffle.model.JobProgress;
import raffle.model.LotteryRun;
import raffle.model.ParticipantSnapshot;
import raffle.model.ParticipantStatus;
import raffle.spi.BroadcastJobRepository;
import raffle.spi.CacheKeys;
import raffle.spi.LotteryRunRepository;
import raffle.spi.ParticipantRepository;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Repository reads served through a {@link CacheTier}.
 *
 * <p>Failed results are returned to the caller and never cached; the next call reloads.
 */
public final class CachedReads {
  /** Number of runs kept under {@link CacheKeys#RECENT_RUNS}. */
  public static final int RECENT_RUNS_LIMIT = 50;

  private final CacheTier cache;
  private final ParticipantRepository participants;
  private final LotteryRunRepository runs;
  private final BroadcastJobRepository broadcasts;

  public CachedReads(CacheTier cache, ParticipantRepository participants,
      LotteryRunRepository runs, BroadcastJobRepository broadcasts) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.participants = Objects.requireNonNull(participants, "participants");
    this.runs = Objects.requireNonNull(runs, "runs");
    this.broadcasts = Objects.requireNonNull(broadcasts, "broadcasts");
  }

  public StoreResult<Optional<ParticipantStatus>> participantStatus(long externalId) {
    return load(CacheKeys.participantStatus(externalId), Tier.HOT,
        () -> participants.getStatus(externalId));
  }

  public StoreResult<ParticipantSnapshot> approvedSnapshot() {
    return load(CacheKeys.APPROVED_SNAPSHOT, Tier.WARM, participants::getApprovedSnapshot);
  }

  public StoreResult<Map<ParticipantStatus, Integer>> statusCounts() {
    return load(CacheKeys.STATUS_COUNTS, Tier.WARM, participants::countByStatus);
  }

  public StoreResult<List<LotteryRun>> recentRuns() {
    return load(CacheKeys.RECENT_RUNS, Tier.WARM, () -> runs.recent(RECENT_RUNS_LIMIT));
  }

  public StoreResult<Optional<JobProgress>> broadcastProgress(String jobId) {
    return load(CacheKeys.broadcastProgress(jobId), Tier.HOT, () -> broadcasts.progress(jobId));
  }

  private <T> StoreResult<T> load(String key, Tier tier, Supplier<StoreResult<T>> loader) {
    try {
      T value = cache.getOrLoad(key, tier, () -> loader.get().orElseThrow());
      return StoreResult.ok(value);
    } catch (StoreException e) {
      return StoreResult.failure(e.error());
    }
  }
}
