package raffle.model;

import java.time.Instant;

/**
 * A persisted lottery run.
 *
 * @param runId          caller-chosen run identifier
 * @param seed           64-char hex seed published for verification
 * @param requestedCount number of winners requested
 * @param status         run status
 * @param snapshotSize   size of the eligible population the run drew from
 * @param snapshotDigest digest of that population, see {@link ParticipantSnapshot#digest()}
 * @param createdAt      when the run was started
 * @param executedAt     when winners were committed, {@code null} until then
 */
public record LotteryRun(
    String runId,
    String seed,
    int requestedCount,
    RunStatus status,
    int snapshotSize,
    String snapshotDigest,
    Instant createdAt,
    Instant executedAt) {
}
