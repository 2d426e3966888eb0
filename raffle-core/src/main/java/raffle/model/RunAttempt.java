package raffle.model;

import java.time.Instant;

/**
 * One execution of a lottery run. A run that failed and was started again has several attempts,
 * each with its own seed; the run row itself only shows the latest.
 *
 * @param attempt       1-based attempt number
 * @param outcome       {@code RUNNING} until the attempt completes or fails
 * @param failureReason why the attempt failed, {@code null} otherwise
 * @param finishedAt    when the attempt completed or failed, {@code null} while running
 */
public record RunAttempt(
    String runId,
    int attempt,
    String seed,
    int requestedCount,
    int snapshotSize,
    String snapshotDigest,
    RunStatus outcome,
    String failureReason,
    Instant startedAt,
    Instant finishedAt) {
}
