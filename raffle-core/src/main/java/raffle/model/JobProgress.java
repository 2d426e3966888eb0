package raffle.model;

/**
 * Progress snapshot of a broadcast job.
 */
public record JobProgress(
    String jobId,
    JobStatus status,
    int total,
    int delivered,
    int failed,
    int pending,
    boolean cancelRequested) {
}
