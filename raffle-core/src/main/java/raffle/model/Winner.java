package raffle.model;

/**
 * One selected winner of a run. Positions are 1-based in selection order.
 */
public record Winner(
    String runId,
    long participantId,
    int position,
    String prizeDescription,
    boolean claimed) {
}
