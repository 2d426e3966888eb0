package raffle.model;

import raffle.fraud.Verdict;

import java.time.Instant;
import java.util.List;

/**
 * Audit row written for a scored registration.
 */
public record FraudLogEntry(
    long id,
    long externalId,
    double score,
    Verdict verdict,
    List<String> reasons,
    Instant detectedAt) {
}
