/**
 * Heuristic abuse screening for registrations. {@link raffle.fraud.FraudScorer} has no I/O;
 * persisting scores is left to {@link raffle.spi.FraudLogRepository}.
 */
package raffle.fraud;
