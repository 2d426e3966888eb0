package raffle.spi;

/**
 * Observability hook for exporting raffle counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of draws that committed winners.
     */
    void incrementDrawCompleted();

    /**
     * Increments the count of draw requests refused because the run was already running
     * or completed.
     */
    void incrementDrawRejected();

    /**
     * Increments the count of recipients delivered successfully.
     */
    void incrementDeliverySuccess();

    /**
     * Increments the count of failed send attempts that will be retried.
     */
    void incrementDeliveryRetry();

    /**
     * Increments the count of recipients that exhausted their attempts.
     */
    void incrementDeliveryFailed();

    /**
     * Increments the count of throttle signals received from the delivery channel.
     */
    void incrementDeliveryThrottled();

    /**
     * Increments the count of broadcast jobs reaching a terminal status.
     */
    default void incrementBroadcastFinished() {
    }

    /**
     * Increments the count of cache hits in the named tier.
     *
     * @param tier lower-case tier name
     */
    default void incrementCacheHit(String tier) {
    }

    /**
     * Increments the count of cache misses in the named tier.
     *
     * @param tier lower-case tier name
     */
    default void incrementCacheMiss(String tier) {
    }

    /**
     * Increments the count of cache loads that failed.
     */
    default void incrementCacheLoadFailure() {
    }

    /**
     * Increments the count of attempts retried because the datastore was busy.
     */
    default void incrementBusyRetry() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDrawCompleted() {
        }

        @Override
        public void incrementDrawRejected() {
        }

        @Override
        public void incrementDeliverySuccess() {
        }

        @Override
        public void incrementDeliveryRetry() {
        }

        @Override
        public void incrementDeliveryFailed() {
        }

        @Override
        public void incrementDeliveryThrottled() {
        }
    }
}
