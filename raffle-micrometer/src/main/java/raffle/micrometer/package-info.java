/**
 * Micrometer bridge for exporting raffle metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link raffle.micrometer.MicrometerMetricsExporter} implements the
 * {@link raffle.spi.MetricsExporter} SPI using Micrometer counters.
 *
 * @see raffle.micrometer.MicrometerMetricsExporter
 */
package raffle.micrometer;
