/**
 * Micrometer bridge for exporting unit-of-work metrics to Prometheus, Grafana, and other
 * backends.
 *
 * <p>{@link uow.micrometer.MicrometerMetricsExporter} implements the
 * {@link uow.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 *
 * @see uow.micrometer.MicrometerMetricsExporter
 */
package uow.micrometer;
