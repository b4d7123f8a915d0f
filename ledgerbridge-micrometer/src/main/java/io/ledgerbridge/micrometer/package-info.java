/**
 * Micrometer bridge for exporting bridge counters to Prometheus, Grafana and other backends.
 *
 * <p>{@link io.ledgerbridge.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.ledgerbridge.spi.MetricsExporter} SPI using Micrometer counters.
 *
 * @see io.ledgerbridge.micrometer.MicrometerMetricsExporter
 */
package io.ledgerbridge.micrometer;
