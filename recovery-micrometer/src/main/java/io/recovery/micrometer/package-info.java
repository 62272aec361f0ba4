/**
 * Micrometer bridge for the {@link io.recovery.spi.MetricsExporter} SPI.
 *
 * @see io.recovery.micrometer.MicrometerMetricsExporter
 */
package io.recovery.micrometer;
