/**
 * Micrometer bridge for {@link io.shortcast.spi.MetricsExporter}.
 *
 * @see io.shortcast.micrometer.MicrometerMetricsExporter
 */
package io.shortcast.micrometer;
