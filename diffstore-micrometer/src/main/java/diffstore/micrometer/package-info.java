/**
 * Micrometer bridge for {@link diffstore.spi.MetricsExporter}.
 *
 * @see diffstore.micrometer.MicrometerMetricsExporter
 */
package diffstore.micrometer;
