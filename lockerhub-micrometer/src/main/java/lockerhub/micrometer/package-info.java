/**
 * Micrometer bridge for exporting queue, sweep and contention counters.
 *
 * <p>{@link lockerhub.micrometer.MicrometerMetricsExporter} implements the
 * {@link lockerhub.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 */
package lockerhub.micrometer;
