/**
 * Micrometer bridge for exporting check-in engine metrics.
 *
 * @see checkin.micrometer.MicrometerMetricsExporter
 */
package checkin.micrometer;
