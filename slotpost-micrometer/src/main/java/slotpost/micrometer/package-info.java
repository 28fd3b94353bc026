/**
 * Micrometer bridge for exporting scheduler metrics to Prometheus, Grafana, and other backends.
 *
 * @see slotpost.micrometer.MicrometerMetricsExporter
 */
package slotpost.micrometer;
