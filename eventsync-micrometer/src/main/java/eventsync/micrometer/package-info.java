/**
 * Micrometer bridge for exporting sync metrics to Prometheus, Grafana, and other backends.
 *
 * @see eventsync.micrometer.MicrometerMetricsExporter
 */
package eventsync.micrometer;
