/**
 * OpenTelemetry-backed implementation of {@link ca.gc.cra.mimetic.application.port.MetricsPort}.
 * <p>Exporter selection comes from {@link ca.gc.cra.mimetic.infrastructure.metrics.TelemetrySettings};
 * {@code metricsExporter=none} yields a noop meter.</p>
 */
package ca.gc.cra.mimetic.infrastructure.metrics;
