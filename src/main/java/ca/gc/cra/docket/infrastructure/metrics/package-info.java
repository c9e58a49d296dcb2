/**
 * <strong>Purpose:</strong> OpenTelemetry implementation of the metrics port.
 * <p><strong>Observability:</strong> exports through OTLP gRPC when {@code metricsExporter=otlp}; otherwise every
 * measurement is dropped by a noop meter.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docket.infrastructure.metrics;
