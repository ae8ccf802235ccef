/**
 * <strong>Purpose:</strong> Metrics adapters implementing {@link io.airesearcher.safeexec.application.port.MetricsPort}.
 * <p><strong>Observability:</strong> OpenTelemetry SDK with an optional OTLP gRPC exporter.
 *
 * @since 0.1.0
 */
package io.airesearcher.safeexec.infrastructure.metrics;
