/**
 * Metrics adapters implementing {@link ca.gc.cra.vartrunc.application.port.MetricsPort}.
 * <p><strong>Role:</strong> Bridges truncation and offload counters to OpenTelemetry, or discards them.</p>
 * <p><strong>Configuration:</strong> The exporter follows {@code OTEL_METRICS_EXPORTER} /
 * {@code otel.metrics.exporter} ({@code otlp} or {@code none}).</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.vartrunc.infrastructure.metrics;
