/**
 * OpenTelemetry metrics adapters.
 * <p><strong>Configuration:</strong> {@code otel.metrics.exporter=none} (or {@code OTEL_METRICS_EXPORTER}) disables
 * export; otherwise metrics go to an OTLP gRPC endpoint every 30 seconds.</p>
 */
package ca.gc.cra.xlog.infrastructure.metrics;
