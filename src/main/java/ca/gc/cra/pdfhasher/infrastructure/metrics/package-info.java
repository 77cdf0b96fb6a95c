/**
 * <strong>Purpose:</strong> OpenTelemetry implementation of the metrics port.
 * <p><strong>Configuration:</strong> Exporter, endpoint and resource attributes come from the
 * {@code otel.*} system properties set by the CLI. The exporter defaults to {@code none}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.pdfhasher.infrastructure.metrics;
