package ca.gc.cra.pdfhasher.api;

import ca.gc.cra.pdfhasher.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes the metrics settings of the effective configuration as the {@code otel.*} system properties read by
 * {@link ca.gc.cra.pdfhasher.infrastructure.metrics.OpenTelemetryMetricsAdapter}.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  static final String EXPORTER_PROPERTY = "otel.metrics.exporter";
  static final String ENDPOINT_PROPERTY = "otel.exporter.otlp.endpoint";
  static final String RESOURCE_ATTRIBUTES_PROPERTY = "otel.resource.attributes";

  private TelemetryConfigurator() {}

  /**
   * Validates and applies {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}.
   * Blank values leave the corresponding property untouched.
   *
   * @param effective merged configuration
   * @throws IllegalArgumentException if a value is malformed
   */
  static void configureMetrics(Map<String, String> effective) {
    if (effective == null || effective.isEmpty()) {
      return;
    }
    String exporter = trimmed(effective.get("metricsExporter"));
    String endpoint = trimmed(effective.get("otelEndpoint"));
    String resourceAttributes = trimmed(effective.get("otelResourceAttributes"));

    String normalizedExporter = null;
    if (!exporter.isEmpty()) {
      normalizedExporter = exporter.toLowerCase(Locale.ROOT);
      if (!normalizedExporter.equals("otlp") && !normalizedExporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
    }
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
    }
    if (!resourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }

    if (normalizedExporter != null) {
      log.debug("Configuring OpenTelemetry metrics exporter: {}", normalizedExporter);
      System.setProperty(EXPORTER_PROPERTY, normalizedExporter);
    }
    if (!endpoint.isEmpty()) {
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty(ENDPOINT_PROPERTY, endpoint);
    }
    if (!resourceAttributes.isEmpty()) {
      log.debug("Configuring OTEL resource attributes override");
      System.setProperty(RESOURCE_ATTRIBUTES_PROPERTY, resourceAttributes);
    }
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
