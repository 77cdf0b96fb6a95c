package ca.gc.cra.pdfhasher.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the meter used by the ingest CLI and the SDK provider behind it, if any.
 *
 * <p>Settings come from the {@code otel.metrics.exporter}, {@code otel.exporter.otlp.endpoint} and
 * {@code otel.resource.attributes} system properties published by the CLI. Anything other than
 * {@code otlp} yields a no-op meter.</p>
 */
final class IngestMeters implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(IngestMeters.class);
  private static final String SCOPE = "ca.gc.cra.pdfhasher";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(10);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private final Meter meter;
  private final SdkMeterProvider provider;

  private IngestMeters(Meter meter, SdkMeterProvider provider) {
    this.meter = meter;
    this.provider = provider;
  }

  static IngestMeters fromSystemProperties() {
    String exporter = System.getProperty("otel.metrics.exporter", "none").trim();
    if (!exporter.equalsIgnoreCase("otlp")) {
      log.debug("Metrics export disabled (exporter={})", exporter);
      return disabled();
    }
    String endpoint = System.getProperty("otel.exporter.otlp.endpoint", DEFAULT_ENDPOINT).trim();
    Attributes extra = parseResourceAttributes(System.getProperty("otel.resource.attributes", ""));
    try {
      OtlpGrpcMetricExporter otlp = OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build();
      MetricReader reader = PeriodicMetricReader.builder(otlp).setInterval(EXPORT_INTERVAL).build();
      IngestMeters meters = withReader(reader, extra);
      log.info("Exporting ingest metrics over OTLP to {}", endpoint);
      return meters;
    } catch (RuntimeException ex) {
      log.error("Could not start the OTLP metrics exporter; metrics are discarded", ex);
      return disabled();
    }
  }

  static IngestMeters withReader(MetricReader reader, Attributes resourceAttributes) {
    Objects.requireNonNull(reader, "reader");
    Resource resource = Resource.getDefault()
        .merge(Resource.create(serviceAttributes()))
        .merge(Resource.create(resourceAttributes));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    return new IngestMeters(provider.get(SCOPE), provider);
  }

  static IngestMeters disabled() {
    return new IngestMeters(MeterProvider.noop().get(SCOPE), null);
  }

  /**
   * Parses {@code k1=v1,k2=v2}. Entries without a key or value are logged and skipped.
   */
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String entry : raw.split(",")) {
      String token = entry.trim();
      if (token.isEmpty()) {
        continue;
      }
      int eq = token.indexOf('=');
      String key = eq < 0 ? "" : token.substring(0, eq).trim();
      String value = eq < 0 ? "" : token.substring(eq + 1).trim();
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Skipping resource attribute '{}'", token);
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static Attributes serviceAttributes() {
    Package pkg = IngestMeters.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "pdfhasher")
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), version == null ? "dev" : version)
        .put(AttributeKey.stringKey("service.instance.id"), Long.toString(ProcessHandle.current().pid()))
        .build();
  }

  Meter meter() {
    return meter;
  }

  boolean isDisabled() {
    return provider == null;
  }

  @Override
  public void close() {
    if (provider == null) {
      return;
    }
    CompletableResultCode flushed = provider.forceFlush().join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    if (!flushed.isSuccess()) {
      log.warn("Final metrics export did not complete");
    }
    provider.shutdown().join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
  }
}
