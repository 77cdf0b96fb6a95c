package ca.gc.cra.pdfhasher.infrastructure.metrics;

import ca.gc.cra.pdfhasher.application.port.MetricsPort;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MetricsPort} backed by OpenTelemetry: one counter or histogram per metric key, created on
 * first use.
 *
 * <p>Closing flushes the last export, so the CLI closes the adapter before exiting.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private final IngestMeters meters;
  private final Map<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final Map<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter configured from the {@code otel.*} system properties. */
  public OpenTelemetryMetricsAdapter() {
    this(IngestMeters.fromSystemProperties());
  }

  OpenTelemetryMetricsAdapter(IngestMeters meters) {
    this.meters = Objects.requireNonNull(meters, "meters");
  }

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(key, k -> meters.meter()
            .counterBuilder(instrumentName(k))
            .setUnit("1")
            .build())
        .add(1);
  }

  @Override
  public void observe(String key, long value) {
    histograms.computeIfAbsent(key, k -> meters.meter()
            .histogramBuilder(instrumentName(k))
            .ofLongs()
            .setUnit(k.endsWith("Millis") ? "ms" : "1")
            .build())
        .record(value);
  }

  /** Returns whether updates are discarded. */
  public boolean isNoop() {
    return meters.isDisabled();
  }

  @Override
  public void close() {
    meters.close();
  }

  /**
   * Maps a metric key onto a legal instrument name: lower case, a leading letter, and only letters, digits,
   * {@code _ - .}; anything else becomes {@code _}.
   */
  static String instrumentName(String key) {
    String lower = Objects.requireNonNull(key, "key").trim().toLowerCase(Locale.ROOT);
    if (lower.isEmpty()) {
      return "pdfhasher.metric";
    }
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      name.append('m');
    }
    for (char c : lower.toCharArray()) {
      boolean legal = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-' || c == '.';
      name.append(legal ? c : '_');
    }
    return name.toString();
  }
}
