package ca.gc.cra.pdfhasher.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Default configuration values per CLI mode, expressed as the same flat keys the CLI and YAML use.
 *
 * <p>Relative paths are resolved against {@code root} by {@link IngestConfig#fromMap(Map)}.</p>
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  /** Mode name of the ingest CLI and of its YAML section. */
  public static final String INGEST = "ingest";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode}, common keys included.
   *
   * @param mode CLI mode; currently only {@value #INGEST}
   * @return immutable flat map
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    if (!INGEST.equals(normalized)) {
      throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    defaults.putAll(buildIngestDefaults());
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildIngestDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("root", ".");
    map.put("pdfDir", "pdf");
    map.put("objectsDir", "pdf-objects");
    map.put("hashedDir", "hashed-objects");
    map.put("objectsTable", "objects.tsv");
    map.put("ledgerTable", "processed.tsv");
    map.put("hashCountTable", "hash-count.tsv");
    map.put("lockDir", ".locks");
    map.put("pollSeconds", "5");
    map.put("quiet.attempts", "10");
    map.put("quiet.intervalMillis", "300");
    map.put("inflight.staleAfterMinutes", "720");
    map.put("workers", "1");
    map.put("watch.mode", "auto");
    map.put("watch.debounceMillis", "500");
    map.put("metadata.provider", "auto");
    map.put("tools.mutool", "mutool");
    map.put("tools.pdfsig", "pdfsig");
    map.put("tools.exiftool", "exiftool");
    map.put("tools.otfinfo", "otfinfo");
    map.put("tools.fcScan", "fc-scan");
    map.put("tools.timeoutSeconds", "120");
    return map;
  }
}
