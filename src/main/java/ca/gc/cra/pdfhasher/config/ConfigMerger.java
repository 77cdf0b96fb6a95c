package ca.gc.cra.pdfhasher.config;

import ca.gc.cra.pdfhasher.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI key/value pairs into the effective flat configuration.
 *
 * <p>Precedence is CLI over YAML over defaults. Keys that have no default are dropped and reported through the
 * warning sink, since they are usually typos.</p>
 */
public final class ConfigMerger {
  /** CLI key naming the YAML file; consumed before merging. */
  public static final String CONFIG_KEY = "config";

  private ConfigMerger() {}

  /**
   * Builds the effective configuration and validates the enumerated keys.
   *
   * @param yaml values loaded from the YAML file; empty when no file was given
   * @param cli values parsed from {@code key=value} arguments
   * @param defaults defaults for the mode
   * @param warn sink for override and unknown-key warnings; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException when an enumerated key carries an unsupported value
   */
  public static Map<String, String> buildEffectiveConfig(
      Map<String, String> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml == null ? Map.of() : yaml;
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> sink = warn == null ? message -> {} : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    putAll(merged, yamlCopy, defaultsCopy, "YAML", sink);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      if (yamlCopy.containsKey(entry.getKey())) {
        sink.accept("CLI overrides YAML for key: " + entry.getKey());
      }
    }
    putAll(merged, cliCopy, defaultsCopy, "CLI", sink);
    merged.remove(CONFIG_KEY);

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void putAll(
      Map<String, String> merged,
      Map<String, String> source,
      Map<String, String> defaults,
      String origin,
      Consumer<String> warn) {
    for (Map.Entry<String, String> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null || CONFIG_KEY.equals(key)) {
        continue;
      }
      if (!defaults.isEmpty() && !defaults.containsKey(key)) {
        warn.accept("Ignoring unknown " + origin + " key: " + key);
        continue;
      }
      merged.put(key, entry.getValue());
    }
  }

  private static void validate(Map<String, String> effective) {
    WatchMode.fromString(effective.get("watch.mode"));
    MetadataProvider.fromString(effective.get("metadata.provider"));
    String exporter = effective.get("metricsExporter");
    if (exporter != null && !exporter.isBlank()) {
      Strings.requireOneOf("metricsExporter", exporter, "otlp", "none");
    }
  }
}
