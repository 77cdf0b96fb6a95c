package ca.gc.cra.pdfhasher.api;

import ca.gc.cra.pdfhasher.config.ConfigMerger;
import ca.gc.cra.pdfhasher.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /** Removes and returns the {@code config=PATH} argument, or {@code null} when absent or blank. */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove(ConfigMerger.CONFIG_KEY);
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Loads the YAML file named by {@code config=PATH}, if any.
   *
   * @param configPath path from {@link #extractConfigPath(Map)}; may be {@code null}
   * @param mode YAML section to layer over {@code common}
   * @return flat YAML values, empty without a config file
   * @throws IOException if the named file is missing or unreadable
   */
  static Map<String, String> loadYaml(String configPath, String mode) throws IOException {
    if (configPath == null) {
      return Map.of();
    }
    return YamlConfigLoader.load(Path.of(configPath), mode);
  }
}
