package ca.gc.cra.pdfhasher.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads ingest configuration from a YAML document and flattens it into dotted keys.
 *
 * <p>The {@code common} section is applied first and the section named after the mode is layered on top.
 * Nested mappings become dotted keys, so {@code tools: {mutool: /opt/bin/mutool}} yields
 * {@code tools.mutool}. Other top-level sections are ignored.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path}.
   *
   * @param path location of the YAML configuration; must exist
   * @param mode CLI mode whose section is layered over {@code common}
   * @return flat map of configured values
   * @throws NoSuchFileException when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Map<String, String> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.isRegularFile(path)) {
      throw new NoSuchFileException(path.toString(), null, "config file not found");
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return load(reader, path.toString(), mode);
    }
  }

  /**
   * Loads YAML from an open reader.
   *
   * @param reader YAML source; not closed by this method
   * @param source description used in error messages
   * @param mode CLI mode whose section is layered over {@code common}
   * @return flat map of configured values
   * @throws IllegalArgumentException when the YAML is malformed or not shaped as sections of mappings
   */
  public static Map<String, String> load(Reader reader, String source, String mode) {
    Objects.requireNonNull(reader, "reader");
    Objects.requireNonNull(mode, "mode");
    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + source, ex);
    }
    if (document == null) {
      return Map.of();
    }
    Map<String, Object> root = asMap(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    for (String sectionName : new String[] {COMMON_SECTION, normalizedMode}) {
      Object section = findSection(root, sectionName);
      if (section != null) {
        flatten(asMap(section, sectionName), "", flattened);
      }
    }
    return Map.copyOf(flattened);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key " + entry.getKey());
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey().trim();
      if (key.isEmpty()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
