package ca.gc.cra.pdfhasher.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {
  private final Map<String, String> defaults = DefaultsForMode.asFlatMap(DefaultsForMode.INGEST);

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        Map.of("workers", "3", "pdfDir", "inbox"),
        Map.of("workers", "6", "config", "x.yaml"),
        defaults,
        warnings::add);

    assertEquals("6", effective.get("workers"));
    assertEquals("inbox", effective.get("pdfDir"));
    assertEquals("objects.tsv", effective.get("objectsTable"));
    assertFalse(effective.containsKey("config"));
    assertEquals(List.of("CLI overrides YAML for key: workers"), warnings);
  }

  @Test
  void unknownKeysAreWarnedAndDropped() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        Map.of("pdfdir", "typo"), Map.of("wrokers", "2"), defaults, warnings::add);

    assertFalse(effective.containsKey("pdfdir"));
    assertFalse(effective.containsKey("wrokers"));
    assertTrue(warnings.contains("Ignoring unknown YAML key: pdfdir"));
    assertTrue(warnings.contains("Ignoring unknown CLI key: wrokers"));
  }

  @Test
  void enumeratedKeysAreValidated() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        Map.of(), Map.of("watch.mode", "inotify"), defaults, null));
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        Map.of(), Map.of("metadata.provider", "tika"), defaults, null));
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        Map.of(), Map.of("metricsExporter", "prometheus"), defaults, null));
  }

  @Test
  void nullInputsAreTreatedAsEmpty() {
    assertEquals(defaults, ConfigMerger.buildEffectiveConfig(null, null, defaults, null));
  }
}
