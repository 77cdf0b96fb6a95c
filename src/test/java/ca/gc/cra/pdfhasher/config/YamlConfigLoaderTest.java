package ca.gc.cra.pdfhasher.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path dir;

  @Test
  void modeSectionOverridesCommonAndNestedKeysAreFlattened() {
    String yaml = String.join("\n",
        "common:",
        "  metricsExporter: otlp",
        "  workers: 2",
        "ingest:",
        "  workers: 4",
        "  tools:",
        "    mutool: /opt/mupdf/bin/mutool",
        "  quiet:",
        "    attempts: 3",
        "other:",
        "  root: /ignored",
        "");

    Map<String, String> values = load(yaml);

    assertEquals("otlp", values.get("metricsExporter"));
    assertEquals("4", values.get("workers"));
    assertEquals("/opt/mupdf/bin/mutool", values.get("tools.mutool"));
    assertEquals("3", values.get("quiet.attempts"));
    assertFalse(values.containsKey("root"));
  }

  @Test
  void nullValuesBecomeEmptyStrings() {
    assertEquals("", load("ingest:\n  otelEndpoint:\n").get("otelEndpoint"));
  }

  @Test
  void emptyDocumentYieldsNoValues() {
    assertTrue(load("").isEmpty());
  }

  @Test
  void listsAreRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> load("ingest:\n  pdfDir:\n    - a\n    - b\n"));
    assertTrue(ex.getMessage().contains("pdfDir"));
  }

  @Test
  void nonMappingSectionIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> load("ingest: just-a-string\n"));
  }

  @Test
  void malformedYamlIsReportedAsIllegalArgument() {
    assertThrows(IllegalArgumentException.class, () -> load("ingest: [unclosed\n"));
  }

  @Test
  void unsafeTagsAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> load("ingest: !!javax.script.ScriptEngineManager [!!java.net.URLClassLoader [[]]]\n"));
  }

  @Test
  void missingFileRaisesNoSuchFile() {
    assertThrows(NoSuchFileException.class,
        () -> YamlConfigLoader.load(dir.resolve("absent.yaml"), DefaultsForMode.INGEST));
  }

  @Test
  void loadsFromFile() throws Exception {
    Path file = Files.writeString(dir.resolve("c.yaml"), "ingest:\n  pdfDir: inbox\n");

    assertEquals(Map.of("pdfDir", "inbox"), YamlConfigLoader.load(file, DefaultsForMode.INGEST));
  }

  @Test
  void shippedSampleMatchesDefaults() throws Exception {
    Map<String, String> sample = YamlConfigLoader.load(Path.of("config", "pdfhasher.yaml"), "ingest");

    assertEquals(DefaultsForMode.asFlatMap(DefaultsForMode.INGEST), sample);
  }

  private static Map<String, String> load(String yaml) {
    return YamlConfigLoader.load(new StringReader(yaml), "test", DefaultsForMode.INGEST);
  }
}
