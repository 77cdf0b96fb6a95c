package ca.gc.cra.pdfhasher.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IngestConfigTest {
  @TempDir Path root;

  @Test
  void defaultsResolveAgainstRoot() {
    IngestConfig config = IngestConfig.fromMap(withRoot(Map.of()));

    assertEquals(root.resolve("pdf"), config.pdfDir());
    assertEquals(root.resolve("pdf-objects"), config.objectsDir());
    assertEquals(root.resolve("hashed-objects"), config.hashedDir());
    assertEquals(root.resolve("objects.tsv"), config.objectsTable());
    assertEquals(root.resolve("processed.tsv"), config.ledgerTable());
    assertEquals(root.resolve("hash-count.tsv"), config.hashCountTable());
    assertEquals(root.resolve(".locks/inflight"), config.inflightDir());
    assertEquals(Duration.ofSeconds(5), config.pollInterval());
    assertEquals(10, config.quietAttempts());
    assertEquals(300L, config.quietIntervalMillis());
    assertEquals(Duration.ofMinutes(720), config.staleAfter());
    assertEquals(1, config.workers());
    assertEquals(WatchMode.AUTO, config.watchMode());
    assertEquals(500L, config.watchDebounceMillis());
    assertEquals(MetadataProvider.AUTO, config.metadataProvider());
    assertEquals("fc-scan", config.tools().fcScan());
    assertEquals(Duration.ofSeconds(120), config.toolTimeout());
  }

  @Test
  void absolutePathsAreKept() {
    Path elsewhere = root.resolve("elsewhere").toAbsolutePath();

    IngestConfig config = IngestConfig.fromMap(withRoot(Map.of("pdfDir", elsewhere.toString())));

    assertEquals(elsewhere, config.pdfDir());
  }

  @Test
  void overridesAreParsed() {
    IngestConfig config = IngestConfig.fromMap(withRoot(Map.of(
        "workers", "8",
        "watch.mode", "POLL",
        "metadata.provider", "pdfbox",
        "inflight.staleAfterMinutes", "0",
        "tools.mutool", "/usr/local/bin/mutool")));

    assertEquals(8, config.workers());
    assertEquals(WatchMode.POLL, config.watchMode());
    assertEquals(MetadataProvider.PDFBOX, config.metadataProvider());
    assertEquals(Duration.ZERO, config.staleAfter());
    assertEquals("/usr/local/bin/mutool", config.tools().mutool());
  }

  @Test
  void outOfRangeNumbersAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> IngestConfig.fromMap(withRoot(Map.of("workers", "0"))));
    assertThrows(IllegalArgumentException.class,
        () -> IngestConfig.fromMap(withRoot(Map.of("workers", "65"))));
    assertThrows(IllegalArgumentException.class,
        () -> IngestConfig.fromMap(withRoot(Map.of("pollSeconds", "soon"))));
  }

  @Test
  void collidingLocationsAreRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> IngestConfig.fromMap(withRoot(Map.of("objectsTable", "processed.tsv"))));

    assertTrue(ex.getMessage().contains("ledgerTable"));
  }

  @Test
  void blankToolCommandIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> IngestConfig.fromMap(withRoot(Map.of("tools.pdfsig", " "))));
  }

  @Test
  void layoutListsEveryLocation() {
    assertEquals(7, IngestConfig.fromMap(withRoot(Map.of())).layout().size());
  }

  private Map<String, String> withRoot(Map<String, String> overrides) {
    Map<String, String> args = new HashMap<>(DefaultsForMode.asFlatMap(DefaultsForMode.INGEST));
    args.put("root", root.toString());
    args.putAll(overrides);
    return args;
  }
}
