package ca.gc.cra.pdfhasher.infrastructure.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pdfhasher.application.port.ExtractionException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MutoolObjectExtractorTest {
  @TempDir Path dir;

  private Path document;
  private Path destination;

  @BeforeEach
  void setUp() throws Exception {
    document = Files.writeString(dir.resolve("in.pdf"), "%PDF");
    destination = Files.createDirectories(dir.resolve("out"));
  }

  @Test
  void returnsFilesWrittenIntoDestination() throws Exception {
    Path mutool = Scripts.write(dir, "mutool",
        "[ \"$1\" = extract ] || exit 9\necho img > image-0003.png\necho ttf > font-0001.ttf");

    List<Path> files = extractor(mutool).extract(document, destination);

    assertEquals(List.of(destination.resolve("font-0001.ttf"), destination.resolve("image-0003.png")), files);
  }

  @Test
  void failureWithoutOutputIsReported() throws Exception {
    Path mutool = Scripts.write(dir, "mutool", "echo 'cannot open document' >&2\nexit 1");

    ExtractionException ex =
        assertThrows(ExtractionException.class, () -> extractor(mutool).extract(document, destination));

    assertTrue(ex.getMessage().contains("exited with 1"));
    assertTrue(ex.getMessage().contains("cannot open document"));
  }

  @Test
  void partialOutputIsKeptDespiteNonZeroExit() throws Exception {
    Path mutool = Scripts.write(dir, "mutool", "echo img > image-0001.png\necho 'warning: broken xref' >&2\nexit 1");

    assertEquals(List.of(destination.resolve("image-0001.png")),
        extractor(mutool).extract(document, destination));
  }

  @Test
  void stampFileIsNeverReturned() throws Exception {
    Files.writeString(destination.resolve(".processed.sha"), "abc");
    Path mutool = Scripts.write(dir, "mutool", "echo img > image-0001.png");

    assertEquals(List.of(destination.resolve("image-0001.png")),
        extractor(mutool).extract(document, destination));
  }

  @Test
  void timeoutBecomesExtractionFailure() throws Exception {
    Path mutool = Scripts.write(dir, "mutool", "sleep 30");
    MutoolObjectExtractor extractor =
        new MutoolObjectExtractor(mutool.toString(), new CommandRunner(Duration.ofMillis(300)));

    assertThrows(ExtractionException.class, () -> extractor.extract(document, destination));
  }

  private static MutoolObjectExtractor extractor(Path mutool) {
    return new MutoolObjectExtractor(mutool.toString(), new CommandRunner(Duration.ofSeconds(30)));
  }
}
