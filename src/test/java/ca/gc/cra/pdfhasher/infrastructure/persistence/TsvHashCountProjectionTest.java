package ca.gc.cra.pdfhasher.infrastructure.persistence;

import static ca.gc.cra.pdfhasher.testutil.Rows.row;
import static ca.gc.cra.pdfhasher.testutil.Rows.sha;
import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.pdfhasher.infrastructure.persistence.lock.NamedFileLock;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TsvHashCountProjectionTest {
  @TempDir Path dir;

  @Test
  void rebuildReflectsWholeObjectTable() throws IOException {
    TsvObjectTable table =
        new TsvObjectTable(dir.resolve("objects.tsv"), new NamedFileLock(dir.resolve("objects.lock")));
    Path counts = dir.resolve("hash-count.tsv");
    TsvHashCountProjection projection =
        new TsvHashCountProjection(counts, new NamedFileLock(dir.resolve("counts.lock")), table);
    table.ensureLayout();
    projection.ensureExists();

    table.append(List.of(row("a.pdf", "1.png", sha('b')), row("a.pdf", "2.png", sha('a'))));
    table.append(List.of(row("b.pdf", "1.png", sha('b'))));
    int distinct = projection.rebuild();

    assertEquals(2, distinct);
    assertEquals(List.of(sha('b') + "\t2", sha('a') + "\t1"), Files.readAllLines(counts));
  }

  @Test
  void rebuildToleratesNonUtf8Bytes() throws IOException {
    Path objects = dir.resolve("objects.tsv");
    TsvObjectTable table = new TsvObjectTable(objects, new NamedFileLock(dir.resolve("objects.lock")));
    Path counts = dir.resolve("hash-count.tsv");
    table.ensureLayout();
    Files.write(objects, ("\t\t\t" + sha('c') + "\tcaf").getBytes(StandardCharsets.US_ASCII),
        StandardOpenOption.APPEND);
    Files.write(objects, new byte[] {(byte) 0xE9, '.', 'p', 'd', 'f', '\n'}, StandardOpenOption.APPEND);

    int distinct =
        new TsvHashCountProjection(counts, new NamedFileLock(dir.resolve("counts.lock")), table).rebuild();

    assertEquals(1, distinct);
    assertEquals(List.of(sha('c') + "\t1"), Files.readAllLines(counts));
  }

  @Test
  void rebuildOfEmptyTableWritesEmptyProjection() throws IOException {
    TsvObjectTable table =
        new TsvObjectTable(dir.resolve("objects.tsv"), new NamedFileLock(dir.resolve("objects.lock")));
    Path counts = dir.resolve("hash-count.tsv");
    Files.writeString(counts, "stale\t9\n");
    table.ensureLayout();

    int distinct =
        new TsvHashCountProjection(counts, new NamedFileLock(dir.resolve("counts.lock")), table).rebuild();

    assertEquals(0, distinct);
    assertEquals(List.of(), Files.readAllLines(counts));
  }
}
