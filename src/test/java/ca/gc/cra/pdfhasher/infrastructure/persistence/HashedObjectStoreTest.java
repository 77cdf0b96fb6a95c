package ca.gc.cra.pdfhasher.infrastructure.persistence;

import static ca.gc.cra.pdfhasher.testutil.Rows.sha;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pdfhasher.application.port.DedupStorePort.Outcome;
import ca.gc.cra.pdfhasher.infrastructure.persistence.lock.NamedFileLock;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HashedObjectStoreTest {
  @TempDir Path dir;

  private Path blobs;
  private HashedObjectStore store;

  @BeforeEach
  void setUp() {
    blobs = dir.resolve("hashed-objects");
    store = new HashedObjectStore(blobs, new NamedFileLock(dir.resolve("hashed.lock")));
  }

  @Test
  void firstSeenExtensionWins() throws IOException {
    Path png = Files.writeString(dir.resolve("image.png"), "pixels");
    Path jpg = Files.writeString(dir.resolve("image.jpg"), "pixels");

    assertEquals(Outcome.STORED, store.store(png, sha('c'), ".png"));
    assertEquals(Outcome.DUPLICATE, store.store(jpg, sha('c'), ".jpg"));

    assertEquals(List.of(sha('c') + ".png"), listing());
    assertEquals("pixels", Files.readString(blobs.resolve(sha('c') + ".png")));
  }

  @Test
  void extensionlessBlobCountsAsPresent() throws IOException {
    Path raw = Files.writeString(dir.resolve("stream"), "bytes");

    assertEquals(Outcome.STORED, store.store(raw, sha('d'), ""));
    assertEquals(Outcome.DUPLICATE, store.store(raw, sha('d'), ".bin"));
    assertTrue(store.find(sha('d')).isPresent());
  }

  @Test
  void similarPrefixIsNotADuplicate() throws IOException {
    Path file = Files.writeString(dir.resolve("f"), "x");
    Files.createDirectories(blobs);
    Files.writeString(blobs.resolve(sha('e') + "0"), "not the same hash");

    assertFalse(store.find(sha('e')).isPresent());
    assertEquals(Outcome.STORED, store.store(file, sha('e'), ".txt"));
  }

  @Test
  void blobNameMatching() {
    assertTrue(HashedObjectStore.isBlobName("abc", "abc"));
    assertTrue(HashedObjectStore.isBlobName("abc.png", "abc"));
    assertFalse(HashedObjectStore.isBlobName("abcd.png", "abc"));
    assertFalse(HashedObjectStore.isBlobName(".abc.png.tmp-1", "abc"));
  }

  private List<String> listing() throws IOException {
    try (Stream<Path> files = Files.list(blobs)) {
      return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
    }
  }
}
