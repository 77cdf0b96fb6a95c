package ca.gc.cra.pdfhasher.infrastructure.watch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NioDocumentWatcherTest {
  @TempDir Path dir;

  @Test
  void reportsNewDocumentsAndIgnoresOtherFiles() throws Exception {
    try (NioDocumentWatcher watcher = new NioDocumentWatcher(dir, 200)) {
      Files.writeString(dir.resolve("notes.txt"), "x");
      Path doc = Files.writeString(dir.resolve("arrived.pdf"), "%PDF");

      List<Path> seen = assertTimeoutPreemptively(Duration.ofSeconds(30), () -> {
        List<Path> all = new ArrayList<>();
        while (!all.contains(doc.toAbsolutePath())) {
          all.addAll(watcher.next());
        }
        return all;
      });

      assertTrue(seen.stream().allMatch(p -> p.getFileName().toString().endsWith(".pdf")));
    }
  }

  @Test
  void closeFromAnotherThreadUnblocksNext() throws Exception {
    NioDocumentWatcher watcher = new NioDocumentWatcher(dir, 50);
    ExecutorService closer = Executors.newSingleThreadExecutor();
    try {
      closer.submit(() -> {
        TimeUnit.MILLISECONDS.sleep(200);
        watcher.close();
        return null;
      });

      List<Path> batch = assertTimeoutPreemptively(Duration.ofSeconds(10), watcher::next);

      assertEquals(List.of(), batch);
    } finally {
      closer.shutdownNow();
    }
  }
}
