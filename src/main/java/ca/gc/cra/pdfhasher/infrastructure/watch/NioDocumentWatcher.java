package ca.gc.cra.pdfhasher.infrastructure.watch;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import ca.gc.cra.pdfhasher.application.pipeline.DocumentCandidates;
import ca.gc.cra.pdfhasher.application.port.DocumentWatcher;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link DocumentWatcher} driven by create and modify events.
 * <p><strong>Debounce:</strong> After the first event, further events are collected until the directory has been
 * quiet for {@code debounceMillis}, so one copy produces one batch.</p>
 * <p><strong>Overflow:</strong> When the platform drops events the whole directory is listed instead.</p>
 *
 * @since 0.1.0
 */
public final class NioDocumentWatcher implements DocumentWatcher {
  private static final Logger log = LoggerFactory.getLogger(NioDocumentWatcher.class);

  private final Path directory;
  private final WatchService service;
  private final long debounceMillis;

  /**
   * Registers a watch on {@code directory}.
   *
   * @param directory input directory; must exist
   * @param debounceMillis quiet period closing a batch
   * @throws IOException if the watch cannot be registered
   */
  public NioDocumentWatcher(Path directory, long debounceMillis) throws IOException {
    this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath();
    this.debounceMillis = Math.max(0L, debounceMillis);
    this.service = this.directory.getFileSystem().newWatchService();
    try {
      this.directory.register(service, ENTRY_CREATE, ENTRY_MODIFY);
    } catch (IOException | RuntimeException ex) {
      service.close();
      throw ex;
    }
    log.debug("Registered file-system watch on {}", this.directory);
  }

  @Override
  public List<Path> next() throws IOException, InterruptedException {
    WatchKey key;
    try {
      key = service.take();
    } catch (ClosedWatchServiceException ex) {
      return List.of();
    }
    TreeSet<Path> changed = new TreeSet<>();
    boolean overflow = false;
    try {
      while (key != null) {
        for (WatchEvent<?> event : key.pollEvents()) {
          if (event.kind() == OVERFLOW) {
            overflow = true;
            continue;
          }
          Path name = (Path) event.context();
          if (DocumentCandidates.isCandidateName(name.toString())) {
            changed.add(directory.resolve(name));
          }
        }
        if (!key.reset()) {
          throw new IOException("watch on " + directory + " is no longer valid");
        }
        key = service.poll(debounceMillis, TimeUnit.MILLISECONDS);
      }
    } catch (ClosedWatchServiceException ex) {
      log.debug("Watch service closed while collecting events");
    }
    if (overflow) {
      log.warn("File-system events overflowed; rescanning {}", directory);
      return DocumentCandidates.list(directory);
    }
    List<Path> ready = new ArrayList<>(changed.size());
    for (Path path : changed) {
      if (Files.isRegularFile(path)) {
        ready.add(path);
      }
    }
    return ready;
  }

  @Override
  public void close() throws IOException {
    service.close();
  }
}
