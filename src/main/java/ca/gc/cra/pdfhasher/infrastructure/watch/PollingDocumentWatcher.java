package ca.gc.cra.pdfhasher.infrastructure.watch;

import ca.gc.cra.pdfhasher.application.pipeline.DocumentCandidates;
import ca.gc.cra.pdfhasher.application.port.DocumentWatcher;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * {@link DocumentWatcher} that lists the whole input directory every {@code interval}.
 *
 * <p>Documents that failed earlier are offered again on every pass, which is how they are retried.</p>
 *
 * @since 0.1.0
 */
public final class PollingDocumentWatcher implements DocumentWatcher {
  private final Path directory;
  private final Duration interval;
  private final CountDownLatch closed = new CountDownLatch(1);

  /**
   * Creates the watcher.
   *
   * @param directory input directory
   * @param interval delay before each rescan
   */
  public PollingDocumentWatcher(Path directory, Duration interval) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.interval = Objects.requireNonNull(interval, "interval");
  }

  @Override
  public List<Path> next() throws IOException, InterruptedException {
    if (closed.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
      return List.of();
    }
    return DocumentCandidates.list(directory);
  }

  @Override
  public void close() {
    closed.countDown();
  }
}
