package ca.gc.cra.pdfhasher.application.pipeline;

import ca.gc.cra.pdfhasher.application.port.DocumentWatcher;
import ca.gc.cra.pdfhasher.domain.ingest.ProcessingResult;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Catch-up scan followed by continuous monitoring of the input directory.
 * <p><strong>Role:</strong> Application use case behind {@code --monitor}.</p>
 * <p><strong>Lifecycle:</strong> The watcher must already be registered when {@link #run()} starts so documents
 * dropped during the catch-up scan are reported too. {@link #stop()} may be called from another thread, such as
 * a shutdown hook; the watcher is closed when {@link #run()} returns.</p>
 *
 * @since 0.1.0
 */
public final class WatchUseCase {
  private static final Logger log = LoggerFactory.getLogger(WatchUseCase.class);

  private final CatchUpUseCase catchUp;
  private final DocumentWatcher watcher;
  private final Path inputDir;
  private volatile boolean running = true;

  /**
   * Creates the monitor.
   *
   * @param catchUp scanner used for the initial pass and for watcher batches
   * @param watcher registered watcher over {@code inputDir}
   * @param inputDir watched directory, for logging
   */
  public WatchUseCase(CatchUpUseCase catchUp, DocumentWatcher watcher, Path inputDir) {
    this.catchUp = Objects.requireNonNull(catchUp, "catchUp");
    this.watcher = Objects.requireNonNull(watcher, "watcher");
    this.inputDir = Objects.requireNonNull(inputDir, "inputDir");
  }

  /**
   * Runs until {@link #stop()} is called, the watcher closes, or the thread is interrupted.
   *
   * @throws IOException if a durable write fails
   * @throws InterruptedException if interrupted while waiting
   */
  public void run() throws IOException, InterruptedException {
    try {
      catchUp.scan();
      log.info("Monitoring {} for new documents (Ctrl+C to stop)", inputDir);
      while (running && !Thread.currentThread().isInterrupted()) {
        List<Path> batch = watcher.next();
        if (!running) {
          break;
        }
        if (batch.isEmpty()) {
          continue;
        }
        log.debug("Watcher reported {} candidate(s)", batch.size());
        List<ProcessingResult> results = catchUp.processSerially(batch);
        log.debug("Processed watcher batch: {}", results);
      }
    } finally {
      closeWatcher();
      log.info("Monitoring stopped");
    }
  }

  /** Requests the monitor loop to end and wakes a blocked watcher. */
  public void stop() {
    running = false;
    closeWatcher();
  }

  private void closeWatcher() {
    try {
      watcher.close();
    } catch (IOException ex) {
      log.warn("Failed to close document watcher", ex);
    }
  }
}
