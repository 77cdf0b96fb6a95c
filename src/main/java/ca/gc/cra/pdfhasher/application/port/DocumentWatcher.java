package ca.gc.cra.pdfhasher.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Source of candidate documents appearing in the input directory after start-up.
 * <p><strong>Role:</strong> Application port implemented by {@code NioDocumentWatcher} (file-system events) and
 * {@code PollingDocumentWatcher} (periodic rescans).</p>
 * <p><strong>Thread-safety:</strong> Used by a single monitor thread.</p>
 *
 * @since 0.1.0
 */
public interface DocumentWatcher extends AutoCloseable {
  /**
   * Blocks until at least one candidate is ready or the watcher is closed.
   *
   * @return candidate documents, possibly empty after close or a spurious wake-up
   * @throws IOException if the directory cannot be read
   * @throws InterruptedException if the waiting thread is interrupted
   */
  List<Path> next() throws IOException, InterruptedException;

  /** Stops watching and releases native resources. */
  @Override
  void close() throws IOException;
}
