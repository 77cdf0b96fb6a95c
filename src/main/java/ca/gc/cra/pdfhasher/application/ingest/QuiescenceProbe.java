package ca.gc.cra.pdfhasher.application.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Waits for a document's size to stop changing before it is hashed.
 *
 * <p>The size is sampled up to {@code attempts} times, {@code intervalMillis} apart. Two equal consecutive
 * samples end the wait early; otherwise the wait ends when attempts run out. A missing file is slept over and
 * sampled again, which tolerates writers that replace the file.</p>
 *
 * @since 0.1.0
 */
public final class QuiescenceProbe {
  /** Sleep hook so tests can run without real delays. */
  @FunctionalInterface
  interface Pause {
    void pause(long millis) throws InterruptedException;
  }

  private final int attempts;
  private final long intervalMillis;
  private final Pause pause;

  /**
   * Creates a probe that sleeps between samples.
   *
   * @param attempts maximum number of samples; at least one
   * @param intervalMillis delay between samples
   */
  public QuiescenceProbe(int attempts, long intervalMillis) {
    this(attempts, intervalMillis, Thread::sleep);
  }

  QuiescenceProbe(int attempts, long intervalMillis, Pause pause) {
    if (attempts < 1) {
      throw new IllegalArgumentException("attempts must be >= 1");
    }
    if (intervalMillis < 0) {
      throw new IllegalArgumentException("intervalMillis must be >= 0");
    }
    this.attempts = attempts;
    this.intervalMillis = intervalMillis;
    this.pause = pause;
  }

  /**
   * Waits until the file looks quiet.
   *
   * @param file document to observe
   * @return {@code true} if the file exists when the wait ends
   * @throws InterruptedException if interrupted while sleeping
   */
  public boolean awaitQuiet(Path file) throws InterruptedException {
    long last = -1;
    for (int i = 0; i < attempts; i++) {
      long current = sizeOf(file);
      if (current < 0) {
        pause.pause(intervalMillis);
        continue;
      }
      if (current == last) {
        return true;
      }
      last = current;
      pause.pause(intervalMillis);
    }
    return Files.isRegularFile(file);
  }

  private static long sizeOf(Path file) {
    try {
      return Files.size(file);
    } catch (IOException ex) {
      return -1;
    }
  }
}
