package ca.gc.cra.pdfhasher.application.port;

import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> Per-hash ownership markers preventing two workers from processing the same content.
 * <p><strong>Role:</strong> Application port implemented by {@code FileInFlightGuards}; shared by threads and
 * processes.</p>
 * <p><strong>Contract:</strong> Acquisition is atomic (create-new). A guard older than the configured staleness
 * window is treated as abandoned and reclaimed.</p>
 *
 * @since 0.1.0
 */
public interface InFlightGuardPort {
  /**
   * Reports whether a live guard currently exists for the hash.
   *
   * @param sha256 document hash
   * @return {@code true} if another worker owns the hash
   */
  boolean isHeld(String sha256);

  /**
   * Tries to take ownership of a hash.
   *
   * @param sha256 document hash
   * @return the acquired guard, or empty when another worker won
   * @throws IOException if the guard directory cannot be written
   */
  Optional<Guard> tryAcquire(String sha256) throws IOException;

  /** Scoped ownership; closing releases the marker. */
  interface Guard extends AutoCloseable {
    /** Hash owned by this guard. */
    String sha256();

    /** Releases the guard. Never throws; failures are logged. */
    @Override
    void close();
  }
}
