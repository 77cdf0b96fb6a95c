package ca.gc.cra.pdfhasher.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * <strong>What:</strong> Content-addressed store holding one blob per object hash.
 * <p><strong>Policy:</strong> The first extension stored for a hash wins; later submissions of the same hash are
 * discarded whatever their extension.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code HashedObjectStore}.</p>
 *
 * @since 0.1.0
 */
public interface DedupStorePort {
  /** Result of a {@link #store} call. */
  enum Outcome {
    /** A new blob was written. */
    STORED,
    /** A blob for the hash already existed; nothing was written. */
    DUPLICATE
  }

  /**
   * Stores {@code source} under {@code sha256 + extension} unless a blob for the hash exists.
   *
   * @param source object file to copy
   * @param sha256 object hash
   * @param extension lower-case extension with dot, or empty
   * @return whether a blob was written
   * @throws IOException if the copy or rename fails
   */
  Outcome store(Path source, String sha256, String extension) throws IOException;

  /**
   * Finds the stored blob for a hash.
   *
   * @param sha256 object hash
   * @return blob path when present
   * @throws IOException if the store cannot be listed
   */
  Optional<Path> find(String sha256) throws IOException;
}
