package ca.gc.cra.pdfhasher.application.port;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port computing content fingerprints for documents and extracted objects.
 * <p><strong>Role:</strong> Application port implemented by {@code Sha256ContentHasher}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface ContentHasher {
  /**
   * Hashes a file's entire content.
   *
   * @param file regular file to read
   * @return lower-case hexadecimal SHA-256 digest
   * @throws IOException if the file cannot be read
   */
  String hash(Path file) throws IOException;

  /**
   * Hashes a stream until end of input. The stream is not closed.
   *
   * @param in input stream
   * @return lower-case hexadecimal SHA-256 digest
   * @throws IOException if reading fails
   */
  String hash(InputStream in) throws IOException;
}
