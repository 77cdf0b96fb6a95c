package ca.gc.cra.pdfhasher.domain.document;

import java.util.Objects;

/**
 * <strong>What:</strong> Content identity of one ingested PDF.
 * <p><strong>Why:</strong> Documents are deduplicated by whole-content hash, never by name, so the same
 * bytes dropped twice under different names are recognized as one document.</p>
 * <p><strong>Role:</strong> Domain value object produced by the coordinator after quiescence and hashing.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param sha256 lower-case hexadecimal SHA-256 of the document bytes
 * @param fileName original base name as observed in the watched directory
 * @param sizeBytes byte size at hashing time
 * @param modifiedEpochSeconds last-modified time in whole seconds since the epoch
 * @since 0.1.0
 */
public record DocumentFingerprint(
    String sha256, String fileName, long sizeBytes, long modifiedEpochSeconds) {

  /**
   * Validates the fingerprint components.
   *
   * @throws NullPointerException if {@code sha256} or {@code fileName} is {@code null}
   * @throws IllegalArgumentException if {@code sizeBytes} is negative
   */
  public DocumentFingerprint {
    Objects.requireNonNull(sha256, "sha256");
    Objects.requireNonNull(fileName, "fileName");
    if (sizeBytes < 0) {
      throw new IllegalArgumentException("sizeBytes must be >= 0");
    }
  }
}
