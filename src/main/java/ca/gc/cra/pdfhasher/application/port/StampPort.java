package ca.gc.cra.pdfhasher.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Crash-recovery marker stored beside a document's extracted objects.
 *
 * <p>The stamp is written before the ledger entry, so a stamp without an entry means the previous run
 * finished the rows but died before recording completion.</p>
 *
 * @since 0.1.0
 */
public interface StampPort {
  /** File name of the marker inside an extraction destination. */
  String STAMP_FILE_NAME = ".processed.sha";

  /**
   * Checks whether the destination carries a stamp for {@code sha256}.
   *
   * @param destination extraction directory
   * @param sha256 document hash
   * @return {@code true} if the stamp's first line equals the hash
   */
  boolean matches(Path destination, String sha256);

  /**
   * Writes the stamp atomically.
   *
   * @param destination extraction directory
   * @param sha256 document hash
   * @throws IOException if the write fails
   */
  void write(Path destination, String sha256) throws IOException;
}
