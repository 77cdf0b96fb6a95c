package ca.gc.cra.pdfhasher.application.port;

import java.io.IOException;

/**
 * Rebuildable hash frequency projection over the object table.
 *
 * @since 0.1.0
 */
public interface HashCountPort {
  /**
   * Creates an empty projection if none exists.
   *
   * @throws IOException if the file cannot be created
   */
  void ensureExists() throws IOException;

  /**
   * Recomputes the projection from the object table and replaces it atomically.
   *
   * @return number of distinct hashes written
   * @throws IOException if reading the table or writing the projection fails
   */
  int rebuild() throws IOException;
}
