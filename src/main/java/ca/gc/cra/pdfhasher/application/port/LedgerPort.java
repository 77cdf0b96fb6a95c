package ca.gc.cra.pdfhasher.application.port;

import ca.gc.cra.pdfhasher.domain.table.LedgerEntry;
import java.io.IOException;

/**
 * <strong>What:</strong> Authoritative record of fully processed documents.
 * <p><strong>Role:</strong> Application port implemented by {@code TsvLedger}.</p>
 * <p><strong>Error model:</strong> Unreadable entries raise
 * {@link ca.gc.cra.pdfhasher.domain.table.LedgerCorruptionException}.</p>
 *
 * @since 0.1.0
 */
public interface LedgerPort {
  /**
   * Creates an empty ledger if none exists.
   *
   * @throws IOException if the file cannot be created
   */
  void ensureExists() throws IOException;

  /**
   * Checks whether a document hash has been recorded.
   *
   * @param sha256 document hash
   * @return {@code true} if an entry exists
   * @throws IOException if the ledger cannot be read
   */
  boolean contains(String sha256) throws IOException;

  /**
   * Appends {@code entry} unless its hash is already recorded; check and append happen under one lock.
   *
   * @param entry entry to record
   * @return {@code true} if the entry was appended
   * @throws IOException if the ledger cannot be read or written
   */
  boolean appendIfAbsent(LedgerEntry entry) throws IOException;
}
