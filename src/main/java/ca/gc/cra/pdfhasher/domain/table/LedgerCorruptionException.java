package ca.gc.cra.pdfhasher.domain.table;

/**
 * Raised when the ledger holds a line that cannot be trusted as an exactly-once marker.
 *
 * <p>Continuing past such a line could reprocess or silently skip documents, so callers stop the
 * invocation instead of treating it as a per-document failure.</p>
 *
 * @since 0.1.0
 */
public final class LedgerCorruptionException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final long lineNumber;

  /**
   * Creates the exception.
   *
   * @param message description including the offending table
   * @param lineNumber one-based line number of the bad entry
   */
  public LedgerCorruptionException(String message, long lineNumber) {
    super(message + " (line " + lineNumber + ")");
    this.lineNumber = lineNumber;
  }

  /**
   * Returns the one-based line number of the bad entry.
   *
   * @return line number
   */
  public long lineNumber() {
    return lineNumber;
  }
}
