package ca.gc.cra.pdfhasher.application.port;

/**
 * Signals that an extractor produced nothing usable for a document.
 *
 * <p>The coordinator marks the document failed and retries it on the next scan.</p>
 *
 * @since 0.1.0
 */
public class ExtractionException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message failure description
   */
  public ExtractionException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message failure description
   * @param cause underlying failure
   */
  public ExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
