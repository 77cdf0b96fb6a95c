package ca.gc.cra.pdfhasher.domain.ingest;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of offering one document to the coordinator.
 *
 * @param document document path as offered
 * @param state outcome state; {@link DocumentState#isOutcome()} holds
 * @param sha256 document hash, or {@code null} when the document vanished before hashing
 * @param rowsAppended object rows appended by this call
 * @param detail short human-readable reason for skips and failures; empty otherwise
 * @since 0.1.0
 */
public record ProcessingResult(
    Path document, DocumentState state, String sha256, int rowsAppended, String detail) {

  public ProcessingResult {
    Objects.requireNonNull(document, "document");
    Objects.requireNonNull(state, "state");
    if (!state.isOutcome()) {
      throw new IllegalArgumentException("not an outcome state: " + state);
    }
    detail = detail == null ? "" : detail;
  }

  /**
   * Creates a skip or failure outcome that appended no rows.
   *
   * @param document document path
   * @param state outcome state
   * @param sha256 document hash if known
   * @param detail reason
   * @return result
   */
  public static ProcessingResult of(Path document, DocumentState state, String sha256, String detail) {
    return new ProcessingResult(document, state, sha256, 0, detail);
  }

  /**
   * Creates the outcome for a fully processed document.
   *
   * @param document document path
   * @param sha256 document hash
   * @param rowsAppended rows written for this document
   * @return ledgered result
   */
  public static ProcessingResult ledgered(Path document, String sha256, int rowsAppended) {
    return new ProcessingResult(document, DocumentState.LEDGERED, sha256, rowsAppended, "");
  }
}
