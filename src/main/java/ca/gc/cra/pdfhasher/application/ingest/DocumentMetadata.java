package ca.gc.cra.pdfhasher.application.ingest;

import ca.gc.cra.pdfhasher.domain.document.AuthorCreator;
import ca.gc.cra.pdfhasher.domain.document.FilingAttributes;
import ca.gc.cra.pdfhasher.domain.signature.SignatureReport;
import java.util.Objects;

/**
 * Document-level attributes copied onto every object row of one document.
 *
 * @param filing attributes parsed from the file name
 * @param signatures parsed signature blocks
 * @param authorCreator information dictionary values
 * @since 0.1.0
 */
public record DocumentMetadata(
    FilingAttributes filing, SignatureReport signatures, AuthorCreator authorCreator) {
  public DocumentMetadata {
    Objects.requireNonNull(filing, "filing");
    Objects.requireNonNull(signatures, "signatures");
    Objects.requireNonNull(authorCreator, "authorCreator");
  }
}
