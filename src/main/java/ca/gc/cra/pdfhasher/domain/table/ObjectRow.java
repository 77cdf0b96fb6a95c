package ca.gc.cra.pdfhasher.domain.table;

import ca.gc.cra.pdfhasher.domain.document.AuthorCreator;
import ca.gc.cra.pdfhasher.domain.document.ExtractedObject;
import ca.gc.cra.pdfhasher.domain.document.FilingAttributes;
import ca.gc.cra.pdfhasher.domain.signature.SignatureReport;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> One line of the object table: document-level attributes denormalized onto one
 * extracted object.
 * <p><strong>Role:</strong> Domain record rendered by {@link ObjectsSchema#CURRENT_HEADER} column order.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param filing case/filing attributes parsed from the document name
 * @param documentName original document base name
 * @param object extracted object identity
 * @param signatures up to four signature blocks
 * @param authorCreator document author and creator
 * @since 0.1.0
 */
public record ObjectRow(
    FilingAttributes filing,
    String documentName,
    ExtractedObject object,
    SignatureReport signatures,
    AuthorCreator authorCreator) {

  public ObjectRow {
    Objects.requireNonNull(filing, "filing");
    Objects.requireNonNull(documentName, "documentName");
    Objects.requireNonNull(object, "object");
    Objects.requireNonNull(signatures, "signatures");
    Objects.requireNonNull(authorCreator, "authorCreator");
  }

  /**
   * Renders the row's fields in table column order.
   *
   * @return exactly {@link ObjectsSchema#COLUMN_COUNT} values
   */
  public List<String> fields() {
    List<String> fields = new ArrayList<>(ObjectsSchema.COLUMN_COUNT);
    fields.add(filing.caseNumber());
    fields.add(filing.filingType());
    fields.add(filing.filingDate());
    fields.add(object.sha256());
    fields.add(documentName);
    fields.add(object.relativePath());
    fields.add(object.extension());
    fields.add(object.fontName());
    fields.add(signatures.block(1).commonName());
    fields.add(signatures.block(2).commonName());
    fields.add(authorCreator.author());
    fields.add(authorCreator.creator());
    fields.add(signatures.block(3).commonName());
    fields.add(signatures.block(4).commonName());
    for (int i = 1; i <= SignatureReport.MAX_BLOCKS; i++) {
      fields.add(signatures.block(i).signingTime());
    }
    for (int i = 1; i <= SignatureReport.MAX_BLOCKS; i++) {
      fields.add(signatures.block(i).byteRanges());
    }
    return fields;
  }

  /**
   * Renders the row as a tab-separated line without the trailing newline.
   *
   * @return table line
   */
  public String toTsvLine() {
    return TsvFields.join(fields());
  }
}
