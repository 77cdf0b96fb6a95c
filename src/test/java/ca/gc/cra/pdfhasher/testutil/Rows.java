package ca.gc.cra.pdfhasher.testutil;

import ca.gc.cra.pdfhasher.domain.document.AuthorCreator;
import ca.gc.cra.pdfhasher.domain.document.ExtractedObject;
import ca.gc.cra.pdfhasher.domain.document.FilenameParser;
import ca.gc.cra.pdfhasher.domain.signature.SignatureReport;
import ca.gc.cra.pdfhasher.domain.table.ObjectRow;

/** Builders for object rows used across table tests. */
public final class Rows {
  private Rows() {}

  /** Returns a row for {@code document} with a single object hashed to {@code sha}. */
  public static ObjectRow row(String document, String objectPath, String sha) {
    return new ObjectRow(
        FilenameParser.parse(document),
        document,
        new ExtractedObject(objectPath, sha, ExtractedObject.extensionOf(objectPath), ""),
        SignatureReport.empty(),
        AuthorCreator.empty());
  }

  /** Returns a 64-character lower-case hex digest made of {@code c}. */
  public static String sha(char c) {
    return String.valueOf(c).repeat(64);
  }
}
