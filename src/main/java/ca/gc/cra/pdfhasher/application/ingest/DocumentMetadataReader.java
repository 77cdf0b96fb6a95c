package ca.gc.cra.pdfhasher.application.ingest;

import ca.gc.cra.pdfhasher.application.port.AuthorCreatorProvider;
import ca.gc.cra.pdfhasher.application.port.SignatureReportProvider;
import ca.gc.cra.pdfhasher.domain.document.FilenameParser;
import ca.gc.cra.pdfhasher.domain.signature.SignatureReportParser;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the per-document metadata once before object rows are built.
 *
 * @since 0.1.0
 */
public final class DocumentMetadataReader {
  private static final Logger log = LoggerFactory.getLogger(DocumentMetadataReader.class);

  private final SignatureReportProvider signatureReports;
  private final AuthorCreatorProvider authorCreators;

  /**
   * Creates a reader over the given providers.
   *
   * @param signatureReports signature report source
   * @param authorCreators author/creator source
   */
  public DocumentMetadataReader(
      SignatureReportProvider signatureReports, AuthorCreatorProvider authorCreators) {
    this.signatureReports = Objects.requireNonNull(signatureReports, "signatureReports");
    this.authorCreators = Objects.requireNonNull(authorCreators, "authorCreators");
  }

  /**
   * Reads filing attributes, signatures and author/creator for one document.
   *
   * @param document document path handed to the providers
   * @param fileName original base name used for filing attributes
   * @return assembled metadata
   */
  public DocumentMetadata read(Path document, String fileName) {
    DocumentMetadata metadata = new DocumentMetadata(
        FilenameParser.parse(fileName),
        SignatureReportParser.parse(signatureReports.report(document)),
        authorCreators.authorCreator(document));
    log.debug("Metadata for {}: {}", fileName, metadata);
    return metadata;
  }
}
