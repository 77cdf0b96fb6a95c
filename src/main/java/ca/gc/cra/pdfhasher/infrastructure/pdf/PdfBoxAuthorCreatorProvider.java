package ca.gc.cra.pdfhasher.infrastructure.pdf;

import ca.gc.cra.pdfhasher.application.port.AuthorCreatorProvider;
import ca.gc.cra.pdfhasher.domain.document.AuthorCreator;
import java.io.IOException;
import java.nio.file.Path;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AuthorCreatorProvider} reading the document information dictionary with Apache PDFBox.
 *
 * <p>Used when {@code exiftool} is not installed. Unreadable or password-protected documents yield blank
 * values.</p>
 *
 * @since 0.1.0
 */
public final class PdfBoxAuthorCreatorProvider implements AuthorCreatorProvider {
  private static final Logger log = LoggerFactory.getLogger(PdfBoxAuthorCreatorProvider.class);

  @Override
  public AuthorCreator authorCreator(Path document) {
    try (PDDocument doc = PDDocument.load(document.toFile())) {
      PDDocumentInformation info = doc.getDocumentInformation();
      if (info == null) {
        return AuthorCreator.empty();
      }
      return new AuthorCreator(info.getAuthor(), info.getCreator());
    } catch (IOException | RuntimeException ex) {
      log.warn("PDFBox could not read metadata of {}: {}", document.getFileName(), ex.toString());
      return AuthorCreator.empty();
    }
  }
}
