package ca.gc.cra.pdfhasher.infrastructure.pdf;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.pdfhasher.domain.document.AuthorCreator;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PdfBoxAuthorCreatorProviderTest {
  @TempDir Path dir;

  private final PdfBoxAuthorCreatorProvider provider = new PdfBoxAuthorCreatorProvider();

  @Test
  void readsInformationDictionary() throws Exception {
    Path file = dir.resolve("with-info.pdf");
    try (PDDocument doc = new PDDocument()) {
      doc.addPage(new PDPage());
      PDDocumentInformation info = doc.getDocumentInformation();
      info.setAuthor("Registry Clerk");
      info.setCreator("Court Forms 3.1");
      doc.save(file.toFile());
    }

    assertEquals(new AuthorCreator("Registry Clerk", "Court Forms 3.1"), provider.authorCreator(file));
  }

  @Test
  void missingEntriesAreBlank() throws Exception {
    Path file = dir.resolve("bare.pdf");
    try (PDDocument doc = new PDDocument()) {
      doc.addPage(new PDPage());
      doc.save(file.toFile());
    }

    assertEquals(AuthorCreator.empty(), provider.authorCreator(file));
  }

  @Test
  void unreadableDocumentYieldsBlank() throws Exception {
    Path file = Files.writeString(dir.resolve("junk.pdf"), "definitely not a pdf");

    assertEquals(AuthorCreator.empty(), provider.authorCreator(file));
  }
}
