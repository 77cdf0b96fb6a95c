package ca.gc.cra.pdfhasher.domain.table;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.pdfhasher.domain.document.AuthorCreator;
import ca.gc.cra.pdfhasher.domain.document.ExtractedObject;
import ca.gc.cra.pdfhasher.domain.document.FilingAttributes;
import ca.gc.cra.pdfhasher.domain.signature.SignatureReportParser;
import java.util.List;
import org.junit.jupiter.api.Test;

class ObjectRowTest {
  @Test
  void fieldsFollowColumnOrder() {
    ObjectRow row = new ObjectRow(
        new FilingAttributes("2024-001", "Order", "2024-05-01"),
        "MCRO_2024-001_Order_2024-05-01.pdf",
        new ExtractedObject("font-0003.ttf", "f".repeat(64), ".ttf", "Times\tNew Roman"),
        SignatureReportParser.parse("Signature #2:\n - Signer Certificate Common Name: Clerk\n"
            + " - Signing Time: Jan 02 2024 03:04:05\n - Signed Ranges: [0 - 9]"),
        new AuthorCreator(" Alice ", "Writer"));

    List<String> fields = row.fields();

    assertEquals(ObjectsSchema.COLUMN_COUNT, fields.size());
    assertEquals("2024-001", fields.get(0));
    assertEquals("f".repeat(64), fields.get(ObjectsSchema.HASH_COLUMN));
    assertEquals("font-0003.ttf", fields.get(5));
    assertEquals("", fields.get(8));
    assertEquals("Clerk", fields.get(9));
    assertEquals("Alice", fields.get(10));
    assertEquals("Writer", fields.get(11));
    assertEquals("2024-01-02 03:04:05", fields.get(15));
    assertEquals("[0 - 9]", fields.get(19));
  }

  @Test
  void tsvLineReplacesEmbeddedTabs() {
    ObjectRow row = new ObjectRow(
        FilingAttributes.empty(),
        "doc.pdf",
        new ExtractedObject("font.ttf", "a".repeat(64), ".ttf", "Times\tNew Roman"),
        SignatureReportParser.parse(""),
        AuthorCreator.empty());

    String[] fields = TsvFields.split(row.toTsvLine());

    assertEquals(ObjectsSchema.COLUMN_COUNT, fields.length);
    assertEquals("Times New Roman", fields[7]);
  }
}
