package ca.gc.cra.pdfhasher.domain.document;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class FilenameParserTest {
  @Test
  void parsesCaseTypeAndDateFromPrefixedName() {
    FilingAttributes attributes = FilenameParser.parse("MCRO_2024-001_Order_2024-05-01_x.pdf");

    assertEquals(new FilingAttributes("2024-001", "Order", "2024-05-01"), attributes);
  }

  @Test
  void unprefixedNameYieldsBlanks() {
    assertEquals(FilingAttributes.empty(), FilenameParser.parse("random.pdf"));
  }

  @Test
  void prefixIsCaseSensitive() {
    assertEquals(FilingAttributes.empty(), FilenameParser.parse("mcro_2024-001_Order_2024-05-01.pdf"));
  }

  @Test
  void missingTrailingFieldsAreBlankAndSuffixIsStripped() {
    assertEquals(new FilingAttributes("2024-001", "Order", ""), FilenameParser.parse("MCRO_2024-001_Order.pdf"));
    assertEquals(new FilingAttributes("2024-001", "", ""), FilenameParser.parse("MCRO_2024-001.PDF"));
  }

  @Test
  void dateFieldLosesDocumentSuffixWhenLast() {
    assertEquals(
        new FilingAttributes("77", "Motion", "2023-12-31"),
        FilenameParser.parse("MCRO_77_Motion_2023-12-31.pdf"));
  }

  @Test
  void suffixIsStrippedOnlyFromTheLastField() {
    assertEquals(new FilingAttributes("a.pdf", "b", "c"), FilenameParser.parse("MCRO_a.pdf_b_c_x.pdf"));
    assertEquals(new FilingAttributes("a", "b.PDF", "c"), FilenameParser.parse("MCRO_a_b.PDF_c.pdf"));
  }

  @Test
  void nullNameYieldsBlanks() {
    assertEquals(FilingAttributes.empty(), FilenameParser.parse(null));
  }
}
