package ca.gc.cra.pdfhasher.domain.signature;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SignatureReportParserTest {
  private static final String TWO_SIGNATURES = String.join("\n",
      "Digital Signature Info of: MCRO_1_Order_2024-01-01.pdf",
      "Signature #1:",
      "  - Signer Certificate Common Name: Judge Alice",
      "  - Signer full Distinguished Name: CN=Judge Alice,O=Court",
      "  - Signing Time: Jan 05 2024 10:11:12",
      "  - Signing Hash Algorithm: SHA-256",
      "  - Signed Ranges: [0 - 1000], [3000 - 5000]",
      "  - Total document signed",
      "Signature #2:",
      "  - Signer Certificate Common Name: Clerk Bob",
      "  - Signing Time garbled line without colon",
      "  - Signed Ranges: [0 - 6000], [8000 - 9000]");

  @Test
  void parsesTwoBlocksAndToleratesMalformedLine() {
    SignatureReport report = SignatureReportParser.parse(TWO_SIGNATURES);

    assertEquals(
        new SignatureBlock("Judge Alice", "2024-01-05 10:11:12", "[0 - 1000], [3000 - 5000]"),
        report.block(1));
    assertEquals(new SignatureBlock("Clerk Bob", "", "[0 - 6000], [8000 - 9000]"), report.block(2));
    assertEquals(SignatureBlock.empty(), report.block(3));
    assertEquals(SignatureBlock.empty(), report.block(4));
  }

  @Test
  void linesBeforeFirstBlockAreIgnored() {
    SignatureReport report = SignatureReportParser.parse(
        "  - Signer Certificate Common Name: Nobody\nSignature #1:\n  - Signer Certificate Common Name: Someone");

    assertEquals("Someone", report.block(1).commonName());
  }

  @Test
  void blocksBeyondFourAreDropped() {
    StringBuilder text = new StringBuilder();
    for (int i = 1; i <= 5; i++) {
      text.append("Signature #").append(i).append(":\n")
          .append("  - Signer Certificate Common Name: Signer ").append(i).append('\n');
    }

    SignatureReport report = SignatureReportParser.parse(text.toString());

    assertEquals(SignatureReport.MAX_BLOCKS, report.blocks().size());
    assertEquals("Signer 4", report.block(4).commonName());
  }

  @Test
  void fieldsAfterOutOfRangeBlockDoNotLeakIntoPreviousBlock() {
    String text = "Signature #4:\n  - Signer Certificate Common Name: Four\n"
        + "Signature #5:\n  - Signer Certificate Common Name: Five\n";

    SignatureReport report = SignatureReportParser.parse(text);

    assertEquals("Four", report.block(4).commonName());
  }

  @Test
  void emptyOrUnsignedReportYieldsNoSignatures() {
    assertFalse(SignatureReportParser.parse("").hasSignatures());
    assertFalse(SignatureReportParser.parse("File 'x.pdf' does not contain any signatures\n").hasSignatures());
    assertTrue(SignatureReportParser.parse(TWO_SIGNATURES).hasSignatures());
  }

  @Test
  void handlesWindowsLineEndings() {
    SignatureReport report = SignatureReportParser.parse(TWO_SIGNATURES.replace("\n", "\r\n"));

    assertEquals("Judge Alice", report.block(1).commonName());
    assertEquals("Clerk Bob", report.block(2).commonName());
  }
}
