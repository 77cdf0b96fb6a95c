package ca.gc.cra.pdfhasher.domain.signature;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Line scanner turning a signature verification report into a {@link SignatureReport}.
 * <p><strong>Why:</strong> Keeps the report format knowledge out of the ingest pipeline and testable without
 * the external verifier installed.</p>
 * <p><strong>Role:</strong> Domain parser invoked once per document by the processing coordinator.</p>
 * <p><strong>State machine:</strong> the scanner is either {@code OUTSIDE} a block or {@code INSIDE(n)}
 * for {@code n} in {@code 1..4}. A {@code Signature #n:} line moves to {@code INSIDE(n)} when {@code n}
 * is in range and to {@code OUTSIDE} otherwise, so fields of a fifth block never overwrite the fourth.
 * Inside a block the common name, signing time and signed ranges lines populate that block; every other
 * line is ignored.</p>
 * <p><strong>Thread-safety:</strong> Stateless; each call uses its own scanner state.</p>
 *
 * @since 0.1.0
 */
public final class SignatureReportParser {
  private static final Pattern BLOCK_START = Pattern.compile("^Signature\\s+#(\\d+):");
  private static final Pattern COMMON_NAME =
      Pattern.compile("Signer\\s+Certificate\\s+Common\\s+Name:\\s(.*)$");
  private static final Pattern SIGNING_TIME = Pattern.compile("Signing\\s+Time:\\s(.*)$");
  private static final Pattern SIGNED_RANGES = Pattern.compile("Signed\\s+Ranges:\\s(.*)$");

  private static final int OUTSIDE = 0;

  private SignatureReportParser() {}

  /**
   * Parses report text.
   *
   * @param reportText full report; {@code null} or blank yields {@link SignatureReport#empty()}
   * @return report holding up to four blocks
   */
  public static SignatureReport parse(String reportText) {
    if (reportText == null || reportText.isBlank()) {
      return SignatureReport.empty();
    }
    SignatureBlock[] blocks = new SignatureBlock[SignatureReport.MAX_BLOCKS];
    int current = OUTSIDE;
    for (String rawLine : reportText.split("\\R")) {
      String line = rawLine.strip();
      Matcher start = BLOCK_START.matcher(line);
      if (start.find()) {
        current = blockIndex(start.group(1));
        continue;
      }
      if (current == OUTSIDE) {
        continue;
      }
      SignatureBlock block = blocks[current - 1] == null ? SignatureBlock.empty() : blocks[current - 1];
      Matcher m = COMMON_NAME.matcher(line);
      if (m.find()) {
        blocks[current - 1] = block.withCommonName(m.group(1).strip());
        continue;
      }
      m = SIGNING_TIME.matcher(line);
      if (m.find()) {
        blocks[current - 1] = block.withSigningTime(SigningTimeNormalizer.normalize(m.group(1)));
        continue;
      }
      m = SIGNED_RANGES.matcher(line);
      if (m.find()) {
        blocks[current - 1] = block.withByteRanges(m.group(1).strip());
      }
    }
    return new SignatureReport(blocks);
  }

  private static int blockIndex(String digits) {
    try {
      int index = Integer.parseInt(digits);
      return index >= 1 && index <= SignatureReport.MAX_BLOCKS ? index : OUTSIDE;
    } catch (NumberFormatException ex) {
      return OUTSIDE;
    }
  }
}
