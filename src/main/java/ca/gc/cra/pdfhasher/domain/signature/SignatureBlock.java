package ca.gc.cra.pdfhasher.domain.signature;

/**
 * Fields captured for one signature in a report.
 *
 * @param commonName signer certificate common name; empty when not reported
 * @param signingTime normalized {@code yyyy-MM-dd HH:mm:ss}, or the raw reported text when it could
 *     not be normalized; empty when not reported
 * @param byteRanges signed byte ranges exactly as reported; empty when not reported
 * @since 0.1.0
 */
public record SignatureBlock(String commonName, String signingTime, String byteRanges) {
  private static final SignatureBlock EMPTY = new SignatureBlock("", "", "");

  public SignatureBlock {
    commonName = commonName == null ? "" : commonName;
    signingTime = signingTime == null ? "" : signingTime;
    byteRanges = byteRanges == null ? "" : byteRanges;
  }

  /**
   * Returns the all-blank block.
   *
   * @return shared empty block
   */
  public static SignatureBlock empty() {
    return EMPTY;
  }

  SignatureBlock withCommonName(String value) {
    return new SignatureBlock(value, signingTime, byteRanges);
  }

  SignatureBlock withSigningTime(String value) {
    return new SignatureBlock(commonName, value, byteRanges);
  }

  SignatureBlock withByteRanges(String value) {
    return new SignatureBlock(commonName, signingTime, value);
  }
}
