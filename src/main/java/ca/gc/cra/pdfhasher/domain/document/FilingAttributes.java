package ca.gc.cra.pdfhasher.domain.document;

/**
 * Case/filing attributes encoded in court filing names.
 *
 * @param caseNumber case number field; empty when absent
 * @param filingType filing type field; empty when absent
 * @param filingDate filing date field as written in the name; empty when absent
 * @since 0.1.0
 */
public record FilingAttributes(String caseNumber, String filingType, String filingDate) {
  private static final FilingAttributes EMPTY = new FilingAttributes("", "", "");

  public FilingAttributes {
    caseNumber = caseNumber == null ? "" : caseNumber;
    filingType = filingType == null ? "" : filingType;
    filingDate = filingDate == null ? "" : filingDate;
  }

  /**
   * Returns the all-blank attribute set used for names without the filing prefix.
   *
   * @return shared empty attributes
   */
  public static FilingAttributes empty() {
    return EMPTY;
  }
}
