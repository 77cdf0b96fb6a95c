package ca.gc.cra.pdfhasher.application.port;

import java.nio.file.Path;

/**
 * Produces the line-oriented signature report of a document.
 *
 * <p>The report is parsed by {@code SignatureReportParser}; providers never interpret it.</p>
 *
 * @since 0.1.0
 */
public interface SignatureReportProvider {
  /**
   * Returns the raw signature report.
   *
   * @param document document path
   * @return report text, empty when the document is unsigned or the tool is unavailable
   */
  String report(Path document);

  /** Provider used when no signature tool is installed. */
  SignatureReportProvider NONE = document -> "";
}
