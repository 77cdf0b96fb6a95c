package ca.gc.cra.pdfhasher.application.port;

import java.nio.file.Path;

/**
 * Looks up the display name of an extracted font file.
 *
 * @since 0.1.0
 */
public interface FontNameProvider {
  /**
   * Returns the font's display name.
   *
   * @param fontFile extracted font object
   * @return first reported name, or empty when unknown
   */
  String fontName(Path fontFile);

  /** Provider used when no font tool is installed. */
  FontNameProvider NONE = fontFile -> "";
}
