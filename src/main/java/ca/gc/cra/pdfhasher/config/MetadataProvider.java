package ca.gc.cra.pdfhasher.config;

import java.util.Locale;

/**
 * Source of the Author and Creator document properties.
 *
 * @since 0.1.0
 */
public enum MetadataProvider {
  /** exiftool when installed, otherwise PDFBox. */
  AUTO,
  EXIFTOOL,
  PDFBOX;

  /**
   * Parses a configured value; blank selects {@link #AUTO}.
   *
   * @param value textual provider name
   * @return parsed provider
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static MetadataProvider fromString(String value) {
    if (value == null || value.isBlank()) {
      return AUTO;
    }
    try {
      return MetadataProvider.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "Unknown metadata.provider: " + value + " (expected auto|exiftool|pdfbox)", ex);
    }
  }
}
