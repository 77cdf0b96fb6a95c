package ca.gc.cra.pdfhasher.domain.document;

import java.util.Locale;

/**
 * Parses filing attributes out of {@code MCRO_<case>_<type>_<date>[_...].pdf} document names.
 *
 * <p>Only the first three underscore-separated fields after the prefix are kept. The {@code .pdf}
 * suffix is removed from whichever kept field ends up holding it, so no attribute absorbs the file
 * extension. Names without the prefix yield blank attributes.</p>
 *
 * @since 0.1.0
 */
public final class FilenameParser {
  /** Literal prefix marking names that carry filing attributes. */
  public static final String PREFIX = "MCRO_";

  private static final String DOCUMENT_SUFFIX = ".pdf";
  private static final char DELIMITER = '_';

  private FilenameParser() {}

  /**
   * Parses a document base name.
   *
   * @param baseName file name without directories; {@code null} is treated as blank
   * @return parsed attributes; never {@code null}
   */
  public static FilingAttributes parse(String baseName) {
    if (baseName == null || !baseName.startsWith(PREFIX)) {
      return FilingAttributes.empty();
    }
    String rest = baseName.substring(PREFIX.length());
    String[] fields = new String[3];
    int start = 0;
    for (int i = 0; i < fields.length; i++) {
      if (start > rest.length()) {
        fields[i] = "";
        continue;
      }
      int end = rest.indexOf(DELIMITER, start);
      if (end < 0) {
        end = rest.length();
      }
      String field = rest.substring(start, end);
      fields[i] = end == rest.length() ? stripDocumentSuffix(field) : field;
      start = end + 1;
    }
    return new FilingAttributes(fields[0], fields[1], fields[2]);
  }

  private static String stripDocumentSuffix(String field) {
    if (field.toLowerCase(Locale.ROOT).endsWith(DOCUMENT_SUFFIX)) {
      return field.substring(0, field.length() - DOCUMENT_SUFFIX.length());
    }
    return field;
  }
}
