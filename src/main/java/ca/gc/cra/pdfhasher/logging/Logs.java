package ca.gc.cra.pdfhasher.logging;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Helpers for putting external-tool output into log records.
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final Pattern LINE_BREAKS = Pattern.compile("\\s*\\R\\s*");

  private Logs() {}

  /**
   * Keeps at most {@code maxBytes} UTF-8 bytes of {@code value}, cutting only between code points and noting how
   * many bytes were dropped.
   *
   * @param value text to bound; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return {@code value} itself when it fits, otherwise a prefix followed by {@code "... [+N bytes]"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return "<null>";
    }
    int total = value.getBytes(StandardCharsets.UTF_8).length;
    if (total <= maxBytes) {
      return value;
    }
    int used = 0;
    int end = 0;
    while (end < value.length()) {
      int cp = value.codePointAt(end);
      int width = utf8Width(cp);
      if (used + width > maxBytes) {
        break;
      }
      used += width;
      end += Character.charCount(cp);
    }
    return value.substring(0, end) + "... [+" + (total - used) + " bytes]";
  }

  /**
   * Joins the lines of a multi-line tool message with {@code " | "}.
   *
   * @param value text possibly containing line breaks; {@code null} yields an empty string
   * @return single-line text
   */
  public static String oneLine(String value) {
    return value == null ? "" : LINE_BREAKS.matcher(value.strip()).replaceAll(" | ");
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
