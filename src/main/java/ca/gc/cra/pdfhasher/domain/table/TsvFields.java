package ca.gc.cra.pdfhasher.domain.table;

import java.util.List;

/**
 * Helpers for writing tab-separated lines.
 *
 * @since 0.1.0
 */
public final class TsvFields {
  /** Field separator. */
  public static final char TAB = '\t';

  private TsvFields() {}

  /**
   * Replaces tabs and line breaks so a value occupies exactly one field.
   *
   * @param value raw value; {@code null} becomes empty
   * @return value safe to place in a single field
   */
  public static String clean(String value) {
    if (value == null || value.isEmpty()) {
      return "";
    }
    StringBuilder sb = null;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '\t' || c == '\n' || c == '\r') {
        if (sb == null) {
          sb = new StringBuilder(value.length());
          sb.append(value, 0, i);
        }
        sb.append(' ');
      } else if (sb != null) {
        sb.append(c);
      }
    }
    return sb == null ? value : sb.toString();
  }

  /**
   * Joins cleaned values with tabs (no trailing newline).
   *
   * @param values field values in column order
   * @return joined line
   */
  public static String join(List<String> values) {
    StringBuilder sb = new StringBuilder(values.size() * 16);
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        sb.append(TAB);
      }
      sb.append(clean(values.get(i)));
    }
    return sb.toString();
  }

  /**
   * Splits a line on tabs, keeping trailing empty fields.
   *
   * @param line table line without its newline
   * @return fields in column order
   */
  public static String[] split(String line) {
    return line.split("\t", -1);
  }
}
