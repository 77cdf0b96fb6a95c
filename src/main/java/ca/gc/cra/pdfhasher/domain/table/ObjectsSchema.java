package ca.gc.cra.pdfhasher.domain.table;

import java.util.List;

/**
 * <strong>What:</strong> Versioned header of the object table and the one supported migration.
 * <p><strong>Why:</strong> Tables created by the earlier five-column release must keep their rows when the
 * case, signature and author columns were added.</p>
 * <p><strong>Role:</strong> Pure schema transformer keyed by exact header match; the persistence adapter
 * performs the atomic rewrite.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Recognize the current and the legacy five-column headers.</li>
 *   <li>Pad legacy rows with {@value #LEGACY_LEADING_BLANKS} leading and {@value #LEGACY_TRAILING_BLANKS}
 *   trailing blank fields.</li>
 *   <li>Leave any other header untouched.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class ObjectsSchema {
  /** Column names of the current schema in order. */
  public static final List<String> CURRENT_COLUMNS = List.of(
      "Case Number", "Filing Type", "Filing Date",
      "SHA256 Hash Value", "Pdf File Name", "Pdf Internal Object Path", "Object Type", "Font Name",
      "Sig #1 Common Name", "Sig #2 Common Name", "Author", "Creator",
      "Sig #3 Common Name", "Sig #4 Common Name",
      "Sig #1 Signing Time", "Sig #2 Signing Time", "Sig #3 Signing Time", "Sig #4 Signing Time",
      "Sig #1 Byte Ranges", "Sig #2 Byte Ranges", "Sig #3 Byte Ranges", "Sig #4 Byte Ranges");

  /** Column names written by the first release. */
  public static final List<String> LEGACY_COLUMNS = List.of(
      "SHA256 Hash Value", "Pdf File Name", "Pdf Internal Object Path", "Object Type", "Font Name");

  /** Header line of the current schema. */
  public static final String CURRENT_HEADER = String.join("\t", CURRENT_COLUMNS);

  /** Header line of the legacy five-column schema. */
  public static final String LEGACY_HEADER = String.join("\t", LEGACY_COLUMNS);

  /** Number of columns in the current schema. */
  public static final int COLUMN_COUNT = CURRENT_COLUMNS.size();

  /** Zero-based index of the content hash column in the current schema. */
  public static final int HASH_COLUMN = 3;

  /** Zero-based index of the document name column in the current schema. */
  public static final int DOCUMENT_NAME_COLUMN = 4;

  static final int LEGACY_LEADING_BLANKS = 3;
  static final int LEGACY_TRAILING_BLANKS = 14;

  private static final String LEADING_PAD = "\t".repeat(LEGACY_LEADING_BLANKS);
  private static final String TRAILING_PAD = "\t".repeat(LEGACY_TRAILING_BLANKS);

  private ObjectsSchema() {}

  /** Layout detected from a table's first line. */
  public enum Layout {
    /** File missing or zero bytes long; the current header must be written. */
    EMPTY,
    /** Header matches the current schema. */
    CURRENT,
    /** Header matches the legacy five-column schema; rows need padding. */
    LEGACY_FIVE_COLUMN,
    /** Any other header; left untouched. */
    CUSTOM
  }

  /**
   * Classifies a table by its first line.
   *
   * @param firstLine first line without its newline; {@code null} only for a zero-byte file. A blank first
   *     line in a non-empty file is a custom header.
   * @return detected layout
   */
  public static Layout classify(String firstLine) {
    if (firstLine == null) {
      return Layout.EMPTY;
    }
    String header = stripCarriageReturn(firstLine);
    if (header.equals(CURRENT_HEADER)) {
      return Layout.CURRENT;
    }
    if (header.equals(LEGACY_HEADER)) {
      return Layout.LEGACY_FIVE_COLUMN;
    }
    return Layout.CUSTOM;
  }

  /**
   * Rewrites one legacy data row into the current schema.
   *
   * @param legacyRow data row of a five-column table, without its newline
   * @return row with three blank leading and fourteen blank trailing fields
   */
  public static String migrateLegacyRow(String legacyRow) {
    return LEADING_PAD + stripCarriageReturn(legacyRow) + TRAILING_PAD;
  }

  private static String stripCarriageReturn(String line) {
    return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
  }
}
