package ca.gc.cra.pdfhasher.domain.document;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * One file produced by exploding a document.
 *
 * @param relativePath path relative to the objects directory, always using {@code /} separators
 * @param sha256 lower-case hexadecimal SHA-256 of the object bytes
 * @param extension lower-case extension including the leading dot, or empty
 * @param fontName display name for font objects; empty otherwise
 * @since 0.1.0
 */
public record ExtractedObject(String relativePath, String sha256, String extension, String fontName) {
  /** Longest extension (dot included) that is kept; longer suffixes are treated as no extension. */
  public static final int MAX_EXTENSION_LENGTH = 11;

  private static final Set<String> FONT_EXTENSIONS =
      Set.of(".ttf", ".otf", ".ttc", ".woff", ".woff2", ".pfb", ".pfa");

  public ExtractedObject {
    Objects.requireNonNull(relativePath, "relativePath");
    Objects.requireNonNull(sha256, "sha256");
    extension = extension == null ? "" : extension;
    fontName = fontName == null ? "" : fontName;
  }

  /**
   * Derives the object type column from a file name.
   *
   * <p>Uses the last dot of the name; leading-dot names such as {@code .hidden} have no extension.</p>
   *
   * @param fileName bare file name (no directories)
   * @return lower-case extension with its dot, or empty when absent or longer than
   *     {@link #MAX_EXTENSION_LENGTH}
   */
  public static String extensionOf(String fileName) {
    if (fileName == null) {
      return "";
    }
    int dot = fileName.lastIndexOf('.');
    if (dot <= 0 || dot == fileName.length() - 1) {
      return "";
    }
    String ext = fileName.substring(dot).toLowerCase(Locale.ROOT);
    return ext.length() > MAX_EXTENSION_LENGTH ? "" : ext;
  }

  /**
   * Indicates whether an extension belongs to a recognized font container.
   *
   * @param extension lower-case extension with its dot
   * @return {@code true} for TrueType, OpenType, WOFF and Type 1 files
   */
  public static boolean isFontExtension(String extension) {
    return extension != null && FONT_EXTENSIONS.contains(extension);
  }
}
