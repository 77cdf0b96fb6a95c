package ca.gc.cra.pdfhasher.domain.document;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Maps document names to extraction directory names.
 *
 * <p>The readable part keeps {@code [A-Za-z0-9._-]} and replaces everything else with {@code _}.
 * A short digest of the untouched name is appended, so {@code "a b.pdf"} and {@code "a_b.pdf"} land
 * in different directories.</p>
 *
 * @since 0.1.0
 */
public final class SafeNames {
  private static final int DIGEST_HEX_CHARS = 12;
  private static final int MAX_READABLE_CHARS = 120;

  private SafeNames() {}

  /**
   * Returns the extraction directory name for a document.
   *
   * @param documentName base name of the document; must not be blank
   * @return deterministic, filesystem-safe directory name
   * @throws IllegalArgumentException if {@code documentName} is blank
   */
  public static String forDocument(String documentName) {
    if (documentName == null || documentName.isBlank()) {
      throw new IllegalArgumentException("documentName must not be blank");
    }
    String base = documentName;
    if (base.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
      base = base.substring(0, base.length() - 4);
    }
    StringBuilder sb = new StringBuilder(Math.min(base.length(), MAX_READABLE_CHARS) + DIGEST_HEX_CHARS + 1);
    for (int i = 0; i < base.length() && sb.length() < MAX_READABLE_CHARS; i++) {
      char c = base.charAt(i);
      if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
          || c == '.' || c == '_' || c == '-') {
        sb.append(c);
      } else {
        sb.append('_');
      }
    }
    if (sb.length() == 0 || sb.charAt(0) == '.') {
      sb.insert(0, 'x');
    }
    sb.append('-').append(nameDigest(documentName));
    return sb.toString();
  }

  private static String nameDigest(String name) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(name.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash).substring(0, DIGEST_HEX_CHARS);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }
}
