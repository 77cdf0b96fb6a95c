package ca.gc.cra.pdfhasher.validation;

import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through the CLI or YAML configuration.
 * <p><strong>Why:</strong> Tool executables, endpoints and resource attributes reach external processes;
 * rejecting blank or control-character values up front keeps failures close to their cause.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value contains only printable ASCII characters and fits within {@code maxLength}.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; must be non-null
   * @param maxLength maximum permitted length in characters
   * @return validated, trimmed value containing only characters {@code 0x20-0x7E}
   * @throws IllegalArgumentException if the value is blank, too long, or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Matches {@code value} case-insensitively against a closed set of choices.
   *
   * @param name logical name for diagnostics
   * @param value candidate value
   * @param choices permitted lowercase values
   * @return the matching choice in lowercase
   * @throws IllegalArgumentException if {@code value} is blank or not one of {@code choices}
   */
  public static String requireOneOf(String name, String value, String... choices) {
    String sanitized = requireNonBlank(name, value).toLowerCase(Locale.ROOT);
    for (String choice : choices) {
      if (choice.equals(sanitized)) {
        return choice;
      }
    }
    throw new IllegalArgumentException(
        message(name, "must be one of " + String.join("|", choices) + " (was " + value + ")"));
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
