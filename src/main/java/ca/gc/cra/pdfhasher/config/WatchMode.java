package ca.gc.cra.pdfhasher.config;

import java.util.Locale;

/**
 * How {@code --monitor} notices new documents.
 *
 * @since 0.1.0
 */
public enum WatchMode {
  /** Native events when the platform supports them, otherwise polling. */
  AUTO,
  /** {@link java.nio.file.WatchService} events only. */
  NATIVE,
  /** Periodic rescans every {@code pollSeconds}. */
  POLL;

  /**
   * Parses a configured value; blank selects {@link #AUTO}.
   *
   * @param value textual mode
   * @return parsed mode
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static WatchMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return AUTO;
    }
    try {
      return WatchMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown watch.mode: " + value + " (expected auto|native|poll)", ex);
    }
  }
}
