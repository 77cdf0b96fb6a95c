package ca.gc.cra.pdfhasher.domain.table;

import ca.gc.cra.pdfhasher.domain.document.DocumentFingerprint;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Authoritative record that a document was fully processed.
 *
 * <p>Line format: {@code sha\tname\tbytes\tmtimeEpochSeconds\tcompletedAtUtc}.</p>
 *
 * @param sha256 document content hash
 * @param fileName document name at completion
 * @param sizeBytes document size
 * @param modifiedEpochSeconds document modification time
 * @param completedAt completion instant, truncated to seconds
 * @since 0.1.0
 */
public record LedgerEntry(
    String sha256, String fileName, long sizeBytes, long modifiedEpochSeconds, Instant completedAt) {
  private static final Pattern SHA256_HEX = Pattern.compile("^[0-9a-f]{64}$");
  private static final DateTimeFormatter COMPLETED_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);
  private static final int FIELD_COUNT = 5;

  public LedgerEntry {
    Objects.requireNonNull(sha256, "sha256");
    Objects.requireNonNull(fileName, "fileName");
    Objects.requireNonNull(completedAt, "completedAt");
    completedAt = completedAt.truncatedTo(ChronoUnit.SECONDS);
  }

  /**
   * Creates an entry for a document completing at {@code completedAt}.
   *
   * @param document fingerprint of the completed document
   * @param completedAt completion time
   * @return ledger entry
   */
  public static LedgerEntry of(DocumentFingerprint document, Instant completedAt) {
    return new LedgerEntry(
        document.sha256(),
        document.fileName(),
        document.sizeBytes(),
        document.modifiedEpochSeconds(),
        completedAt);
  }

  /**
   * Renders the ledger line without its newline.
   *
   * @return tab-separated line
   */
  public String toTsvLine() {
    return TsvFields.join(List.of(
        sha256,
        fileName,
        Long.toString(sizeBytes),
        Long.toString(modifiedEpochSeconds),
        COMPLETED_FORMAT.format(completedAt)));
  }

  /**
   * Extracts and validates the hash column of a ledger line.
   *
   * @param line ledger line without its newline; must not be blank
   * @param lineNumber one-based position used in diagnostics
   * @return the line's document hash
   * @throws LedgerCorruptionException if the line has too few fields or the hash is not SHA-256 hex
   */
  public static String hashOf(String line, long lineNumber) {
    String[] fields = TsvFields.split(line);
    if (fields.length < FIELD_COUNT) {
      throw new LedgerCorruptionException(
          "ledger entry has " + fields.length + " fields, expected " + FIELD_COUNT, lineNumber);
    }
    String sha = fields[0].strip();
    if (!SHA256_HEX.matcher(sha).matches()) {
      throw new LedgerCorruptionException("ledger entry hash is not a SHA-256 hex digest", lineNumber);
    }
    return sha;
  }
}
