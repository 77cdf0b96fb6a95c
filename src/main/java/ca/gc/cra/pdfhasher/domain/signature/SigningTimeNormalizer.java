package ca.gc.cra.pdfhasher.domain.signature;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Normalizes signing times reported by signature verifiers to {@code yyyy-MM-dd HH:mm:ss}.
 *
 * <p>Unparseable input is returned trimmed rather than dropped so the table never loses a reported
 * time.</p>
 *
 * @since 0.1.0
 */
public final class SigningTimeNormalizer {
  private static final DateTimeFormatter OUTPUT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);
  private static final DateTimeFormatter MONTH_DAY_YEAR_SECONDS = pattern("MMM d yyyy HH:mm:ss");
  private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
      MONTH_DAY_YEAR_SECONDS,
      pattern("MMM d yyyy HH:mm"),
      pattern("EEE MMM d HH:mm:ss yyyy"),
      pattern("yyyy-MM-dd HH:mm:ss"),
      DateTimeFormatter.ISO_LOCAL_DATE_TIME);
  private static final int DATE_TOKENS = 4;

  private SigningTimeNormalizer() {}

  /**
   * Normalizes a raw signing time.
   *
   * @param raw reported value; {@code null} yields an empty string
   * @return normalized time, or the trimmed raw value when no known format matches
   */
  public static String normalize(String raw) {
    if (raw == null) {
      return "";
    }
    String collapsed = raw.trim().replaceAll("\\s+", " ");
    if (collapsed.isEmpty()) {
      return "";
    }
    for (DateTimeFormatter format : LOCAL_FORMATS) {
      try {
        return LocalDateTime.parse(collapsed, format).format(OUTPUT);
      } catch (DateTimeParseException ignored) {
        // next format
      }
    }
    try {
      return OffsetDateTime.parse(collapsed).toLocalDateTime().format(OUTPUT);
    } catch (DateTimeParseException ignored) {
      // fall through to token trimming
    }
    // Verifiers may append a zone or locale suffix after "Mon DD YYYY HH:MM:SS".
    String[] tokens = collapsed.split(" ");
    if (tokens.length > DATE_TOKENS) {
      String leading = String.join(" ", List.of(tokens).subList(0, DATE_TOKENS));
      try {
        return LocalDateTime.parse(leading, MONTH_DAY_YEAR_SECONDS).format(OUTPUT);
      } catch (DateTimeParseException ignored) {
        // keep raw
      }
    }
    return raw.trim();
  }

  private static DateTimeFormatter pattern(String pattern) {
    return new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(pattern)
        .toFormatter(Locale.ENGLISH);
  }
}
