package ca.gc.cra.docket.application.normalize;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Parses the timestamp encodings seen in upstream payloads.
 *
 * <p>Accepted: epoch milliseconds (number or digit string, positive), ISO-8601 instants, offset and zoned
 * date-times, local date-times (read as UTC), and plain dates (UTC start of day). A space between date and time is
 * accepted in place of {@code T}.</p>
 *
 * @since 0.1.0
 */
public final class TimestampParser {
  private static final Pattern DIGITS = Pattern.compile("\\d{1,15}");
  private static final Pattern SPACED_DATE_TIME = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) (\\d{2}:.*)$");
  private static final List<Function<String, Instant>> TEXT_PARSERS = List.of(
      Instant::parse,
      text -> OffsetDateTime.parse(text).toInstant(),
      text -> ZonedDateTime.parse(text).toInstant(),
      text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
      text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());

  private static final Instant MIN_MILLIS_INSTANT = Instant.ofEpochMilli(Long.MIN_VALUE);
  private static final Instant MAX_MILLIS_INSTANT = Instant.ofEpochMilli(Long.MAX_VALUE);

  private TimestampParser() {
    // Utility
  }

  /**
   * Parses a raw field value.
   *
   * @param value raw value from the payload
   * @return instant, or empty when the value is not a recognizable timestamp
   */
  public static Optional<Instant> parse(Object value) {
    if (value instanceof Number number) {
      long millis = number.longValue();
      return millis > 0 ? Optional.of(Instant.ofEpochMilli(millis)) : Optional.empty();
    }
    if (value instanceof String text) {
      return parseText(text.trim());
    }
    return Optional.empty();
  }

  private static Optional<Instant> parseText(String text) {
    if (text.isEmpty()) {
      return Optional.empty();
    }
    if (DIGITS.matcher(text).matches()) {
      long millis = Long.parseLong(text);
      return millis > 0 ? Optional.of(Instant.ofEpochMilli(millis)) : Optional.empty();
    }
    String iso = SPACED_DATE_TIME.matcher(text).replaceFirst("$1T$2");
    for (Function<String, Instant> parser : TEXT_PARSERS) {
      try {
        return Optional.of(parser.apply(iso)).filter(TimestampParser::fitsEpochMillis);
      } catch (DateTimeParseException ex) {
        continue;
      }
    }
    return Optional.empty();
  }

  // Timelines are ordered and rendered in epoch milliseconds; years beyond that range are unusable.
  private static boolean fitsEpochMillis(Instant instant) {
    return !instant.isBefore(MIN_MILLIS_INSTANT) && !instant.isAfter(MAX_MILLIS_INSTANT);
  }
}
