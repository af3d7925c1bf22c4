package eventsync.receive;

import eventsync.filter.EventFilter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Set;

/**
 * Query parameters of a feed request.
 *
 * @param since      inclusive lower bound on record creation time, {@code null} for none
 * @param eventTypes types to export; empty for all
 * @param limit      maximum number of events
 */
public record FeedQuery(Instant since, Set<String> eventTypes, int limit) {
  public static final int DEFAULT_LIMIT = 10;

  private static final DateTimeFormatter SINCE_FORMAT = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .optionalStart()
      .appendLiteral('T')
      .append(DateTimeFormatter.ISO_LOCAL_TIME)
      .optionalStart()
      .appendOffsetId()
      .optionalEnd()
      .optionalEnd()
      .toFormatter();

  public FeedQuery {
    eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
  }

  /**
   * Builds a query from raw request parameters.
   *
   * @param since     ISO-8601 instant, local date-time (UTC) or date; blank for none
   * @param eventType one type or a comma-separated list; blank for all
   * @param limit     positive integer; blank for {@link #DEFAULT_LIMIT}
   * @throws IllegalArgumentException if a parameter cannot be parsed
   */
  public static FeedQuery parse(String since, String eventType, String limit) {
    int parsedLimit = DEFAULT_LIMIT;
    if (limit != null && !limit.isBlank()) {
      try {
        parsedLimit = Integer.parseInt(limit.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("limit must be an integer but was '" + limit + "'", e);
      }
    }
    return new FeedQuery(parseInstant(since), EventFilter.splitCsv(eventType), parsedLimit);
  }

  static Instant parseInstant(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    TemporalAccessor parsed;
    try {
      parsed = SINCE_FORMAT.parseBest(value.trim().replace(' ', 'T'),
          OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("since must be an ISO-8601 timestamp but was '"
          + value + "'", e);
    }
    if (parsed instanceof OffsetDateTime offsetDateTime) {
      return offsetDateTime.toInstant();
    }
    if (parsed instanceof LocalDateTime localDateTime) {
      return localDateTime.toInstant(ZoneOffset.UTC);
    }
    return ((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC);
  }
}
