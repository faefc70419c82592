package io.breland.calhub.server.calendar;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import lombok.extern.slf4j.Slf4j;

/** Parsing for the ISO-8601 text backends use for event start and end. */
@Slf4j
public final class EventTimes {

  private EventTimes() {}

  public static boolean isDateOnly(String value) {
    return value != null && value.length() == 10 && value.indexOf('T') < 0;
  }

  /**
   * Resolves a date, a local date-time or an offset date-time to an instant. Values without an
   * offset are read in {@code fallbackZone}. Returns null when the text is not a date.
   */
  public static Instant toInstant(String value, ZoneId fallbackZone) {
    if (value == null || value.isBlank()) {
      return null;
    }
    ZoneId zone = fallbackZone != null ? fallbackZone : ZoneId.systemDefault();
    try {
      if (isDateOnly(value)) {
        return LocalDate.parse(value).atStartOfDay(zone).toInstant();
      }
      TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(
              value, ZonedDateTime::from, LocalDateTime::from);
      if (parsed instanceof ZonedDateTime zoned) {
        return zoned.toInstant();
      }
      return ((LocalDateTime) parsed).atZone(zone).toInstant();
    } catch (DateTimeParseException e) {
      log.debug("Ignoring unparseable event time {}", value);
      return null;
    }
  }

  /** Like {@link #toInstant} but only for values that carry their own offset. */
  public static Instant toAbsoluteInstant(String value) {
    if (value == null || isDateOnly(value)) {
      return null;
    }
    try {
      return ZonedDateTime.parse(value, DateTimeFormatter.ISO_DATE_TIME).toInstant();
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  /** Equal text, or two offset date-times naming the same instant. */
  public static boolean sameMoment(String left, String right) {
    if (left == null || right == null) {
      return left == null && right == null;
    }
    if (left.equals(right)) {
      return true;
    }
    Instant a = toAbsoluteInstant(left);
    Instant b = toAbsoluteInstant(right);
    return a != null && a.equals(b);
  }

  /** The calendar day an event time falls on in {@code zone}; dates are taken as-is. */
  public static LocalDate localDate(String value, ZoneId zone) {
    if (isDateOnly(value)) {
      try {
        return LocalDate.parse(value);
      } catch (DateTimeParseException e) {
        return null;
      }
    }
    Instant instant = toInstant(value, zone);
    return instant != null ? instant.atZone(zone).toLocalDate() : null;
  }
}
