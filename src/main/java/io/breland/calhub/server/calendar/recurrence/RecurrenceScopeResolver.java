package io.breland.calhub.server.calendar.recurrence;

import io.breland.calhub.server.calendar.EventTimes;
import io.breland.calhub.server.calendar.exceptions.CalendarException;
import io.breland.calhub.server.calendar.exceptions.InvalidRequestException;
import io.breland.calhub.server.calendar.model.CalendarEvent;
import io.breland.calhub.server.calendar.model.CreateEventRequest;
import io.breland.calhub.server.calendar.model.EventPatch;
import io.breland.calhub.server.calendar.model.EventType;
import io.breland.calhub.server.calendar.model.RecurrenceScope;
import io.breland.calhub.server.calendar.source.SourceCapability;
import io.breland.calhub.server.config.CalendarProperties;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Applies updates and deletes to the right part of a recurring series. "This and future" on an
 * occurrence splits the series: the parent is ended the day before the occurrence and a new
 * series is created from the occurrence onwards.
 */
@Slf4j
@Component
public class RecurrenceScopeResolver {
  private static final DateTimeFormatter UNTIL_DATE = DateTimeFormatter.BASIC_ISO_DATE;

  private final CalendarProperties properties;

  public RecurrenceScopeResolver(CalendarProperties properties) {
    this.properties = properties;
  }

  public static RecurrenceScope effectiveScope(CalendarEvent event, RecurrenceScope requested) {
    if (requested != null) {
      return requested;
    }
    if (event.isOccurrence()) {
      return RecurrenceScope.THIS_EVENT;
    }
    if (event.isSeriesParent()) {
      return RecurrenceScope.ALL_EVENTS;
    }
    return RecurrenceScope.THIS_EVENT;
  }

  /** {@code thisAndFuture} only splits occurrences; on the parent it means the whole series. */
  static RecurrenceScope resolve(CalendarEvent event, RecurrenceScope requested) {
    RecurrenceScope scope = effectiveScope(event, requested);
    if (scope == RecurrenceScope.THIS_AND_FUTURE && !event.isOccurrence()) {
      return RecurrenceScope.ALL_EVENTS;
    }
    return scope;
  }

  public CalendarEvent update(
      SourceCapability source, CalendarEvent target, EventPatch patch, RecurrenceScope requested) {
    EventFieldRestrictions.check(target.effectiveType(), patch.presentFields());
    EventPatch typed = withTargetType(target, patch);
    RecurrenceScope scope = resolve(target, requested);
    log.debug("Updating {} with scope {}", target.id(), scope);
    return switch (scope) {
      case THIS_EVENT -> source.updateEvent(target.id(), typed);
      case ALL_EVENTS -> source.updateEvent(target.seriesId(), typed);
      case THIS_AND_FUTURE -> splitSeries(source, target, typed);
    };
  }

  /** Type-specific properties are written against the type of the event being changed. */
  static EventPatch withTargetType(CalendarEvent target, EventPatch patch) {
    if (patch.properties() == null || patch.eventType() != null) {
      return patch;
    }
    return patch.toBuilder().eventType(target.effectiveType()).build();
  }

  public void delete(SourceCapability source, CalendarEvent target, RecurrenceScope requested) {
    RecurrenceScope scope = resolve(target, requested);
    log.debug("Deleting {} with scope {}", target.id(), scope);
    switch (scope) {
      case THIS_EVENT -> source.deleteEvent(target.id());
      case ALL_EVENTS -> source.deleteEvent(target.seriesId());
      case THIS_AND_FUTURE -> truncateParent(source, target, seriesParent(source, target));
    }
  }

  /** UNTIL value ending a series at 23:59:59 UTC on the day before {@code occurrenceDate}. */
  static String untilBefore(LocalDate occurrenceDate) {
    return occurrenceDate.minusDays(1).format(UNTIL_DATE) + "T235959Z";
  }

  private CalendarEvent splitSeries(
      SourceCapability source, CalendarEvent occurrence, EventPatch patch) {
    CalendarEvent parent = seriesParent(source, occurrence);
    EventType type = parent.effectiveType();
    if (!type.isCreatable()) {
      throw new InvalidRequestException(
          "Cannot split a " + type.apiValue() + " series: its events cannot be created");
    }
    List<String> recurrence =
        patch.recurrence() != null
            ? patch.recurrence()
            : RecurrenceRule.withoutTermination(parent.recurrence());
    CreateEventRequest continuation =
        CreateEventRequest.builder()
            .title(patch.title() != null ? patch.title() : parent.title())
            .start(patch.start() != null ? patch.start() : occurrence.start())
            .end(patch.end() != null ? patch.end() : occurrence.end())
            .allDay(patch.allDay() != null ? patch.allDay() : parent.allDay())
            .location(patch.location() != null ? patch.location() : parent.location())
            .description(patch.description() != null ? patch.description() : parent.description())
            .attendees(patch.attendees() != null ? patch.attendees() : parent.attendees())
            .reminders(patch.reminders())
            .eventType(type)
            .properties(patch.properties() != null ? patch.properties() : parent.properties())
            .recurrence(recurrence)
            .calendarId(parent.calendar())
            .build();
    if (EventTimes.toInstant(continuation.start(), properties.zoneId()) == null
        || EventTimes.toInstant(continuation.end(), properties.zoneId()) == null) {
      throw new InvalidRequestException(
          "Unreadable event times: " + continuation.start() + " - " + continuation.end());
    }
    truncateParent(source, occurrence, parent);
    try {
      CalendarEvent created = source.createEvent(continuation);
      log.info(
          "Split series {} at {}: continuation is {}",
          parent.id(),
          occurrence.start(),
          created.id());
      return created;
    } catch (CalendarException e) {
      log.error(
          "Series {} was ended before {} but the continuation could not be created",
          parent.id(),
          occurrence.start());
      throw e;
    }
  }

  private static CalendarEvent seriesParent(SourceCapability source, CalendarEvent occurrence) {
    CalendarEvent parent = source.getEvent(occurrence.seriesId());
    if (!parent.isSeriesParent()) {
      throw new InvalidRequestException("Event " + parent.id() + " is not a recurring series");
    }
    return parent;
  }

  private void truncateParent(
      SourceCapability source, CalendarEvent occurrence, CalendarEvent parent) {
    LocalDate occurrenceDate = EventTimes.localDate(occurrence.start(), properties.zoneId());
    if (occurrenceDate == null) {
      throw new InvalidRequestException(
          "Cannot read the start of occurrence " + occurrence.id() + ": " + occurrence.start());
    }
    List<String> truncated =
        RecurrenceRule.truncate(parent.recurrence(), untilBefore(occurrenceDate));
    source.updateEvent(parent.id(), EventPatch.recurrenceOnly(truncated));
    log.info("Ended series {} before {}", parent.id(), occurrenceDate);
  }
}
