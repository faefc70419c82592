package io.breland.calhub.server.calendar.coordination;

import io.breland.calhub.server.calendar.EventTimes;
import io.breland.calhub.server.calendar.availability.AvailabilityEngine;
import io.breland.calhub.server.calendar.availability.CommonAvailabilityCalculator;
import io.breland.calhub.server.calendar.coordination.FallbackCoordinator.FanOut;
import io.breland.calhub.server.calendar.coordination.FallbackCoordinator.Routed;
import io.breland.calhub.server.calendar.dedup.EventDeduplicator;
import io.breland.calhub.server.calendar.exceptions.BackendException;
import io.breland.calhub.server.calendar.exceptions.InvalidRequestException;
import io.breland.calhub.server.calendar.model.AvailableSlot;
import io.breland.calhub.server.calendar.model.CalendarEvent;
import io.breland.calhub.server.calendar.model.CalendarInfo;
import io.breland.calhub.server.calendar.model.CommonAvailabilityResult;
import io.breland.calhub.server.calendar.model.CreateEventRequest;
import io.breland.calhub.server.calendar.model.EventFilter;
import io.breland.calhub.server.calendar.model.EventPatch;
import io.breland.calhub.server.calendar.model.EventSource;
import io.breland.calhub.server.calendar.model.EventType;
import io.breland.calhub.server.calendar.model.FindSlotsRequest;
import io.breland.calhub.server.calendar.model.PeopleAvailabilityResult;
import io.breland.calhub.server.calendar.model.RecurrenceScope;
import io.breland.calhub.server.calendar.model.RespondResult;
import io.breland.calhub.server.calendar.model.ResponseType;
import io.breland.calhub.server.calendar.model.SourceStatus;
import io.breland.calhub.server.calendar.model.TimeWindow;
import io.breland.calhub.server.calendar.recurrence.RecurrenceRuleValidator;
import io.breland.calhub.server.calendar.recurrence.RecurrenceScopeResolver;
import io.breland.calhub.server.calendar.source.SourceCapability;
import io.breland.calhub.server.config.CalendarProperties;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Entry point for every calendar operation, across all configured sources. */
@Slf4j
@Service
public class SourceCoordinator {
  private final FallbackCoordinator fallback;
  private final EventDeduplicator deduplicator;
  private final AvailabilityEngine availabilityEngine;
  private final CommonAvailabilityCalculator commonAvailability;
  private final RecurrenceScopeResolver scopeResolver;
  private final CalendarProperties properties;

  public SourceCoordinator(
      FallbackCoordinator fallback,
      EventDeduplicator deduplicator,
      AvailabilityEngine availabilityEngine,
      CommonAvailabilityCalculator commonAvailability,
      RecurrenceScopeResolver scopeResolver,
      CalendarProperties properties) {
    this.fallback = fallback;
    this.deduplicator = deduplicator;
    this.availabilityEngine = availabilityEngine;
    this.commonAvailability = commonAvailability;
    this.scopeResolver = scopeResolver;
    this.properties = properties;
  }

  public List<CalendarEvent> getEvents(TimeWindow window) {
    return getEvents(window, EventFilter.none());
  }

  public List<CalendarEvent> getEvents(TimeWindow window, EventFilter filter) {
    return fetchEvents(window, filter).items();
  }

  private FanOut<CalendarEvent> fetchEvents(TimeWindow window, EventFilter filter) {
    FanOut<CalendarEvent> fanOut =
        fallback.readAll("list events", source -> source.listEvents(window, filter));
    List<CalendarEvent> unique = deduplicator.deduplicate(fanOut.items());
    log.debug(
        "Listed {} events ({} unique) from {}",
        fanOut.items().size(),
        unique.size(),
        fanOut.respondedSources());
    return new FanOut<>(unique, fanOut.respondedSources(), fanOut.failures());
  }

  /**
   * Recurring events always go to the cloud source. Everything else tries {@code
   * preferredSource} first and falls back through the other enabled sources.
   */
  public CalendarEvent createEvent(CreateEventRequest request, EventSource preferredSource) {
    validateCreate(request);
    if (request.isRecurring()) {
      RecurrenceRuleValidator.requireValid(request.recurrence());
      SourceCapability cloud = fallback.requireEnabled(EventSource.CLOUD);
      return cloud.createEvent(request);
    }
    Routed<CalendarEvent> created =
        fallback.firstSuccess(
            "create event", preferredSource, source -> source.createEvent(request));
    log.info("Created event {} on {}", created.value().id(), created.sourceId());
    return created.value();
  }

  public CalendarEvent updateEvent(String eventId, EventPatch patch, RecurrenceScope scope) {
    requireId(eventId);
    if (patch == null || patch.presentFields().isEmpty()) {
      throw new InvalidRequestException("Nothing to update on event " + eventId);
    }
    if (patch.recurrence() != null) {
      RecurrenceRuleValidator.requireValid(patch.recurrence());
    }
    Routed<CalendarEvent> located = fallback.locate(eventId);
    return scopeResolver.update(located.source(), located.value(), patch, scope);
  }

  /**
   * Without a scope the id is deleted as given: from {@code source} when named, otherwise from
   * every enabled source. A scope first resolves the event and its series.
   */
  public void deleteEvent(String eventId, EventSource source, RecurrenceScope scope) {
    requireId(eventId);
    if (scope == null || scope == RecurrenceScope.THIS_EVENT) {
      if (source != null) {
        fallback.deleteFrom(source, eventId);
      } else {
        List<EventSource> deleted = fallback.deleteEverywhere(eventId);
        log.info("Deleted event {} from {}", eventId, deleted);
      }
      return;
    }
    Routed<CalendarEvent> located = locate(eventId, source);
    try {
      scopeResolver.delete(located.source(), located.value(), scope);
    } catch (BackendException e) {
      if (!e.isNotFound()) {
        throw e;
      }
      log.info("Event {} already absent from {}", eventId, located.sourceId());
    }
  }

  public RespondResult respondToEvent(
      String eventId, ResponseType response, EventSource source, String calendarId) {
    requireId(eventId);
    if (response == null) {
      throw new InvalidRequestException("A response is required");
    }
    Routed<CalendarEvent> responded =
        fallback.firstSuccess(
            "respond to event " + eventId,
            source,
            candidate -> candidate.respondToEvent(eventId, response, calendarId));
    String title = responded.value().title() != null ? responded.value().title() : eventId;
    return new RespondResult(
        true,
        "Responded " + response.attendeeStatus() + " to \"" + title + "\"",
        responded.sourceId());
  }

  public List<AvailableSlot> findAvailableSlots(FindSlotsRequest request) {
    TimeWindow window = availabilityEngine.searchWindow(request);
    FanOut<CalendarEvent> events = fetchEvents(window, EventFilter.none());
    return availabilityEngine.findSlots(request, events.items(), events.respondedSources());
  }

  public CommonAvailabilityResult findCommonAvailability(
      List<String> identities, TimeWindow window, Integer minDurationMinutes, boolean includeSelf) {
    SourceCapability cloud = fallback.requireEnabled(EventSource.CLOUD);
    return commonAvailability.findCommonAvailability(
        cloud, identities, window, minDurationMinutes, includeSelf);
  }

  public PeopleAvailabilityResult checkPeopleAvailability(
      List<String> identities, TimeWindow window) {
    SourceCapability cloud = fallback.requireEnabled(EventSource.CLOUD);
    return commonAvailability.checkPeopleAvailability(cloud, identities, window);
  }

  public List<CalendarInfo> listCalendars() {
    return fallback.readAll("list calendars", SourceCapability::listCalendars).items();
  }

  /** Which sources could be used on this host right now, enabled or not. */
  public SourceStatus detectAvailableSources() {
    boolean os = false;
    boolean cloud = false;
    for (SourceCapability source : fallback.registeredSources()) {
      boolean available = source.isAvailable();
      switch (source.source()) {
        case OS -> os = available;
        case CLOUD -> cloud = available;
      }
    }
    return new SourceStatus(os, cloud);
  }

  public List<EventSource> getEnabledSources() {
    return fallback.enabledSources().stream().map(SourceCapability::source).toList();
  }

  /** Reachability of each enabled source. */
  public Map<EventSource, Boolean> healthCheck() {
    Map<EventSource, Boolean> health = new EnumMap<>(EventSource.class);
    for (SourceCapability source : fallback.enabledSources()) {
      health.put(source.source(), source.isAvailable());
    }
    return health;
  }

  private Routed<CalendarEvent> locate(String eventId, EventSource source) {
    if (source == null) {
      return fallback.locate(eventId);
    }
    SourceCapability target = fallback.requireEnabled(source);
    return new Routed<>(target.getEvent(eventId), target);
  }

  private void validateCreate(CreateEventRequest request) {
    if (request == null || request.title() == null || request.title().isBlank()) {
      throw new InvalidRequestException("An event title is required");
    }
    if (request.start() == null || request.end() == null) {
      throw new InvalidRequestException("Event start and end are required");
    }
    EventType type = request.effectiveType();
    if (!type.isCreatable()) {
      throw new InvalidRequestException(type.apiValue() + " events cannot be created");
    }
    Instant start = EventTimes.toInstant(request.start(), properties.zoneId());
    Instant end = EventTimes.toInstant(request.end(), properties.zoneId());
    if (start == null || end == null) {
      throw new InvalidRequestException(
          "Unreadable event times: " + request.start() + " - " + request.end());
    }
    if (end.isBefore(start)) {
      throw new InvalidRequestException("Event end must not be before its start");
    }
  }

  private static void requireId(String eventId) {
    if (eventId == null || eventId.isBlank()) {
      throw new InvalidRequestException("An event id is required");
    }
  }
}
