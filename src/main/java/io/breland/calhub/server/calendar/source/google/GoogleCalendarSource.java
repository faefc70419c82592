package io.breland.calhub.server.calendar.source.google;

import com.google.api.client.util.DateTime;
import com.google.api.services.calendar.Calendar;
import com.google.api.services.calendar.model.CalendarList;
import com.google.api.services.calendar.model.CalendarListEntry;
import com.google.api.services.calendar.model.Error;
import com.google.api.services.calendar.model.Event;
import com.google.api.services.calendar.model.EventAttendee;
import com.google.api.services.calendar.model.Events;
import com.google.api.services.calendar.model.FreeBusyCalendar;
import com.google.api.services.calendar.model.FreeBusyRequest;
import com.google.api.services.calendar.model.FreeBusyRequestItem;
import com.google.api.services.calendar.model.FreeBusyResponse;
import com.google.api.services.calendar.model.TimePeriod;
import com.google.common.collect.Lists;
import io.breland.calhub.server.calendar.BackendRetry;
import io.breland.calhub.server.calendar.exceptions.BackendErrorKind;
import io.breland.calhub.server.calendar.exceptions.BackendException;
import io.breland.calhub.server.calendar.exceptions.CalendarException;
import io.breland.calhub.server.calendar.model.BusyPeriod;
import io.breland.calhub.server.calendar.model.CalendarEvent;
import io.breland.calhub.server.calendar.model.CalendarInfo;
import io.breland.calhub.server.calendar.model.CreateEventRequest;
import io.breland.calhub.server.calendar.model.EventFilter;
import io.breland.calhub.server.calendar.model.EventPatch;
import io.breland.calhub.server.calendar.model.EventSource;
import io.breland.calhub.server.calendar.model.ParticipantAvailability;
import io.breland.calhub.server.calendar.model.ResponseType;
import io.breland.calhub.server.calendar.model.TimeWindow;
import io.breland.calhub.server.calendar.source.SourceCapability;
import io.breland.calhub.server.config.CalendarProperties;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** Google Calendar v3. Supports every operation. */
@Slf4j
@Component
public class GoogleCalendarSource implements SourceCapability {
  private static final String SEND_UPDATES_ALL = "all";

  private final GoogleCalendarClientFactory clientFactory;
  private final GoogleEventMapper mapper;
  private final BackendRetry retry;
  private final CalendarProperties properties;
  private final ExecutorService executor;

  public GoogleCalendarSource(
      GoogleCalendarClientFactory clientFactory,
      GoogleEventMapper mapper,
      BackendRetry retry,
      CalendarProperties properties,
      @Qualifier("calendarSourceExecutor") ExecutorService executor) {
    this.clientFactory = clientFactory;
    this.mapper = mapper;
    this.retry = retry;
    this.properties = properties;
    this.executor = executor;
  }

  @Override
  public EventSource source() {
    return EventSource.CLOUD;
  }

  @Override
  public boolean isAvailable() {
    if (!clientFactory.isConfigured()) {
      return false;
    }
    try {
      Calendar client = clientFactory.calendar();
      GoogleErrors.execute(
          "probe calendar list", () -> client.calendarList().list().setMaxResults(1).execute());
      return true;
    } catch (CalendarException e) {
      log.warn("Google Calendar is not available: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public List<CalendarEvent> listEvents(TimeWindow window, EventFilter filter) {
    EventFilter effective = filter != null ? filter : EventFilter.none();
    String calendarId = calendarId(effective.calendar());
    Calendar client = clientFactory.calendar();
    DateTime timeMin = new DateTime(window.start().toEpochMilli());
    DateTime timeMax = new DateTime(window.end().toEpochMilli());
    int pageSize = properties.getCloud().getPageSize();

    List<CalendarEvent> events = new ArrayList<>();
    String pageToken = null;
    do {
      String token = pageToken;
      Events page =
          retry.call(
              EventSource.CLOUD,
              "listEvents",
              () ->
                  GoogleErrors.execute(
                      "list events",
                      () ->
                          client
                              .events()
                              .list(calendarId)
                              .setTimeMin(timeMin)
                              .setTimeMax(timeMax)
                              .setMaxResults(pageSize)
                              .setSingleEvents(true)
                              .setPageToken(token)
                              .execute()));
      if (page.getItems() != null) {
        for (Event item : page.getItems()) {
          CalendarEvent event = mapper.toCalendarEvent(item, calendarId);
          if (effective.accepts(event)) {
            events.add(event);
          }
        }
      }
      pageToken = page.getNextPageToken();
    } while (pageToken != null && !pageToken.isBlank());
    log.debug("Listed {} events from {}", events.size(), calendarId);
    return events;
  }

  @Override
  public CalendarEvent getEvent(String eventId) {
    String calendarId = calendarId(null);
    Calendar client = clientFactory.calendar();
    Event event =
        retry.call(
            EventSource.CLOUD,
            "getEvent",
            () ->
                GoogleErrors.execute(
                    "get event " + eventId,
                    () -> client.events().get(calendarId, eventId).execute()));
    return mapper.toCalendarEvent(event, calendarId);
  }

  @Override
  public CalendarEvent createEvent(CreateEventRequest request) {
    String calendarId = calendarId(request.calendarId());
    Event body = mapper.toGoogleEvent(request, properties.zoneId());
    Calendar client = clientFactory.calendar();
    Event created =
        retry.call(
            EventSource.CLOUD,
            "createEvent",
            () ->
                GoogleErrors.execute(
                    "create event",
                    () -> {
                      Calendar.Events.Insert insert = client.events().insert(calendarId, body);
                      if (body.getAttendees() != null && !body.getAttendees().isEmpty()) {
                        insert.setSendUpdates(SEND_UPDATES_ALL);
                      }
                      return insert.execute();
                    }));
    log.info("Created event {} on {}", created.getId(), calendarId);
    return mapper.toCalendarEvent(created, calendarId);
  }

  @Override
  public CalendarEvent updateEvent(String eventId, EventPatch patch) {
    String calendarId = calendarId(null);
    Event body = mapper.toGooglePatch(patch, properties.zoneId());
    Calendar client = clientFactory.calendar();
    Event updated =
        retry.call(
            EventSource.CLOUD,
            "updateEvent",
            () ->
                GoogleErrors.execute(
                    "update event " + eventId,
                    () -> {
                      Calendar.Events.Patch request =
                          client.events().patch(calendarId, eventId, body);
                      if (patch.attendees() != null) {
                        request.setSendUpdates(SEND_UPDATES_ALL);
                      }
                      return request.execute();
                    }));
    return mapper.toCalendarEvent(updated, calendarId);
  }

  @Override
  public void deleteEvent(String eventId) {
    String calendarId = calendarId(null);
    Calendar client = clientFactory.calendar();
    retry.call(
        EventSource.CLOUD,
        "deleteEvent",
        () ->
            GoogleErrors.execute(
                "delete event " + eventId,
                () -> client.events().delete(calendarId, eventId).execute()));
    log.info("Deleted event {} from {}", eventId, calendarId);
  }

  @Override
  public CalendarEvent respondToEvent(String eventId, ResponseType response, String calendarId) {
    String targetCalendar = calendarId(calendarId);
    Calendar client = clientFactory.calendar();
    Event event =
        retry.call(
            EventSource.CLOUD,
            "getEvent",
            () ->
                GoogleErrors.execute(
                    "get event " + eventId,
                    () -> client.events().get(targetCalendar, eventId).execute()));
    List<EventAttendee> attendees =
        event.getAttendees() != null ? new ArrayList<>(event.getAttendees()) : new ArrayList<>();
    EventAttendee self = findSelf(attendees);
    if (self == null) {
      throw new BackendException(
          EventSource.CLOUD,
          BackendErrorKind.VALIDATION,
          "You are not an attendee of event " + eventId);
    }
    self.setResponseStatus(response.attendeeStatus());
    Event body = new Event().setAttendees(attendees);
    Event patched =
        retry.call(
            EventSource.CLOUD,
            "respondToEvent",
            () ->
                GoogleErrors.execute(
                    "respond to event " + eventId,
                    () ->
                        client
                            .events()
                            .patch(targetCalendar, eventId, body)
                            .setSendUpdates(SEND_UPDATES_ALL)
                            .execute()));
    log.info("Responded {} to event {}", response.attendeeStatus(), eventId);
    return mapper.toCalendarEvent(patched, targetCalendar);
  }

  @Override
  public List<ParticipantAvailability> queryFreeBusy(List<String> identities, TimeWindow window) {
    Calendar client = clientFactory.calendar();
    List<List<String>> batches =
        Lists.partition(identities, properties.getCloud().getFreebusyBatchSize());
    List<CompletableFuture<Map<String, ParticipantAvailability>>> futures = new ArrayList<>();
    for (List<String> batch : batches) {
      futures.add(
          CompletableFuture.supplyAsync(() -> queryBatch(client, batch, window), executor));
    }
    Map<String, ParticipantAvailability> byIdentity = new LinkedHashMap<>();
    for (int i = 0; i < futures.size(); i++) {
      List<String> batch = batches.get(i);
      try {
        byIdentity.putAll(futures.get(i).join());
      } catch (CompletionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.warn("Free/busy batch of {} failed: {}", batch.size(), cause.getMessage());
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.toString();
        for (String identity : batch) {
          byIdentity.put(identity, ParticipantAvailability.failed(identity, reason));
        }
      }
    }
    List<ParticipantAvailability> results = new ArrayList<>();
    for (String identity : identities) {
      results.add(byIdentity.get(identity));
    }
    return results;
  }

  private Map<String, ParticipantAvailability> queryBatch(
      Calendar client, List<String> batch, TimeWindow window) {
    FreeBusyRequest request = new FreeBusyRequest();
    request.setTimeMin(new DateTime(window.start().toEpochMilli()));
    request.setTimeMax(new DateTime(window.end().toEpochMilli()));
    request.setTimeZone(properties.zoneId().getId());
    List<FreeBusyRequestItem> items = new ArrayList<>();
    for (String identity : batch) {
      items.add(new FreeBusyRequestItem().setId(identity));
    }
    request.setItems(items);
    FreeBusyResponse response =
        retry.call(
            EventSource.CLOUD,
            "queryFreeBusy",
            () ->
                GoogleErrors.execute(
                    "query free/busy", () -> client.freebusy().query(request).execute()));

    Map<String, ParticipantAvailability> results = new LinkedHashMap<>();
    Map<String, FreeBusyCalendar> calendars =
        response.getCalendars() != null ? response.getCalendars() : Map.of();
    for (String identity : batch) {
      FreeBusyCalendar calendar = calendars.get(identity);
      if (calendar == null) {
        results.put(
            identity, ParticipantAvailability.failed(identity, "No free/busy data returned"));
      } else if (calendar.getErrors() != null && !calendar.getErrors().isEmpty()) {
        results.put(
            identity, ParticipantAvailability.failed(identity, describe(calendar.getErrors())));
      } else {
        results.put(identity, ParticipantAvailability.busy(identity, busyPeriods(calendar)));
      }
    }
    return results;
  }

  private static String describe(List<Error> errors) {
    Error error = errors.get(0);
    if (error.getReason() != null && !error.getReason().isBlank()) {
      return error.getReason();
    }
    return error.getDomain() != null ? error.getDomain() + " error" : "unknown error";
  }

  private static List<BusyPeriod> busyPeriods(FreeBusyCalendar calendar) {
    List<BusyPeriod> periods = new ArrayList<>();
    if (calendar.getBusy() == null) {
      return periods;
    }
    for (TimePeriod period : calendar.getBusy()) {
      periods.add(
          new BusyPeriod(
              Instant.ofEpochMilli(period.getStart().getValue()),
              Instant.ofEpochMilli(period.getEnd().getValue())));
    }
    return periods;
  }

  @Override
  public String primaryIdentity() {
    Calendar client = clientFactory.calendar();
    CalendarListEntry primary =
        retry.call(
            EventSource.CLOUD,
            "primaryIdentity",
            () ->
                GoogleErrors.execute(
                    "get primary calendar", () -> client.calendarList().get("primary").execute()));
    return primary.getId();
  }

  @Override
  public List<CalendarInfo> listCalendars() {
    Calendar client = clientFactory.calendar();
    List<CalendarInfo> calendars = new ArrayList<>();
    String pageToken = null;
    do {
      String token = pageToken;
      CalendarList list =
          retry.call(
              EventSource.CLOUD,
              "listCalendars",
              () ->
                  GoogleErrors.execute(
                      "list calendars",
                      () -> client.calendarList().list().setPageToken(token).execute()));
      if (list.getItems() != null) {
        for (CalendarListEntry entry : list.getItems()) {
          calendars.add(
              new CalendarInfo(
                  entry.getId(),
                  entry.getSummary(),
                  entry.getPrimary(),
                  entry.getTimeZone(),
                  entry.getAccessRole(),
                  EventSource.CLOUD));
        }
      }
      pageToken = list.getNextPageToken();
    } while (pageToken != null && !pageToken.isBlank());
    return calendars;
  }

  /** The authenticated user's attendee entry: by primary calendar id, else the self flag. */
  private EventAttendee findSelf(List<EventAttendee> attendees) {
    String identity = null;
    try {
      identity = primaryIdentity();
    } catch (CalendarException e) {
      log.warn("Could not resolve primary calendar, using attendee self flag: {}", e.getMessage());
    }
    if (identity != null) {
      for (EventAttendee attendee : attendees) {
        if (identity.equalsIgnoreCase(attendee.getEmail())) {
          return attendee;
        }
      }
    }
    for (EventAttendee attendee : attendees) {
      if (Boolean.TRUE.equals(attendee.getSelf())) {
        return attendee;
      }
    }
    return null;
  }

  private String calendarId(String requested) {
    if (requested != null && !requested.isBlank()) {
      return requested;
    }
    return properties.getCloud().getDefaultCalendar();
  }
}
