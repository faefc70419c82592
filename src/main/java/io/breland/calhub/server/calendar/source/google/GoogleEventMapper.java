package io.breland.calhub.server.calendar.source.google;

import com.google.api.client.util.Data;
import com.google.api.client.util.DateTime;
import com.google.api.services.calendar.model.Event;
import com.google.api.services.calendar.model.EventAttendee;
import com.google.api.services.calendar.model.EventDateTime;
import com.google.api.services.calendar.model.EventFocusTimeProperties;
import com.google.api.services.calendar.model.EventOutOfOfficeProperties;
import com.google.api.services.calendar.model.EventReminder;
import com.google.api.services.calendar.model.EventWorkingLocationProperties;
import io.breland.calhub.server.calendar.EventTimes;
import io.breland.calhub.server.calendar.exceptions.InvalidRequestException;
import io.breland.calhub.server.calendar.model.CalendarEvent;
import io.breland.calhub.server.calendar.model.CreateEventRequest;
import io.breland.calhub.server.calendar.model.EventPatch;
import io.breland.calhub.server.calendar.model.EventSource;
import io.breland.calhub.server.calendar.model.EventType;
import io.breland.calhub.server.calendar.model.Reminders;
import io.breland.calhub.server.calendar.model.TypeSpecificProperties;
import io.breland.calhub.server.calendar.model.WorkingLocationType;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Converts between Google Calendar v3 events and {@link CalendarEvent}. */
@Component
public class GoogleEventMapper {

  public CalendarEvent toCalendarEvent(Event event, String calendarId) {
    boolean allDay = event.getStart() != null && event.getStart().getDate() != null;
    List<String> attendees = new ArrayList<>();
    if (event.getAttendees() != null) {
      for (EventAttendee attendee : event.getAttendees()) {
        if (attendee.getEmail() != null) {
          attendees.add(attendee.getEmail());
        }
      }
    }
    return CalendarEvent.builder()
        .id(event.getId())
        .title(event.getSummary())
        .start(timeText(event.getStart()))
        .end(timeText(event.getEnd()))
        .allDay(allDay)
        .source(EventSource.CLOUD)
        .eventType(EventType.fromApiValue(event.getEventType()))
        .iCalUID(event.getICalUID())
        .calendar(calendarId)
        .location(event.getLocation())
        .description(event.getDescription())
        .attendees(attendees)
        .status(event.getStatus())
        .recurringEventId(event.getRecurringEventId())
        .recurrence(event.getRecurrence())
        .properties(properties(event))
        .build();
  }

  public Event toGoogleEvent(CreateEventRequest request, ZoneId zone) {
    Event event = new Event();
    event.setSummary(request.title());
    if (request.description() != null && !request.description().isBlank()) {
      event.setDescription(request.description());
    }
    if (request.location() != null && !request.location().isBlank()) {
      event.setLocation(request.location());
    }
    boolean allDay = request.allDay() || EventTimes.isDateOnly(request.start());
    event.setStart(eventDateTime(request.start(), allDay, zone));
    event.setEnd(eventDateTime(request.end(), allDay, zone));
    if (request.attendees() != null && !request.attendees().isEmpty()) {
      event.setAttendees(attendees(request.attendees()));
    }
    if (request.reminders() != null) {
      event.setReminders(reminders(request.reminders()));
    }
    if (request.isRecurring()) {
      event.setRecurrence(request.recurrence());
    }
    applyType(event, request.effectiveType(), request.properties());
    return event;
  }

  /** Only the fields present in the patch are set on the returned body. */
  public Event toGooglePatch(EventPatch patch, ZoneId zone) {
    Event event = new Event();
    if (patch.title() != null) {
      event.setSummary(patch.title());
    }
    if (patch.location() != null) {
      event.setLocation(patch.location());
    }
    if (patch.description() != null) {
      event.setDescription(patch.description());
    }
    if (patch.start() != null) {
      boolean allDay =
          patch.allDay() != null ? patch.allDay() : EventTimes.isDateOnly(patch.start());
      event.setStart(eventDateTime(patch.start(), allDay, zone));
    }
    if (patch.end() != null) {
      boolean allDay = patch.allDay() != null ? patch.allDay() : EventTimes.isDateOnly(patch.end());
      event.setEnd(eventDateTime(patch.end(), allDay, zone));
    }
    if (patch.attendees() != null) {
      event.setAttendees(attendees(patch.attendees()));
    }
    if (patch.reminders() != null) {
      event.setReminders(reminders(patch.reminders()));
    }
    if (patch.recurrence() != null) {
      event.setRecurrence(patch.recurrence());
    }
    if (patch.eventType() != null || patch.properties() != null) {
      applyType(
          event,
          patch.eventType() != null ? patch.eventType() : EventType.DEFAULT,
          patch.properties());
    }
    return event;
  }

  EventDateTime eventDateTime(String value, boolean allDay, ZoneId zone) {
    if (allDay) {
      String date = EventTimes.isDateOnly(value) ? value : localDate(value, zone);
      return new EventDateTime()
          .setDate(DateTime.parseRfc3339(date))
          .setDateTime(Data.NULL_DATE_TIME);
    }
    Instant instant = EventTimes.toInstant(value, zone);
    if (instant == null) {
      throw new InvalidRequestException("Invalid event time: " + value);
    }
    return new EventDateTime()
        .setDateTime(new DateTime(instant.toEpochMilli()))
        .setTimeZone(zone.getId())
        .setDate(Data.NULL_DATE_TIME);
  }

  private static String localDate(String value, ZoneId zone) {
    Instant instant = EventTimes.toInstant(value, zone);
    if (instant == null) {
      throw new InvalidRequestException("Invalid event date: " + value);
    }
    return instant.atZone(zone).toLocalDate().toString();
  }

  private static String timeText(EventDateTime time) {
    if (time == null) {
      return null;
    }
    if (time.getDate() != null) {
      return time.getDate().toStringRfc3339();
    }
    return time.getDateTime() != null ? time.getDateTime().toStringRfc3339() : null;
  }

  private static List<EventAttendee> attendees(List<String> emails) {
    List<EventAttendee> attendees = new ArrayList<>();
    for (String email : emails) {
      if (email != null && !email.isBlank()) {
        attendees.add(new EventAttendee().setEmail(email));
      }
    }
    return attendees;
  }

  private static Event.Reminders reminders(Reminders reminders) {
    Event.Reminders result = new Event.Reminders().setUseDefault(reminders.useDefault());
    if (reminders.overrides() != null && !reminders.overrides().isEmpty()) {
      List<EventReminder> overrides = new ArrayList<>();
      for (Reminders.ReminderOverride override : reminders.overrides()) {
        overrides.add(
            new EventReminder().setMethod(override.method()).setMinutes(override.minutes()));
      }
      result.setOverrides(overrides);
    }
    return result;
  }

  private static void applyType(Event event, EventType type, TypeSpecificProperties properties) {
    TypeSpecificProperties props =
        properties != null ? properties : TypeSpecificProperties.builder().build();
    switch (type) {
      case OUT_OF_OFFICE -> {
        event.setEventType(type.apiValue());
        event.setOutOfOfficeProperties(
            new EventOutOfOfficeProperties()
                .setAutoDeclineMode(props.autoDeclineMode())
                .setDeclineMessage(props.declineMessage()));
      }
      case FOCUS_TIME -> {
        event.setEventType(type.apiValue());
        event.setFocusTimeProperties(
            new EventFocusTimeProperties()
                .setAutoDeclineMode(props.autoDeclineMode())
                .setDeclineMessage(props.declineMessage())
                .setChatStatus(props.chatStatus()));
      }
      case WORKING_LOCATION -> {
        event.setEventType(type.apiValue());
        event.setTransparency("transparent");
        event.setVisibility("public");
        event.setWorkingLocationProperties(workingLocation(props));
      }
      case DEFAULT -> {
        if (properties != null) {
          throw new InvalidRequestException("Default events do not take type-specific properties");
        }
      }
      case BIRTHDAY, FROM_GMAIL ->
          throw new InvalidRequestException(
              "Events of type " + type.apiValue() + " cannot be written");
    }
  }

  private static EventWorkingLocationProperties workingLocation(TypeSpecificProperties props) {
    WorkingLocationType type =
        props.workingLocationType() != null
            ? props.workingLocationType()
            : WorkingLocationType.HOME_OFFICE;
    EventWorkingLocationProperties result =
        new EventWorkingLocationProperties().setType(type.apiValue());
    switch (type) {
      case OFFICE_LOCATION -> result.setOfficeLocation(
          new EventWorkingLocationProperties.OfficeLocation()
              .setLabel(props.workingLocationLabel()));
      case CUSTOM_LOCATION -> result.setCustomLocation(
          new EventWorkingLocationProperties.CustomLocation()
              .setLabel(props.workingLocationLabel()));
      case HOME_OFFICE, UNKNOWN -> {
        result.setType(WorkingLocationType.HOME_OFFICE.apiValue());
        result.setHomeOffice(Map.of());
      }
    }
    return result;
  }

  private static TypeSpecificProperties properties(Event event) {
    if (event.getOutOfOfficeProperties() != null) {
      EventOutOfOfficeProperties ooo = event.getOutOfOfficeProperties();
      return TypeSpecificProperties.builder()
          .autoDeclineMode(ooo.getAutoDeclineMode())
          .declineMessage(ooo.getDeclineMessage())
          .build();
    }
    if (event.getFocusTimeProperties() != null) {
      EventFocusTimeProperties focus = event.getFocusTimeProperties();
      return TypeSpecificProperties.builder()
          .autoDeclineMode(focus.getAutoDeclineMode())
          .declineMessage(focus.getDeclineMessage())
          .chatStatus(focus.getChatStatus())
          .build();
    }
    if (event.getWorkingLocationProperties() != null) {
      EventWorkingLocationProperties location = event.getWorkingLocationProperties();
      String label = null;
      if (location.getOfficeLocation() != null) {
        label = location.getOfficeLocation().getLabel();
      } else if (location.getCustomLocation() != null) {
        label = location.getCustomLocation().getLabel();
      }
      return TypeSpecificProperties.builder()
          .workingLocationType(WorkingLocationType.fromApiValue(location.getType()))
          .workingLocationLabel(label)
          .build();
    }
    return null;
  }
}
