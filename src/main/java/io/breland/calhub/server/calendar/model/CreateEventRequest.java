package io.breland.calhub.server.calendar.model;

import java.util.List;
import lombok.Builder;

@Builder(toBuilder = true)
public record CreateEventRequest(
    String title,
    String start,
    String end,
    boolean allDay,
    String location,
    String description,
    List<String> attendees,
    Reminders reminders,
    EventType eventType,
    List<String> recurrence,
    TypeSpecificProperties properties,
    String calendarId) {

  public EventType effectiveType() {
    return eventType != null ? eventType : EventType.DEFAULT;
  }

  public boolean isRecurring() {
    return recurrence != null && !recurrence.isEmpty();
  }
}
