package io.breland.calhub.server.calendar.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.Builder;

/** Partial update. A null component means "leave unchanged". */
@Builder(toBuilder = true)
public record EventPatch(
    String title,
    String location,
    String description,
    String start,
    String end,
    Boolean allDay,
    List<String> attendees,
    Reminders reminders,
    EventType eventType,
    List<String> recurrence,
    TypeSpecificProperties properties) {

  public static EventPatch recurrenceOnly(List<String> recurrence) {
    return EventPatch.builder().recurrence(recurrence).build();
  }

  public Set<EventField> presentFields() {
    Set<EventField> fields = EnumSet.noneOf(EventField.class);
    if (title != null) {
      fields.add(EventField.TITLE);
    }
    if (location != null) {
      fields.add(EventField.LOCATION);
    }
    if (description != null) {
      fields.add(EventField.DESCRIPTION);
    }
    if (start != null) {
      fields.add(EventField.START);
    }
    if (end != null) {
      fields.add(EventField.END);
    }
    if (allDay != null) {
      fields.add(EventField.IS_ALL_DAY);
    }
    if (attendees != null) {
      fields.add(EventField.ATTENDEES);
    }
    if (reminders != null) {
      fields.add(EventField.REMINDERS);
    }
    if (eventType != null) {
      fields.add(EventField.EVENT_TYPE);
    }
    if (recurrence != null) {
      fields.add(EventField.RECURRENCE);
    }
    if (properties != null) {
      fields.add(EventField.TYPE_SPECIFIC_PROPERTIES);
    }
    return fields;
  }
}
