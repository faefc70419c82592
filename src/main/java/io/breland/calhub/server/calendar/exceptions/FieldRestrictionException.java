package io.breland.calhub.server.calendar.exceptions;

import io.breland.calhub.server.calendar.model.EventField;
import io.breland.calhub.server.calendar.model.EventType;
import java.util.Set;
import java.util.stream.Collectors;

public class FieldRestrictionException extends CalendarException {
  private final EventType eventType;
  private final Set<EventField> disallowed;
  private final Set<EventField> allowed;

  public FieldRestrictionException(
      EventType eventType, Set<EventField> disallowed, Set<EventField> allowed) {
    super(
        "Cannot update field(s) "
            + names(disallowed)
            + " on "
            + eventType.apiValue()
            + " events. Allowed fields: "
            + names(allowed));
    this.eventType = eventType;
    this.disallowed = Set.copyOf(disallowed);
    this.allowed = Set.copyOf(allowed);
  }

  public EventType getEventType() {
    return eventType;
  }

  public Set<EventField> getDisallowed() {
    return disallowed;
  }

  public Set<EventField> getAllowed() {
    return allowed;
  }

  private static String names(Set<EventField> fields) {
    return fields.stream()
        .sorted()
        .map(EventField::fieldName)
        .collect(Collectors.joining(", "));
  }
}
