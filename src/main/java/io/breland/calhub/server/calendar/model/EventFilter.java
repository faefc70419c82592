package io.breland.calhub.server.calendar.model;

import java.util.Set;

/**
 * Optional narrowing of a listing. A null {@code calendar} means every calendar, an empty
 * {@code eventTypes} means every type.
 */
public record EventFilter(String calendar, Set<EventType> eventTypes) {

  public static EventFilter none() {
    return new EventFilter(null, Set.of());
  }

  public static EventFilter calendar(String calendar) {
    return new EventFilter(calendar, Set.of());
  }

  public boolean accepts(CalendarEvent event) {
    return eventTypes == null || eventTypes.isEmpty() || eventTypes.contains(event.effectiveType());
  }
}
