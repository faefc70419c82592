package io.breland.calhub.server.calendar.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;

/**
 * One event as reported by its owning backend. {@code start} and {@code end} keep the
 * backend's ISO-8601 text (a date for all-day events, a date-time otherwise).
 */
@Builder(toBuilder = true)
public record CalendarEvent(
    String id,
    String title,
    String start,
    String end,
    @JsonProperty("isAllDay") boolean allDay,
    EventSource source,
    EventType eventType,
    @JsonProperty("iCalUID") String iCalUID,
    String calendar,
    String location,
    String description,
    List<String> attendees,
    String status,
    String recurringEventId,
    List<String> recurrence,
    TypeSpecificProperties properties) {

  @JsonIgnore
  public EventType effectiveType() {
    return eventType != null ? eventType : EventType.DEFAULT;
  }

  /** An occurrence points back at the series that generated it. */
  @JsonIgnore
  public boolean isOccurrence() {
    return recurringEventId != null && !recurringEventId.isBlank();
  }

  @JsonIgnore
  public boolean isSeriesParent() {
    return recurrence != null && !recurrence.isEmpty();
  }

  @JsonIgnore
  public String seriesId() {
    return isOccurrence() ? recurringEventId : id;
  }
}
