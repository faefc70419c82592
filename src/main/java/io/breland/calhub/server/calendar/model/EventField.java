package io.breland.calhub.server.calendar.model;

/** Patchable event fields, named as callers name them. */
public enum EventField {
  TITLE("title"),
  LOCATION("location"),
  DESCRIPTION("description"),
  START("start"),
  END("end"),
  IS_ALL_DAY("isAllDay"),
  ATTENDEES("attendees"),
  REMINDERS("reminders"),
  EVENT_TYPE("eventType"),
  RECURRENCE("recurrence"),
  TYPE_SPECIFIC_PROPERTIES("typeSpecificProperties");

  private final String fieldName;

  EventField(String fieldName) {
    this.fieldName = fieldName;
  }

  public String fieldName() {
    return fieldName;
  }

  @Override
  public String toString() {
    return fieldName;
  }
}
