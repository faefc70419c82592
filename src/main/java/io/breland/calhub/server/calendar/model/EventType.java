package io.breland.calhub.server.calendar.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum EventType {
  @JsonProperty("default")
  DEFAULT("default"),
  @JsonProperty("outOfOffice")
  OUT_OF_OFFICE("outOfOffice"),
  @JsonProperty("focusTime")
  FOCUS_TIME("focusTime"),
  @JsonProperty("workingLocation")
  WORKING_LOCATION("workingLocation"),
  @JsonProperty("birthday")
  BIRTHDAY("birthday"),
  @JsonProperty("fromGmail")
  FROM_GMAIL("fromGmail");

  private final String apiValue;

  EventType(String apiValue) {
    this.apiValue = apiValue;
  }

  public String apiValue() {
    return apiValue;
  }

  /** Birthdays and Gmail-derived events are managed by Google and cannot be created. */
  public boolean isCreatable() {
    return this != BIRTHDAY && this != FROM_GMAIL;
  }

  /** Unknown or missing values are treated as {@link #DEFAULT}. */
  public static EventType fromApiValue(String value) {
    if (value == null) {
      return DEFAULT;
    }
    return switch (value) {
      case "outOfOffice" -> OUT_OF_OFFICE;
      case "focusTime" -> FOCUS_TIME;
      case "workingLocation" -> WORKING_LOCATION;
      case "birthday" -> BIRTHDAY;
      case "fromGmail" -> FROM_GMAIL;
      default -> DEFAULT;
    };
  }

  @Override
  public String toString() {
    return apiValue;
  }
}
