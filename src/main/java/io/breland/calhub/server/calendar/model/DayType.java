package io.breland.calhub.server.calendar.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DayType {
  @JsonProperty("deep-work")
  DEEP_WORK,
  @JsonProperty("meeting-heavy")
  MEETING_HEAVY,
  @JsonProperty("normal")
  NORMAL
}
