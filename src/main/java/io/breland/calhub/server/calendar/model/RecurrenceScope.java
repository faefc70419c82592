package io.breland.calhub.server.calendar.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Which part of a recurring series a mutation applies to. */
public enum RecurrenceScope {
  @JsonProperty("thisEvent")
  THIS_EVENT,
  @JsonProperty("thisAndFuture")
  THIS_AND_FUTURE,
  @JsonProperty("allEvents")
  ALL_EVENTS
}
