package io.breland.calhub.server.calendar.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ResponseType {
  @JsonProperty("accept")
  ACCEPT("accepted"),
  @JsonProperty("decline")
  DECLINE("declined"),
  @JsonProperty("tentative")
  TENTATIVE("tentative");

  private final String attendeeStatus;

  ResponseType(String attendeeStatus) {
    this.attendeeStatus = attendeeStatus;
  }

  /** Value of an attendee's {@code responseStatus} after this response. */
  public String attendeeStatus() {
    return attendeeStatus;
  }
}
