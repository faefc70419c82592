package io.breland.calhub.server.calendar.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum EventSource {
  @JsonProperty("os")
  OS("os"),
  @JsonProperty("cloud")
  CLOUD("cloud");

  private final String apiValue;

  EventSource(String apiValue) {
    this.apiValue = apiValue;
  }

  public String apiValue() {
    return apiValue;
  }

  @Override
  public String toString() {
    return apiValue;
  }
}
