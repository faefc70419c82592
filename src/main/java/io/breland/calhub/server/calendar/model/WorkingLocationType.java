package io.breland.calhub.server.calendar.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum WorkingLocationType {
  @JsonProperty("homeOffice")
  HOME_OFFICE("homeOffice"),
  @JsonProperty("officeLocation")
  OFFICE_LOCATION("officeLocation"),
  @JsonProperty("customLocation")
  CUSTOM_LOCATION("customLocation"),
  @JsonProperty("unknown")
  UNKNOWN("unknown");

  private final String apiValue;

  WorkingLocationType(String apiValue) {
    this.apiValue = apiValue;
  }

  public String apiValue() {
    return apiValue;
  }

  public static WorkingLocationType fromApiValue(String value) {
    if (value == null) {
      return UNKNOWN;
    }
    return switch (value) {
      case "homeOffice" -> HOME_OFFICE;
      case "officeLocation" -> OFFICE_LOCATION;
      case "customLocation" -> CUSTOM_LOCATION;
      default -> UNKNOWN;
    };
  }
}
