package io.breland.calhub.server.calendar.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PreferredLocation {
  @JsonProperty("homeOffice")
  HOME_OFFICE(WorkingLocationType.HOME_OFFICE),
  @JsonProperty("officeLocation")
  OFFICE_LOCATION(WorkingLocationType.OFFICE_LOCATION),
  @JsonProperty("any")
  ANY(null);

  private final WorkingLocationType locationType;

  PreferredLocation(WorkingLocationType locationType) {
    this.locationType = locationType;
  }

  public boolean matches(WorkingLocationInfo info) {
    return locationType != null && info != null && info.type() == locationType;
  }

  public boolean reorders() {
    return locationType != null;
  }
}
