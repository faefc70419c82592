package io.breland.calhub.server.calendar.model;

public record WorkingLocationInfo(WorkingLocationType type, String label) {

  public static WorkingLocationInfo unknown() {
    return new WorkingLocationInfo(WorkingLocationType.UNKNOWN, null);
  }
}
