package io.breland.calhub.server.calendar.model;

import java.time.LocalTime;

public record WorkingHours(LocalTime start, LocalTime end) {

  public WorkingHours {
    if (start == null || end == null || !end.isAfter(start)) {
      throw new IllegalArgumentException("Working hours must end after they start");
    }
  }

  public static WorkingHours parse(String start, String end) {
    return new WorkingHours(LocalTime.parse(start), LocalTime.parse(end));
  }
}
