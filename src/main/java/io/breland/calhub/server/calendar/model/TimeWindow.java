package io.breland.calhub.server.calendar.model;

import java.time.Instant;

public record TimeWindow(Instant start, Instant end) {

  public TimeWindow {
    if (start == null || end == null) {
      throw new IllegalArgumentException("Time window needs both a start and an end");
    }
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("Time window end " + end + " is before start " + start);
    }
  }
}
