package io.breland.calhub.server.calendar.model;

import java.util.List;
import java.util.Objects;

/** Free/busy answer for one identity; {@code error} is set when the lookup failed. */
public record ParticipantAvailability(
    String identity, List<BusyPeriod> busyPeriods, boolean available, String error) {

  public static ParticipantAvailability busy(String identity, List<BusyPeriod> busyPeriods) {
    return new ParticipantAvailability(
        identity, List.copyOf(busyPeriods), busyPeriods.isEmpty(), null);
  }

  /** A failed lookup always carries an error, even when the backend gave no reason. */
  public static ParticipantAvailability failed(String identity, String error) {
    return new ParticipantAvailability(
        identity, List.of(), false, Objects.requireNonNullElse(error, "unknown error"));
  }

  public boolean failed() {
    return error != null;
  }
}
