package io.breland.calhub.server.calendar.model;

import java.util.List;

public record Reminders(boolean useDefault, List<ReminderOverride> overrides) {

  public record ReminderOverride(String method, int minutes) {}
}
