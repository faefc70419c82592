package io.breland.calhub.server.calendar.source.os;

import io.breland.calhub.server.calendar.model.CalendarEvent;
import io.breland.calhub.server.calendar.model.TimeWindow;
import java.util.List;

/** Read access to the calendars stored on this machine. */
public interface LocalCalendarStore {

  /**
   * Events overlapping {@code window}. A null {@code calendarName} reads every calendar.
   */
  List<CalendarEvent> fetchEvents(TimeWindow window, String calendarName);

  boolean isAccessible();
}
