package io.breland.calhub.server.calendar.source.os;

import io.breland.calhub.server.calendar.BackendRetry;
import io.breland.calhub.server.calendar.exceptions.CalendarException;
import io.breland.calhub.server.calendar.model.CalendarEvent;
import io.breland.calhub.server.calendar.model.EventFilter;
import io.breland.calhub.server.calendar.model.EventSource;
import io.breland.calhub.server.calendar.model.TimeWindow;
import io.breland.calhub.server.calendar.source.SourceCapability;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** The OS calendar store. Read-only: listing and availability. */
@Slf4j
@Component
public class OsCalendarSource implements SourceCapability {
  private final LocalCalendarStore store;
  private final BackendRetry retry;

  public OsCalendarSource(LocalCalendarStore store, BackendRetry retry) {
    this.store = store;
    this.retry = retry;
  }

  @Override
  public EventSource source() {
    return EventSource.OS;
  }

  @Override
  public boolean isAvailable() {
    try {
      return store.isAccessible();
    } catch (CalendarException e) {
      log.warn("OS calendar store is not accessible: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public List<CalendarEvent> listEvents(TimeWindow window, EventFilter filter) {
    EventFilter effective = filter != null ? filter : EventFilter.none();
    List<CalendarEvent> events =
        retry.call(
            EventSource.OS,
            "listEvents",
            () -> store.fetchEvents(window, effective.calendar()));
    return events.stream().filter(effective::accepts).toList();
  }
}
