package io.breland.calhub.server.calendar.source;

import io.breland.calhub.server.calendar.exceptions.UnsupportedSourceOperationException;
import io.breland.calhub.server.calendar.model.CalendarEvent;
import io.breland.calhub.server.calendar.model.CalendarInfo;
import io.breland.calhub.server.calendar.model.CreateEventRequest;
import io.breland.calhub.server.calendar.model.EventFilter;
import io.breland.calhub.server.calendar.model.EventPatch;
import io.breland.calhub.server.calendar.model.EventSource;
import io.breland.calhub.server.calendar.model.ParticipantAvailability;
import io.breland.calhub.server.calendar.model.ResponseType;
import io.breland.calhub.server.calendar.model.TimeWindow;
import java.util.List;

/**
 * One calendar backend. Operations a backend cannot perform throw {@link
 * UnsupportedSourceOperationException}; whether the backend is enabled is decided elsewhere.
 */
public interface SourceCapability {

  EventSource source();

  boolean isAvailable();

  List<CalendarEvent> listEvents(TimeWindow window, EventFilter filter);

  default CalendarEvent getEvent(String eventId) {
    throw new UnsupportedSourceOperationException(source(), "getEvent");
  }

  default CalendarEvent createEvent(CreateEventRequest request) {
    throw new UnsupportedSourceOperationException(source(), "createEvent");
  }

  default CalendarEvent updateEvent(String eventId, EventPatch patch) {
    throw new UnsupportedSourceOperationException(source(), "updateEvent");
  }

  default void deleteEvent(String eventId) {
    throw new UnsupportedSourceOperationException(source(), "deleteEvent");
  }

  default CalendarEvent respondToEvent(String eventId, ResponseType response, String calendarId) {
    throw new UnsupportedSourceOperationException(source(), "respondToEvent");
  }

  /** Busy periods per identity, in the order the identities were given. */
  default List<ParticipantAvailability> queryFreeBusy(List<String> identities, TimeWindow window) {
    throw new UnsupportedSourceOperationException(source(), "queryFreeBusy");
  }

  /** Identity of the authenticated user, usually an email address. */
  default String primaryIdentity() {
    throw new UnsupportedSourceOperationException(source(), "primaryIdentity");
  }

  default List<CalendarInfo> listCalendars() {
    throw new UnsupportedSourceOperationException(source(), "listCalendars");
  }
}
