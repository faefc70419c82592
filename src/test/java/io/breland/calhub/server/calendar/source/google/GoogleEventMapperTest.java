package io.breland.calhub.server.calendar.source.google;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.api.client.util.Data;
import com.google.api.services.calendar.model.Event;
import com.google.api.services.calendar.model.EventDateTime;
import io.breland.calhub.server.calendar.exceptions.InvalidRequestException;
import io.breland.calhub.server.calendar.model.CreateEventRequest;
import io.breland.calhub.server.calendar.model.EventPatch;
import io.breland.calhub.server.calendar.model.EventType;
import io.breland.calhub.server.calendar.model.TypeSpecificProperties;
import io.breland.calhub.server.calendar.model.WorkingLocationType;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

class GoogleEventMapperTest {
  private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");

  private final GoogleEventMapper mapper = new GoogleEventMapper();

  @Test
  void allDayTimesClearTheDateTimeField() {
    EventDateTime time = mapper.eventDateTime("2024-03-04", true, BERLIN);

    assertEquals("2024-03-04", time.getDate().toStringRfc3339());
    assertTrue(Data.isNull(time.getDateTime()));
  }

  @Test
  void timedValuesCarryTheConfiguredZone() {
    EventDateTime time = mapper.eventDateTime("2024-03-04T10:00:00", false, BERLIN);

    assertEquals(
        Instant.parse("2024-03-04T09:00:00Z").toEpochMilli(),
        time.getDateTime().getValue());
    assertEquals("Europe/Berlin", time.getTimeZone());
    assertTrue(Data.isNull(time.getDate()));
  }

  @Test
  void workingLocationEventsAreTransparent() {
    Event event =
        mapper.toGoogleEvent(
            CreateEventRequest.builder()
                .title("Office")
                .start("2024-03-04")
                .end("2024-03-05")
                .eventType(EventType.WORKING_LOCATION)
                .properties(
                    TypeSpecificProperties.builder()
                        .workingLocationType(WorkingLocationType.OFFICE_LOCATION)
                        .workingLocationLabel("HQ")
                        .build())
                .build(),
            BERLIN);

    assertEquals("workingLocation", event.getEventType());
    assertEquals("transparent", event.getTransparency());
    assertEquals("officeLocation", event.getWorkingLocationProperties().getType());
    assertEquals("HQ", event.getWorkingLocationProperties().getOfficeLocation().getLabel());
  }

  @Test
  void rejectsUnwritableTypesAndStrayProperties() {
    CreateEventRequest.CreateEventRequestBuilder base =
        CreateEventRequest.builder()
            .title("x")
            .start("2024-03-04T10:00:00Z")
            .end("2024-03-04T11:00:00Z");

    assertThrows(
        InvalidRequestException.class,
        () -> mapper.toGoogleEvent(base.eventType(EventType.BIRTHDAY).build(), BERLIN));
    assertThrows(
        InvalidRequestException.class,
        () ->
            mapper.toGoogleEvent(
                base.eventType(EventType.DEFAULT)
                    .properties(TypeSpecificProperties.builder().chatStatus("x").build())
                    .build(),
                BERLIN));
  }

  @Test
  void patchOnlySetsPresentFields() {
    Event patch =
        mapper.toGooglePatch(
            EventPatch.builder().title("Renamed").recurrence(List.of("RRULE:FREQ=DAILY")).build(),
            BERLIN);

    assertEquals("Renamed", patch.getSummary());
    assertEquals(List.of("RRULE:FREQ=DAILY"), patch.getRecurrence());
    assertNull(patch.getStart());
    assertNull(patch.getLocation());
    assertNull(patch.getAttendees());
  }

  @Test
  void outOfOfficePropertiesPatchKeepsItsType() {
    Event patch =
        mapper.toGooglePatch(
            EventPatch.builder()
                .eventType(EventType.OUT_OF_OFFICE)
                .properties(TypeSpecificProperties.builder().declineMessage("Away").build())
                .build(),
            BERLIN);

    assertEquals("outOfOffice", patch.getEventType());
    assertEquals("Away", patch.getOutOfOfficeProperties().getDeclineMessage());
    assertNull(patch.getSummary());
  }
}
