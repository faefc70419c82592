package io.breland.calhub.server.calendar.coordination;

import static io.breland.calhub.server.calendar.CalendarTestSupport.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.MoreExecutors;
import io.breland.calhub.server.calendar.CalendarTestSupport;
import io.breland.calhub.server.calendar.availability.AvailabilityEngine;
import io.breland.calhub.server.calendar.availability.CommonAvailabilityCalculator;
import io.breland.calhub.server.calendar.availability.SlotScorer;
import io.breland.calhub.server.calendar.dedup.EventDeduplicator;
import io.breland.calhub.server.calendar.exceptions.BackendErrorKind;
import io.breland.calhub.server.calendar.exceptions.BackendException;
import io.breland.calhub.server.calendar.exceptions.CalendarConfigurationException;
import io.breland.calhub.server.calendar.exceptions.FieldRestrictionException;
import io.breland.calhub.server.calendar.exceptions.InvalidRequestException;
import io.breland.calhub.server.calendar.exceptions.UnsupportedSourceOperationException;
import io.breland.calhub.server.calendar.model.AvailableSlot;
import io.breland.calhub.server.calendar.model.CalendarEvent;
import io.breland.calhub.server.calendar.model.CreateEventRequest;
import io.breland.calhub.server.calendar.model.EventPatch;
import io.breland.calhub.server.calendar.model.EventSource;
import io.breland.calhub.server.calendar.model.EventType;
import io.breland.calhub.server.calendar.model.FindSlotsRequest;
import io.breland.calhub.server.calendar.model.ParticipantAvailability;
import io.breland.calhub.server.calendar.model.RecurrenceScope;
import io.breland.calhub.server.calendar.model.RespondResult;
import io.breland.calhub.server.calendar.model.ResponseType;
import io.breland.calhub.server.calendar.model.SourceStatus;
import io.breland.calhub.server.calendar.model.TimeWindow;
import io.breland.calhub.server.calendar.recurrence.RecurrenceScopeResolver;
import io.breland.calhub.server.calendar.source.SourceCapability;
import io.breland.calhub.server.config.CalendarProperties;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class SourceCoordinatorTest {
  private static final TimeWindow MONDAY =
      new TimeWindow(Instant.parse("2024-03-04T00:00:00Z"), Instant.parse("2024-03-05T00:00:00Z"));

  private SourceCapability os;
  private SourceCapability cloud;
  private CalendarProperties properties;
  private SourceCoordinator coordinator;

  @BeforeEach
  void setUp() {
    os = Mockito.mock(SourceCapability.class);
    cloud = Mockito.mock(SourceCapability.class);
    when(os.source()).thenReturn(EventSource.OS);
    when(cloud.source()).thenReturn(EventSource.CLOUD);
    properties = CalendarTestSupport.properties();
    FallbackCoordinator fallback =
        new FallbackCoordinator(
            List.of(os, cloud), properties, MoreExecutors.newDirectExecutorService());
    coordinator =
        new SourceCoordinator(
            fallback,
            new EventDeduplicator(),
            new AvailabilityEngine(properties, new SlotScorer(properties)),
            new CommonAvailabilityCalculator(properties),
            new RecurrenceScopeResolver(properties),
            properties);
  }

  private void stubMondayEvents() {
    CalendarEvent localSync =
        event("os-1", "Sync", "2024-03-04T10:00:00Z", "2024-03-04T11:00:00Z", EventSource.OS)
            .toBuilder()
            .iCalUID("uid-sync")
            .build();
    CalendarEvent localLunch =
        event("os-2", "Lunch", "2024-03-04T12:00:00Z", "2024-03-04T13:00:00Z", EventSource.OS);
    CalendarEvent cloudSync =
        event("g-1", "Sync", "2024-03-04T10:00:00Z", "2024-03-04T11:00:00Z", EventSource.CLOUD)
            .toBuilder()
            .iCalUID("uid-sync")
            .build();
    CalendarEvent cloudReview =
        event("g-2", "Review", "2024-03-04T15:00:00Z", "2024-03-04T16:00:00Z", EventSource.CLOUD);
    when(os.listEvents(any(), any())).thenReturn(List.of(localSync, localLunch));
    when(cloud.listEvents(any(), any())).thenReturn(List.of(cloudSync, cloudReview));
  }

  @Test
  void getEventsMergesAndDeduplicatesSources() {
    stubMondayEvents();

    List<CalendarEvent> events = coordinator.getEvents(MONDAY);

    assertEquals(List.of("os-1", "os-2", "g-2"), events.stream().map(CalendarEvent::id).toList());
  }

  @Test
  void getEventsSurvivesOneFailedSource() {
    stubMondayEvents();
    when(os.listEvents(any(), any()))
        .thenThrow(new BackendException(EventSource.OS, BackendErrorKind.FORBIDDEN, "denied"));

    List<CalendarEvent> events = coordinator.getEvents(MONDAY);

    assertEquals(List.of("g-1", "g-2"), events.stream().map(CalendarEvent::id).toList());
  }

  @Test
  void findAvailableSlotsWalksMergedEvents() {
    stubMondayEvents();
    FindSlotsRequest request =
        FindSlotsRequest.builder()
            .startDate(LocalDate.of(2024, 3, 4))
            .endDate(LocalDate.of(2024, 3, 4))
            .build();

    List<AvailableSlot> slots = coordinator.findAvailableSlots(request);

    assertEquals(
        List.of(
            OffsetDateTime.parse("2024-03-04T09:00:00Z"),
            OffsetDateTime.parse("2024-03-04T11:00:00Z"),
            OffsetDateTime.parse("2024-03-04T13:00:00Z"),
            OffsetDateTime.parse("2024-03-04T16:00:00Z")),
        slots.stream().map(AvailableSlot::start).sorted().toList());
    assertEquals(
        360, slots.stream().mapToLong(AvailableSlot::durationMinutes).sum());
    assertEquals(List.of(EventSource.OS, EventSource.CLOUD), slots.get(0).sources());
  }

  @Test
  void createPrefersRequestedSourceAndFallsBack() {
    CreateEventRequest request =
        CreateEventRequest.builder()
            .title("Review")
            .start("2024-03-04T15:00:00Z")
            .end("2024-03-04T16:00:00Z")
            .build();
    CalendarEvent created =
        event("g-3", "Review", "2024-03-04T15:00:00Z", "2024-03-04T16:00:00Z", EventSource.CLOUD);
    when(os.createEvent(request))
        .thenThrow(new UnsupportedSourceOperationException(EventSource.OS, "createEvent"));
    when(cloud.createEvent(request)).thenReturn(created);

    assertEquals(created, coordinator.createEvent(request, EventSource.OS));
  }

  @Test
  void recurringCreateAlwaysGoesToCloud() {
    CreateEventRequest request =
        CreateEventRequest.builder()
            .title("Standup")
            .start("2024-03-04T09:00:00Z")
            .end("2024-03-04T09:15:00Z")
            .recurrence(List.of("RRULE:FREQ=DAILY;COUNT=5"))
            .build();

    coordinator.createEvent(request, EventSource.OS);

    verify(cloud).createEvent(request);
    verify(os, never()).createEvent(any());

    properties.getCloud().setEnabled(false);
    assertThrows(
        CalendarConfigurationException.class, () -> coordinator.createEvent(request, null));
  }

  @Test
  void createRejectsInvalidRequests() {
    CreateEventRequest base =
        CreateEventRequest.builder()
            .title("Thing")
            .start("2024-03-04T10:00:00Z")
            .end("2024-03-04T11:00:00Z")
            .build();

    assertThrows(
        InvalidRequestException.class,
        () -> coordinator.createEvent(base.toBuilder().title(" ").build(), null));
    assertThrows(
        InvalidRequestException.class,
        () ->
            coordinator.createEvent(
                base.toBuilder().eventType(EventType.BIRTHDAY).build(), null));
    assertThrows(
        InvalidRequestException.class,
        () -> coordinator.createEvent(base.toBuilder().end("2024-03-04T09:00:00Z").build(), null));
    assertThrows(
        InvalidRequestException.class,
        () ->
            coordinator.createEvent(
                base.toBuilder().recurrence(List.of("RRULE:FREQ=SOMETIMES")).build(), null));
    verify(os, never()).createEvent(any());
    verify(cloud, never()).createEvent(any());
  }

  @Test
  void updateRoutesToSourceHoldingTheEvent() {
    CalendarEvent held =
        event("g-1", "Sync", "2024-03-04T10:00:00Z", "2024-03-04T11:00:00Z", EventSource.CLOUD);
    when(os.getEvent("g-1"))
        .thenThrow(new UnsupportedSourceOperationException(EventSource.OS, "getEvent"));
    when(cloud.getEvent("g-1")).thenReturn(held);
    EventPatch patch = EventPatch.builder().title("Weekly sync").build();
    when(cloud.updateEvent("g-1", patch)).thenReturn(held.toBuilder().title("Weekly sync").build());

    CalendarEvent updated = coordinator.updateEvent("g-1", patch, null);

    assertEquals("Weekly sync", updated.title());
  }

  @Test
  void updateRejectsEmptyPatchAndRestrictedFields() {
    assertThrows(
        InvalidRequestException.class,
        () -> coordinator.updateEvent("g-1", EventPatch.builder().build(), null));

    CalendarEvent birthday =
        event("b-1", "Ada", "2024-03-04", "2024-03-05", EventSource.CLOUD).toBuilder()
            .allDay(true)
            .eventType(EventType.BIRTHDAY)
            .build();
    when(os.getEvent("b-1"))
        .thenThrow(new UnsupportedSourceOperationException(EventSource.OS, "getEvent"));
    when(cloud.getEvent("b-1")).thenReturn(birthday);

    assertThrows(
        FieldRestrictionException.class,
        () ->
            coordinator.updateEvent(
                "b-1", EventPatch.builder().location("Cafe").build(), RecurrenceScope.THIS_EVENT));
    verify(cloud, never()).updateEvent(anyString(), any());
  }

  @Test
  void deleteWithoutScopeTriesEverySource() {
    doThrow(new UnsupportedSourceOperationException(EventSource.OS, "deleteEvent"))
        .when(os)
        .deleteEvent("g-1");

    coordinator.deleteEvent("g-1", null, null);

    verify(cloud).deleteEvent("g-1");
  }

  @Test
  void deleteThisAndFutureEndsTheSeries() {
    CalendarEvent parent =
        event("s", "Standup", "2024-03-01T09:00:00Z", "2024-03-01T09:15:00Z", EventSource.CLOUD)
            .toBuilder()
            .recurrence(List.of("RRULE:FREQ=DAILY"))
            .build();
    CalendarEvent occurrence =
        event("s_1", "Standup", "2024-03-08T09:00:00Z", "2024-03-08T09:15:00Z", EventSource.CLOUD)
            .toBuilder()
            .recurringEventId("s")
            .build();
    when(cloud.getEvent("s_1")).thenReturn(occurrence);
    when(cloud.getEvent("s")).thenReturn(parent);

    coordinator.deleteEvent("s_1", EventSource.CLOUD, RecurrenceScope.THIS_AND_FUTURE);

    verify(cloud)
        .updateEvent(
            eq("s"),
            eq(EventPatch.recurrenceOnly(List.of("RRULE:FREQ=DAILY;UNTIL=20240307T235959Z"))));
    verify(cloud, never()).deleteEvent(anyString());
  }

  @Test
  void respondReportsStatusAndSource() {
    CalendarEvent invite =
        event("g-5", "Planning", "2024-03-04T15:00:00Z", "2024-03-04T16:00:00Z", EventSource.CLOUD);
    when(os.respondToEvent("g-5", ResponseType.ACCEPT, null))
        .thenThrow(new UnsupportedSourceOperationException(EventSource.OS, "respondToEvent"));
    when(cloud.respondToEvent("g-5", ResponseType.ACCEPT, null)).thenReturn(invite);

    RespondResult result =
        coordinator.respondToEvent("g-5", ResponseType.ACCEPT, EventSource.OS, null);

    assertTrue(result.success());
    assertEquals(EventSource.CLOUD, result.source());
    assertEquals("Responded accepted to \"Planning\"", result.message());
  }

  @Test
  void commonAvailabilityNeedsCloud() {
    when(cloud.queryFreeBusy(anyList(), any()))
        .thenReturn(List.of(ParticipantAvailability.busy("a@example.com", List.of())));

    assertEquals(
        1,
        coordinator
            .findCommonAvailability(List.of("a@example.com"), MONDAY, 30, false)
            .commonSlots()
            .size());

    properties.getCloud().setEnabled(false);
    assertThrows(
        CalendarConfigurationException.class,
        () -> coordinator.checkPeopleAvailability(List.of("a@example.com"), MONDAY));
  }

  @Test
  void reportsSourceStatus() {
    when(os.isAvailable()).thenReturn(false);
    when(cloud.isAvailable()).thenReturn(true);
    properties.getOs().setEnabled(false);

    assertEquals(new SourceStatus(false, true), coordinator.detectAvailableSources());
    assertEquals(List.of(EventSource.CLOUD), coordinator.getEnabledSources());
    assertEquals(Map.of(EventSource.CLOUD, true), coordinator.healthCheck());
    assertFalse(coordinator.healthCheck().containsKey(EventSource.OS));
  }
}
