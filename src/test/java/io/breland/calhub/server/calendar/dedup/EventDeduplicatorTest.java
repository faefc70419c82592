package io.breland.calhub.server.calendar.dedup;

import static io.breland.calhub.server.calendar.CalendarTestSupport.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.breland.calhub.server.calendar.model.CalendarEvent;
import io.breland.calhub.server.calendar.model.EventSource;
import java.util.List;
import org.junit.jupiter.api.Test;

class EventDeduplicatorTest {
  private final EventDeduplicator deduplicator = new EventDeduplicator();

  @Test
  void keepsFirstCopyWhenICalUidsMatch() {
    CalendarEvent local =
        event("os-1", "Sync", "2024-03-04T10:00:00Z", "2024-03-04T11:00:00Z", EventSource.OS)
            .toBuilder()
            .iCalUID("uid-sync")
            .build();
    CalendarEvent cloud =
        event(
                "g-1",
                "Weekly sync",
                "2024-03-04T10:00:00Z",
                "2024-03-04T11:00:00Z",
                EventSource.CLOUD)
            .toBuilder()
            .iCalUID("uid-sync")
            .build();

    List<CalendarEvent> osFirst = deduplicator.deduplicate(List.of(local, cloud));
    List<CalendarEvent> cloudFirst = deduplicator.deduplicate(List.of(cloud, local));

    assertEquals(1, osFirst.size());
    assertSame(local, osFirst.get(0));
    assertEquals(1, cloudFirst.size());
    assertSame(cloud, cloudFirst.get(0));
  }

  @Test
  void matchesTitleIgnoringCaseWithSameTimes() {
    CalendarEvent a =
        event("os-1", "Lunch", "2024-03-04T12:00:00Z", "2024-03-04T13:00:00Z", EventSource.OS);
    CalendarEvent b =
        event("g-1", "LUNCH", "2024-03-04T12:00:00Z", "2024-03-04T13:00:00Z", EventSource.CLOUD);

    assertEquals(List.of(a), deduplicator.deduplicate(List.of(a, b)));
  }

  @Test
  void treatsDifferentOffsetsForTheSameInstantAsEqual() {
    CalendarEvent a =
        event("os-1", "Lunch", "2024-03-04T12:00:00Z", "2024-03-04T13:00:00Z", EventSource.OS);
    CalendarEvent b =
        event(
            "g-1",
            "Lunch",
            "2024-03-04T13:00:00.000+01:00",
            "2024-03-04T14:00:00.000+01:00",
            EventSource.CLOUD);

    assertTrue(EventDeduplicator.isDuplicate(a, b));
  }

  @Test
  void keepsEventsThatDifferInTimeOrTitle() {
    CalendarEvent a =
        event("1", "Lunch", "2024-03-04T12:00:00Z", "2024-03-04T13:00:00Z", EventSource.OS);
    CalendarEvent later =
        event("2", "Lunch", "2024-03-05T12:00:00Z", "2024-03-05T13:00:00Z", EventSource.CLOUD);
    CalendarEvent other =
        event("3", "Dinner", "2024-03-04T12:00:00Z", "2024-03-04T13:00:00Z", EventSource.CLOUD);

    assertEquals(List.of(a, later, other), deduplicator.deduplicate(List.of(a, later, other)));
    assertFalse(EventDeduplicator.isDuplicate(a, later));
  }

  @Test
  void deduplicatingTwiceChangesNothing() {
    CalendarEvent a =
        event("1", "Sync", "2024-03-04T10:00:00Z", "2024-03-04T11:00:00Z", EventSource.OS)
            .toBuilder()
            .iCalUID("uid-1")
            .build();
    CalendarEvent b =
        event("2", "Sync", "2024-03-04T10:00:00Z", "2024-03-04T11:00:00Z", EventSource.CLOUD)
            .toBuilder()
            .iCalUID("uid-1")
            .build();
    CalendarEvent c =
        event("3", "Review", "2024-03-04T14:00:00Z", "2024-03-04T15:00:00Z", EventSource.CLOUD);

    List<CalendarEvent> once = deduplicator.deduplicate(List.of(a, b, c));
    List<CalendarEvent> twice = deduplicator.deduplicate(once);

    assertEquals(List.of(a, c), once);
    assertEquals(once, twice);
  }
}
