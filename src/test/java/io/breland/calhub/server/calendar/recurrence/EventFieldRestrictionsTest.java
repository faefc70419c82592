package io.breland.calhub.server.calendar.recurrence;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.breland.calhub.server.calendar.exceptions.FieldRestrictionException;
import io.breland.calhub.server.calendar.model.EventField;
import io.breland.calhub.server.calendar.model.EventType;
import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class EventFieldRestrictionsTest {

  @Test
  void birthdayRejectsLocation() {
    FieldRestrictionException error =
        assertThrows(
            FieldRestrictionException.class,
            () ->
                EventFieldRestrictions.check(
                    EventType.BIRTHDAY, EnumSet.of(EventField.TITLE, EventField.LOCATION)));

    assertEquals(Set.of(EventField.LOCATION), error.getDisallowed());
    assertEquals(
        "Cannot update field(s) location on birthday events. "
            + "Allowed fields: title, start, end, isAllDay, reminders",
        error.getMessage());
  }

  @Test
  void gmailEventsOnlyAllowRemindersAndAttendees() {
    assertEquals(
        EnumSet.of(EventField.REMINDERS, EventField.ATTENDEES),
        EventFieldRestrictions.allowedFields(EventType.FROM_GMAIL));
    assertThrows(
        FieldRestrictionException.class,
        () -> EventFieldRestrictions.check(EventType.FROM_GMAIL, EnumSet.of(EventField.START)));
  }

  @Test
  void otherTypesAllowEverything() {
    assertDoesNotThrow(
        () ->
            EventFieldRestrictions.check(
                EventType.OUT_OF_OFFICE, EnumSet.allOf(EventField.class)));
    assertEquals(
        EnumSet.allOf(EventField.class), EventFieldRestrictions.allowedFields(null));
  }
}
