package io.breland.calhub.server.calendar.recurrence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.breland.calhub.server.calendar.exceptions.InvalidRequestException;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecurrenceRuleValidatorTest {

  @Test
  void acceptsCommonRules() {
    assertTrue(
        RecurrenceRuleValidator.validate(
                List.of(
                    "RRULE:FREQ=WEEKLY;BYDAY=MO,WE,FR;INTERVAL=2",
                    "RRULE:FREQ=MONTHLY;BYDAY=-1FR;UNTIL=20241231T235959Z",
                    "RRULE:FREQ=MONTHLY;BYMONTHDAY=1,-1;COUNT=12",
                    "EXDATE;TZID=Europe/Berlin:20240311T090000"))
            .isEmpty());
  }

  @Test
  void requiresKnownFrequency() {
    assertEquals(
        List.of("FREQ is required in RRULE"),
        RecurrenceRuleValidator.validate(List.of("RRULE:COUNT=3")));
    assertEquals(
        1, RecurrenceRuleValidator.validate(List.of("RRULE:FREQ=HOURLY")).size());
  }

  @Test
  void countAndUntilAreExclusive() {
    List<String> errors =
        RecurrenceRuleValidator.validate(
            List.of("RRULE:FREQ=DAILY;COUNT=5;UNTIL=20240401"));

    assertEquals(List.of("COUNT and UNTIL are mutually exclusive. Use only one of them."), errors);
  }

  @Test
  void reportsEveryProblem() {
    List<String> errors =
        RecurrenceRuleValidator.validate(
            List.of("RRULE:FREQ=DAILY;INTERVAL=0;BYDAY=XX;BYMONTHDAY=32", ""));

    assertEquals(4, errors.size());
  }

  @Test
  void checksByDayOrdinals() {
    assertTrue(RecurrenceRuleValidator.isValidByDay("MO"));
    assertTrue(RecurrenceRuleValidator.isValidByDay("+2TU"));
    assertTrue(RecurrenceRuleValidator.isValidByDay("-53SU"));
    assertFalse(RecurrenceRuleValidator.isValidByDay("0MO"));
    assertFalse(RecurrenceRuleValidator.isValidByDay("54MO"));
    assertFalse(RecurrenceRuleValidator.isValidByDay("M"));
  }

  @Test
  void checksUntilFormats() {
    assertTrue(RecurrenceRuleValidator.isValidUntil("20240314"));
    assertTrue(RecurrenceRuleValidator.isValidUntil("20240314T235959Z"));
    assertTrue(RecurrenceRuleValidator.isValidUntil("2024-03-14"));
    assertTrue(RecurrenceRuleValidator.isValidUntil("2024-03-14T23:59:59Z"));
    assertFalse(RecurrenceRuleValidator.isValidUntil("20241332"));
    assertFalse(RecurrenceRuleValidator.isValidUntil("tomorrow"));
  }

  @Test
  void requireValidJoinsErrors() {
    InvalidRequestException error =
        assertThrows(
            InvalidRequestException.class,
            () -> RecurrenceRuleValidator.requireValid(List.of("RRULE:INTERVAL=-1")));

    assertTrue(error.getMessage().startsWith("Invalid recurrence: "));
    assertTrue(error.getMessage().contains("FREQ is required in RRULE"));
    assertTrue(error.getMessage().contains("INTERVAL must be a positive integer, got: -1"));
  }
}
