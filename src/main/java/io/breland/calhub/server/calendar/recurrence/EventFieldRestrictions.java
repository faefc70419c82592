package io.breland.calhub.server.calendar.recurrence;

import io.breland.calhub.server.calendar.exceptions.FieldRestrictionException;
import io.breland.calhub.server.calendar.model.EventField;
import io.breland.calhub.server.calendar.model.EventType;
import java.util.EnumSet;
import java.util.Set;

/** Which fields a patch may touch, per event type. */
public final class EventFieldRestrictions {
  private static final Set<EventField> BIRTHDAY_FIELDS =
      EnumSet.of(
          EventField.TITLE,
          EventField.REMINDERS,
          EventField.START,
          EventField.END,
          EventField.IS_ALL_DAY);
  private static final Set<EventField> FROM_GMAIL_FIELDS =
      EnumSet.of(EventField.REMINDERS, EventField.ATTENDEES);

  private EventFieldRestrictions() {}

  public static Set<EventField> allowedFields(EventType type) {
    return switch (type != null ? type : EventType.DEFAULT) {
      case BIRTHDAY -> EnumSet.copyOf(BIRTHDAY_FIELDS);
      case FROM_GMAIL -> EnumSet.copyOf(FROM_GMAIL_FIELDS);
      default -> EnumSet.allOf(EventField.class);
    };
  }

  public static void check(EventType type, Set<EventField> requested) {
    Set<EventField> allowed = allowedFields(type);
    Set<EventField> disallowed = EnumSet.noneOf(EventField.class);
    for (EventField field : requested) {
      if (!allowed.contains(field)) {
        disallowed.add(field);
      }
    }
    if (!disallowed.isEmpty()) {
      throw new FieldRestrictionException(
          type != null ? type : EventType.DEFAULT, disallowed, allowed);
    }
  }
}
