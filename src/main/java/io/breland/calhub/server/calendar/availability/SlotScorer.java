package io.breland.calhub.server.calendar.availability;

import io.breland.calhub.server.calendar.model.AvailableSlot;
import io.breland.calhub.server.calendar.model.DayType;
import io.breland.calhub.server.calendar.model.Suitability;
import io.breland.calhub.server.config.CalendarProperties;
import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Assigns suitability, day type and reason to a slot. The rules run in a fixed order and a
 * later rule that fires replaces the reason set by an earlier one.
 */
@Component
public class SlotScorer {
  static final int MORNING_CUTOFF_HOUR = 12;
  static final long MORNING_MIN_MINUTES = 60;
  static final long SHORT_SLOT_MINUTES = 25;
  static final long EXTENDED_SLOT_MINUTES = 240;

  private final CalendarProperties properties;

  public SlotScorer(CalendarProperties properties) {
    this.properties = properties;
  }

  public AvailableSlot score(AvailableSlot slot) {
    DayOfWeek day = slot.start().getDayOfWeek();
    String dayName = day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    long minutes = slot.durationMinutes();

    Suitability suitability;
    DayType dayType;
    String reason = slot.reason();
    if (properties.getDeepWorkDays().contains(day)) {
      dayType = DayType.DEEP_WORK;
      suitability = Suitability.EXCELLENT;
      reason = dayName + " is a deep work day - excellent for focused tasks";
    } else if (properties.getMeetingHeavyDays().contains(day)) {
      dayType = DayType.MEETING_HEAVY;
      suitability = Suitability.ACCEPTABLE;
      reason = dayName + " is a meeting-heavy day - consider rescheduling for deep work";
    } else {
      dayType = DayType.NORMAL;
      suitability = Suitability.GOOD;
    }

    if (slot.start().getHour() < MORNING_CUTOFF_HOUR
        && minutes >= MORNING_MIN_MINUTES
        && suitability == Suitability.GOOD) {
      suitability = Suitability.EXCELLENT;
      reason = "Morning slot with " + minutes + " minutes - ideal for deep work";
    }

    if (minutes < SHORT_SLOT_MINUTES) {
      suitability = suitability.downgrade();
      reason = "Short slot (" + minutes + " minutes) - best for quick tasks";
    }

    if (minutes > EXTENDED_SLOT_MINUTES && dayType == DayType.DEEP_WORK) {
      suitability = Suitability.EXCELLENT;
      reason = "Extended " + minutes + " minute slot on " + dayName + " - perfect for deep work";
    }

    return slot.toBuilder().suitability(suitability).dayType(dayType).reason(reason).build();
  }
}
