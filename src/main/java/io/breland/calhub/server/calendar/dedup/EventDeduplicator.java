package io.breland.calhub.server.calendar.dedup;

import io.breland.calhub.server.calendar.EventTimes;
import io.breland.calhub.server.calendar.model.CalendarEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Collapses events reported by more than one source. The first occurrence of a duplicate wins,
 * so callers control precedence through input order.
 */
@Component
public class EventDeduplicator {

  public List<CalendarEvent> deduplicate(List<CalendarEvent> events) {
    List<CalendarEvent> kept = new ArrayList<>(events.size());
    for (CalendarEvent candidate : events) {
      boolean duplicate = false;
      for (CalendarEvent existing : kept) {
        if (isDuplicate(existing, candidate)) {
          duplicate = true;
          break;
        }
      }
      if (!duplicate) {
        kept.add(candidate);
      }
    }
    return kept;
  }

  /**
   * Equal iCalUIDs, or failing that the same title (ignoring case) with the same start and end.
   */
  public static boolean isDuplicate(CalendarEvent a, CalendarEvent b) {
    if (hasText(a.iCalUID()) && a.iCalUID().equals(b.iCalUID())) {
      return true;
    }
    return sameTitle(a.title(), b.title())
        && EventTimes.sameMoment(a.start(), b.start())
        && EventTimes.sameMoment(a.end(), b.end());
  }

  private static boolean sameTitle(String a, String b) {
    if (a == null || b == null) {
      return a == null && b == null;
    }
    return a.toLowerCase(Locale.ROOT).equals(b.toLowerCase(Locale.ROOT));
  }

  private static boolean hasText(String value) {
    return value != null && !value.isEmpty();
  }
}
