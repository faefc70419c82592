package io.breland.calhub.server.calendar.availability;

import io.breland.calhub.server.calendar.EventTimes;
import io.breland.calhub.server.calendar.exceptions.InvalidRequestException;
import io.breland.calhub.server.calendar.model.AvailableSlot;
import io.breland.calhub.server.calendar.model.BusyPeriod;
import io.breland.calhub.server.calendar.model.CalendarEvent;
import io.breland.calhub.server.calendar.model.EventSource;
import io.breland.calhub.server.calendar.model.EventType;
import io.breland.calhub.server.calendar.model.FindSlotsRequest;
import io.breland.calhub.server.calendar.model.PreferredLocation;
import io.breland.calhub.server.calendar.model.Suitability;
import io.breland.calhub.server.calendar.model.TimeWindow;
import io.breland.calhub.server.calendar.model.WorkingHours;
import io.breland.calhub.server.calendar.model.WorkingLocationInfo;
import io.breland.calhub.server.config.CalendarProperties;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Turns a user's events into scored free slots inside working hours. */
@Slf4j
@Component
public class AvailabilityEngine {
  private static final Set<EventType> BLOCKING_TYPES =
      Set.of(EventType.DEFAULT, EventType.OUT_OF_OFFICE, EventType.FOCUS_TIME);
  private static final Set<EventType> NEVER_BLOCKING =
      Set.of(EventType.BIRTHDAY, EventType.FROM_GMAIL);

  private final CalendarProperties properties;
  private final SlotScorer scorer;

  public AvailabilityEngine(CalendarProperties properties, SlotScorer scorer) {
    this.properties = properties;
    this.scorer = scorer;
  }

  /** Midnight of the first day to midnight after the last day, in the configured zone. */
  public TimeWindow searchWindow(FindSlotsRequest request) {
    validate(request);
    ZoneId zone = properties.zoneId();
    return new TimeWindow(
        request.startDate().atStartOfDay(zone).toInstant(),
        request.endDate().plusDays(1).atStartOfDay(zone).toInstant());
  }

  public static boolean isBlocking(EventType type, boolean respectBlockingTypes) {
    EventType effective = type != null ? type : EventType.DEFAULT;
    if (!respectBlockingTypes) {
      return !NEVER_BLOCKING.contains(effective);
    }
    return BLOCKING_TYPES.contains(effective);
  }

  /**
   * @param events deduplicated events covering {@link #searchWindow}
   * @param sources the sources those events came from
   */
  public List<AvailableSlot> findSlots(
      FindSlotsRequest request, List<CalendarEvent> events, List<EventSource> sources) {
    validate(request);
    ZoneId zone = properties.zoneId();
    int minDuration = minDuration(request);
    int maxDuration = maxDuration(request);
    WorkingHours hours =
        request.workingHours() != null ? request.workingHours() : properties.workingHours();
    boolean respectBlocking =
        request.respectBlockingTypes() == null || request.respectBlockingTypes();

    List<BusyPeriod> timed = new ArrayList<>();
    List<BusyPeriod> allDay = new ArrayList<>();
    Map<LocalDate, WorkingLocationInfo> locations = new HashMap<>();
    for (CalendarEvent event : events) {
      if (event.effectiveType() == EventType.WORKING_LOCATION) {
        LocalDate date = EventTimes.localDate(event.start(), zone);
        if (date != null) {
          locations.putIfAbsent(date, workingLocation(event));
        }
      }
      if (!isBlocking(event.effectiveType(), respectBlocking)) {
        continue;
      }
      BusyPeriod period = busyPeriod(event, zone);
      if (period == null) {
        log.debug("Skipping event {} with unreadable times", event.id());
      } else if (event.allDay()) {
        allDay.add(period);
      } else {
        timed.add(period);
      }
    }
    timed.sort(Comparator.comparing(BusyPeriod::start));

    List<AvailableSlot> slots = new ArrayList<>();
    for (LocalDate day = request.startDate();
        !day.isAfter(request.endDate());
        day = day.plusDays(1)) {
      for (AvailableSlot slot :
          daySlots(day, hours, zone, timed, allDay, minDuration, maxDuration, sources)) {
        AvailableSlot scored = scorer.score(slot);
        WorkingLocationInfo location =
            locations.getOrDefault(day, WorkingLocationInfo.unknown());
        slots.add(scored.toBuilder().workingLocation(location).build());
      }
    }

    List<AvailableSlot> ordered = preferLocation(slots, request.preferredLocation());
    ordered.sort(
        Comparator.comparing(AvailableSlot::suitability).thenComparing(AvailableSlot::start));
    return ordered;
  }

  private List<AvailableSlot> daySlots(
      LocalDate day,
      WorkingHours hours,
      ZoneId zone,
      List<BusyPeriod> timed,
      List<BusyPeriod> allDay,
      int minDuration,
      int maxDuration,
      List<EventSource> sources) {
    Instant workStart = day.atTime(hours.start()).atZone(zone).toInstant();
    Instant workEnd = day.atTime(hours.end()).atZone(zone).toInstant();

    for (BusyPeriod period : allDay) {
      if (!period.start().isAfter(workStart) && !period.end().isBefore(workEnd)) {
        return List.of();
      }
    }

    List<AvailableSlot> slots = new ArrayList<>();
    Instant current = workStart;
    for (BusyPeriod busy : timed) {
      if (!busy.start().isBefore(workEnd) || !busy.end().isAfter(workStart)) {
        continue;
      }
      Instant gapEnd = clamp(busy.start(), workStart, workEnd);
      addSlot(slots, current, gapEnd, minDuration, maxDuration, zone, sources);
      Instant busyEnd = busy.end().isAfter(workEnd) ? workEnd : busy.end();
      if (busyEnd.isAfter(current)) {
        current = busyEnd;
      }
    }
    addSlot(slots, current, workEnd, minDuration, maxDuration, zone, sources);
    return slots;
  }

  private static void addSlot(
      List<AvailableSlot> slots,
      Instant start,
      Instant end,
      int minDuration,
      int maxDuration,
      ZoneId zone,
      List<EventSource> sources) {
    long minutes = Duration.between(start, end).toMinutes();
    if (minutes < minDuration || minutes > maxDuration) {
      return;
    }
    slots.add(
        AvailableSlot.builder()
            .start(start.atZone(zone).toOffsetDateTime())
            .end(end.atZone(zone).toOffsetDateTime())
            .durationMinutes(minutes)
            .suitability(Suitability.GOOD)
            .reason(minutes + " minutes free")
            .conflicts(List.of())
            .sources(List.copyOf(sources))
            .build());
  }

  private static List<AvailableSlot> preferLocation(
      List<AvailableSlot> slots, PreferredLocation preferred) {
    if (preferred == null || !preferred.reorders()) {
      return new ArrayList<>(slots);
    }
    List<AvailableSlot> ordered = new ArrayList<>(slots.size());
    List<AvailableSlot> others = new ArrayList<>();
    for (AvailableSlot slot : slots) {
      if (preferred.matches(slot.workingLocation())) {
        ordered.add(slot);
      } else {
        others.add(slot);
      }
    }
    ordered.addAll(others);
    return ordered;
  }

  private static BusyPeriod busyPeriod(CalendarEvent event, ZoneId zone) {
    Instant start = EventTimes.toInstant(event.start(), zone);
    Instant end = EventTimes.toInstant(event.end(), zone);
    if (start == null || end == null) {
      return null;
    }
    if (event.allDay() && !end.isAfter(start)) {
      // single-day all-day events reported with an inclusive end date
      end = start.atZone(zone).toLocalDate().plusDays(1).atStartOfDay(zone).toInstant();
    }
    return new BusyPeriod(start, end);
  }

  private static WorkingLocationInfo workingLocation(CalendarEvent event) {
    return event.properties() != null
        ? event.properties().workingLocation()
        : WorkingLocationInfo.unknown();
  }

  private static Instant clamp(Instant value, Instant min, Instant max) {
    if (value.isBefore(min)) {
      return min;
    }
    return value.isAfter(max) ? max : value;
  }

  private int minDuration(FindSlotsRequest request) {
    return request.minDurationMinutes() != null
        ? request.minDurationMinutes()
        : properties.getDefaultMinSlotMinutes();
  }

  private int maxDuration(FindSlotsRequest request) {
    return request.maxDurationMinutes() != null
        ? request.maxDurationMinutes()
        : properties.getDefaultMaxSlotMinutes();
  }

  private void validate(FindSlotsRequest request) {
    if (request.startDate() == null || request.endDate() == null) {
      throw new InvalidRequestException("startDate and endDate are required");
    }
    if (request.endDate().isBefore(request.startDate())) {
      throw new InvalidRequestException("endDate must not be before startDate");
    }
    int min = minDuration(request);
    int max = maxDuration(request);
    if (min <= 0 || max < min) {
      throw new InvalidRequestException(
          "Slot durations must satisfy 0 < minDuration <= maxDuration, got " + min + " and " + max);
    }
  }
}
