package io.breland.calhub.server.calendar.availability;

import io.breland.calhub.server.calendar.exceptions.CalendarException;
import io.breland.calhub.server.calendar.exceptions.InvalidRequestException;
import io.breland.calhub.server.calendar.model.BusyPeriod;
import io.breland.calhub.server.calendar.model.CommonAvailabilityResult;
import io.breland.calhub.server.calendar.model.CommonFreeSlot;
import io.breland.calhub.server.calendar.model.ParticipantAvailability;
import io.breland.calhub.server.calendar.model.PeopleAvailabilityResult;
import io.breland.calhub.server.calendar.model.TimeWindow;
import io.breland.calhub.server.calendar.source.SourceCapability;
import io.breland.calhub.server.config.CalendarProperties;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Free time shared by several people, computed from free/busy data. */
@Slf4j
@Component
public class CommonAvailabilityCalculator {
  private final CalendarProperties properties;

  public CommonAvailabilityCalculator(CalendarProperties properties) {
    this.properties = properties;
  }

  public CommonAvailabilityResult findCommonAvailability(
      SourceCapability freeBusySource,
      List<String> identities,
      TimeWindow window,
      Integer minDurationMinutes,
      boolean includeSelf) {
    List<String> participants = validate(identities);
    if (includeSelf) {
      addSelf(freeBusySource, participants);
    }
    int minDuration =
        minDurationMinutes != null ? minDurationMinutes : properties.getDefaultCommonSlotMinutes();
    if (minDuration <= 0) {
      throw new InvalidRequestException("minDuration must be positive, got " + minDuration);
    }

    List<ParticipantAvailability> results = freeBusySource.queryFreeBusy(participants, window);
    List<BusyPeriod> busy = new ArrayList<>();
    int answered = 0;
    for (ParticipantAvailability participant : results) {
      if (participant.failed()) {
        log.warn(
            "Excluding {} from common availability: {}",
            participant.identity(),
            participant.error());
        continue;
      }
      answered++;
      busy.addAll(participant.busyPeriods());
    }

    List<CommonFreeSlot> slots =
        answered == 0 ? List.of() : freeSlots(busy, window, minDuration, properties.zoneId());
    return new CommonAvailabilityResult(slots, results, window);
  }

  public PeopleAvailabilityResult checkPeopleAvailability(
      SourceCapability freeBusySource, List<String> identities, TimeWindow window) {
    List<String> participants = validate(identities);
    return new PeopleAvailabilityResult(
        freeBusySource.queryFreeBusy(participants, window), window);
  }

  /** Sorted, clipped to the window, with overlapping and touching periods merged. */
  public static List<BusyPeriod> mergeBusy(List<BusyPeriod> periods, TimeWindow window) {
    List<BusyPeriod> clipped = new ArrayList<>();
    for (BusyPeriod period : periods) {
      Instant start = period.start().isBefore(window.start()) ? window.start() : period.start();
      Instant end = period.end().isAfter(window.end()) ? window.end() : period.end();
      if (end.isAfter(start)) {
        clipped.add(new BusyPeriod(start, end));
      }
    }
    clipped.sort(Comparator.comparing(BusyPeriod::start));

    List<BusyPeriod> merged = new ArrayList<>();
    for (BusyPeriod period : clipped) {
      if (!merged.isEmpty()) {
        BusyPeriod last = merged.get(merged.size() - 1);
        if (!period.start().isAfter(last.end())) {
          if (period.end().isAfter(last.end())) {
            merged.set(merged.size() - 1, new BusyPeriod(last.start(), period.end()));
          }
          continue;
        }
      }
      merged.add(period);
    }
    return merged;
  }

  static List<CommonFreeSlot> freeSlots(
      List<BusyPeriod> busy, TimeWindow window, int minDuration, ZoneId zone) {
    List<CommonFreeSlot> slots = new ArrayList<>();
    Instant cursor = window.start();
    for (BusyPeriod period : mergeBusy(busy, window)) {
      addGap(slots, cursor, period.start(), minDuration, zone);
      cursor = period.end();
    }
    addGap(slots, cursor, window.end(), minDuration, zone);
    return slots;
  }

  private static void addGap(
      List<CommonFreeSlot> slots, Instant start, Instant end, int minDuration, ZoneId zone) {
    long minutes = Duration.between(start, end).toMinutes();
    if (minutes >= minDuration) {
      slots.add(
          new CommonFreeSlot(
              start.atZone(zone).toOffsetDateTime(), end.atZone(zone).toOffsetDateTime(), minutes));
    }
  }

  private List<String> validate(List<String> identities) {
    if (identities == null || identities.isEmpty()) {
      throw new InvalidRequestException("At least one participant is required");
    }
    Set<String> unique = new LinkedHashSet<>();
    for (String identity : identities) {
      if (identity == null || identity.isBlank()) {
        throw new InvalidRequestException("Participant identities must not be blank");
      }
      unique.add(identity.trim());
    }
    if (unique.size() > properties.getMaxParticipants()) {
      throw new InvalidRequestException(
          "At most "
              + properties.getMaxParticipants()
              + " participants are supported, got "
              + unique.size());
    }
    return new ArrayList<>(unique);
  }

  private static void addSelf(SourceCapability source, List<String> participants) {
    String self = currentUser(source);
    if (self == null) {
      return;
    }
    for (String participant : participants) {
      if (participant.equalsIgnoreCase(self)) {
        return;
      }
    }
    participants.add(self);
  }

  private static String currentUser(SourceCapability source) {
    try {
      return source.primaryIdentity();
    } catch (CalendarException e) {
      log.warn("Could not resolve the current user, leaving them out: {}", e.getMessage());
      return null;
    }
  }
}
