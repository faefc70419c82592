package io.breland.calhub.server.calendar.model;

import java.time.OffsetDateTime;
import java.util.List;
import lombok.Builder;

@Builder(toBuilder = true)
public record AvailableSlot(
    OffsetDateTime start,
    OffsetDateTime end,
    long durationMinutes,
    Suitability suitability,
    DayType dayType,
    String reason,
    List<String> conflicts,
    List<EventSource> sources,
    WorkingLocationInfo workingLocation) {}
