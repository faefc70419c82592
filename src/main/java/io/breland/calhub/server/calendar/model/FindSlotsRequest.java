package io.breland.calhub.server.calendar.model;

import java.time.LocalDate;
import lombok.Builder;

/**
 * Free-slot search over the calendar days {@code startDate..endDate} (both inclusive).
 * Null optional components fall back to engine defaults.
 */
@Builder
public record FindSlotsRequest(
    LocalDate startDate,
    LocalDate endDate,
    Integer minDurationMinutes,
    Integer maxDurationMinutes,
    WorkingHours workingHours,
    PreferredLocation preferredLocation,
    Boolean respectBlockingTypes) {}
