package io.breland.calhub.server.calendar.model;

import java.util.List;

public record CommonAvailabilityResult(
    List<CommonFreeSlot> commonSlots,
    List<ParticipantAvailability> participants,
    TimeWindow timeRange) {}
