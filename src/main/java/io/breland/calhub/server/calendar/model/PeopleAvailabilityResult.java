package io.breland.calhub.server.calendar.model;

import java.util.List;

public record PeopleAvailabilityResult(
    List<ParticipantAvailability> people, TimeWindow timeRange) {}
