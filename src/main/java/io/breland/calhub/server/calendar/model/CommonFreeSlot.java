package io.breland.calhub.server.calendar.model;

import java.time.OffsetDateTime;

public record CommonFreeSlot(OffsetDateTime start, OffsetDateTime end, long durationMinutes) {}
