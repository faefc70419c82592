package io.breland.calhub.server.calendar.model;

import java.time.Instant;

/** Half-open busy interval {@code [start, end)}. */
public record BusyPeriod(Instant start, Instant end) {}
