package io.breland.calhub.server.calendar.model;

public record CalendarInfo(
    String calendarId,
    String summary,
    Boolean primary,
    String timeZone,
    String accessRole,
    EventSource source) {}
