package io.breland.calhub.server.calendar.model;

public record RespondResult(boolean success, String message, EventSource source) {}
