package io.breland.calhub.server.calendar.exceptions;

import io.breland.calhub.server.calendar.model.EventSource;

public record SourceFailure(EventSource source, String reason, Throwable cause) {

  public static SourceFailure of(EventSource source, Throwable cause) {
    String reason = cause.getMessage() != null ? cause.getMessage() : cause.toString();
    return new SourceFailure(source, reason, cause);
  }

  @Override
  public String toString() {
    return source + ": " + reason;
  }
}
