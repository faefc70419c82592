package io.breland.calhub.server.calendar.exceptions;

import io.breland.calhub.server.calendar.model.EventSource;

/** A backend call failed; {@link #getKind()} decides whether it is worth retrying. */
public class BackendException extends CalendarException {
  private final EventSource source;
  private final BackendErrorKind kind;

  public BackendException(EventSource source, BackendErrorKind kind, String message) {
    super(message);
    this.source = source;
    this.kind = kind;
  }

  public BackendException(
      EventSource source, BackendErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
    this.kind = kind;
  }

  public EventSource getSource() {
    return source;
  }

  public BackendErrorKind getKind() {
    return kind;
  }

  public boolean isTransient() {
    return kind.isTransient();
  }

  public boolean isNotFound() {
    return kind == BackendErrorKind.NOT_FOUND;
  }
}
