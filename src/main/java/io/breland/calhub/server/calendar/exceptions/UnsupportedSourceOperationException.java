package io.breland.calhub.server.calendar.exceptions;

import io.breland.calhub.server.calendar.model.EventSource;

public class UnsupportedSourceOperationException extends CalendarException {
  private final EventSource source;
  private final String operation;

  public UnsupportedSourceOperationException(EventSource source, String operation) {
    super(operation + " is not supported by the " + source + " calendar source");
    this.source = source;
    this.operation = operation;
  }

  public EventSource getSource() {
    return source;
  }

  public String getOperation() {
    return operation;
  }
}
