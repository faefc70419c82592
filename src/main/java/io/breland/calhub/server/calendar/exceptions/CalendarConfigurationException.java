package io.breland.calhub.server.calendar.exceptions;

/** No usable source for the request, or a named source is not enabled. */
public class CalendarConfigurationException extends CalendarException {

  public CalendarConfigurationException(String message) {
    super(message);
  }
}
