package io.breland.calhub.server.calendar.exceptions;

public class InvalidRequestException extends CalendarException {

  public InvalidRequestException(String message) {
    super(message);
  }
}
