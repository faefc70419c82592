package io.breland.calhub.server.calendar.model;

public record SourceStatus(boolean os, boolean cloud) {

  public boolean of(EventSource source) {
    return switch (source) {
      case OS -> os;
      case CLOUD -> cloud;
    };
  }
}
