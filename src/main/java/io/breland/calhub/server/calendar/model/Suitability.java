package io.breland.calhub.server.calendar.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Declared best first; ordinal order is the caller-visible sort order. */
public enum Suitability {
  @JsonProperty("excellent")
  EXCELLENT,
  @JsonProperty("good")
  GOOD,
  @JsonProperty("acceptable")
  ACCEPTABLE;

  public Suitability downgrade() {
    return switch (this) {
      case EXCELLENT -> GOOD;
      case GOOD, ACCEPTABLE -> ACCEPTABLE;
    };
  }
}
