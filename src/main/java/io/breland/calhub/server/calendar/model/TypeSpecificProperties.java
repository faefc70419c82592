package io.breland.calhub.server.calendar.model;

import lombok.Builder;

/** Properties that only exist for some event types; unused fields stay null. */
@Builder
public record TypeSpecificProperties(
    String autoDeclineMode,
    String declineMessage,
    String chatStatus,
    WorkingLocationType workingLocationType,
    String workingLocationLabel) {

  public WorkingLocationInfo workingLocation() {
    if (workingLocationType == null) {
      return WorkingLocationInfo.unknown();
    }
    return new WorkingLocationInfo(workingLocationType, workingLocationLabel);
  }
}
