package io.breland.calhub.server.calendar.exceptions;

import java.util.List;
import java.util.stream.Collectors;

/** Every source that was tried failed. */
public class AggregateSourceException extends CalendarException {
  private final List<SourceFailure> failures;

  public AggregateSourceException(String operation, List<SourceFailure> failures) {
    super(describe(operation, failures));
    this.failures = List.copyOf(failures);
    failures.stream().map(SourceFailure::cause).filter(c -> c != null).forEach(this::addSuppressed);
  }

  public List<SourceFailure> getFailures() {
    return failures;
  }

  private static String describe(String operation, List<SourceFailure> failures) {
    if (failures.isEmpty()) {
      return "Failed to " + operation + ": no source could handle the request";
    }
    return "Failed to "
        + operation
        + " from all sources: "
        + failures.stream().map(SourceFailure::toString).collect(Collectors.joining("; "));
  }
}
