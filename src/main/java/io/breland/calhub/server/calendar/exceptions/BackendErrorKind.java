package io.breland.calhub.server.calendar.exceptions;

public enum BackendErrorKind {
  RATE_LIMITED(true),
  SERVER_ERROR(true),
  NETWORK(true),
  UNAUTHORIZED(false),
  FORBIDDEN(false),
  NOT_FOUND(false),
  VALIDATION(false);

  private final boolean transientFailure;

  BackendErrorKind(boolean transientFailure) {
    this.transientFailure = transientFailure;
  }

  /** Whether retrying the same call may succeed. */
  public boolean isTransient() {
    return transientFailure;
  }

  public static BackendErrorKind fromHttpStatus(int status) {
    if (status == 429) {
      return RATE_LIMITED;
    }
    if (status >= 500) {
      return SERVER_ERROR;
    }
    return switch (status) {
      case 401 -> UNAUTHORIZED;
      case 403 -> FORBIDDEN;
      case 404, 410 -> NOT_FOUND;
      default -> VALIDATION;
    };
  }
}
