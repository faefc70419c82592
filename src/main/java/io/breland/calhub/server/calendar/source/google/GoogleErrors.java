package io.breland.calhub.server.calendar.source.google;

import com.google.api.client.auth.oauth2.TokenResponseException;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpResponseException;
import io.breland.calhub.server.calendar.exceptions.BackendErrorKind;
import io.breland.calhub.server.calendar.exceptions.BackendException;
import io.breland.calhub.server.calendar.model.EventSource;
import java.io.IOException;

/** Translates Google client failures into {@link BackendException}s. */
final class GoogleErrors {

  private GoogleErrors() {}

  @FunctionalInterface
  interface GoogleCall<T> {
    T execute() throws IOException;
  }

  static <T> T execute(String operation, GoogleCall<T> call) {
    try {
      return call.execute();
    } catch (IOException e) {
      throw translate(operation, e);
    }
  }

  static BackendException translate(String operation, IOException e) {
    if (e instanceof TokenResponseException tokenError) {
      return new BackendException(
          EventSource.CLOUD,
          BackendErrorKind.UNAUTHORIZED,
          operation + " failed: credential refresh rejected (" + tokenError.getStatusCode() + ")",
          e);
    }
    if (e instanceof HttpResponseException httpError) {
      int status = httpError.getStatusCode();
      return new BackendException(
          EventSource.CLOUD,
          BackendErrorKind.fromHttpStatus(status),
          operation + " failed: " + status + " " + detail(httpError),
          e);
    }
    return new BackendException(
        EventSource.CLOUD, BackendErrorKind.NETWORK, operation + " failed: " + e.getMessage(), e);
  }

  private static String detail(HttpResponseException e) {
    if (e instanceof GoogleJsonResponseException jsonError
        && jsonError.getDetails() != null
        && jsonError.getDetails().getMessage() != null) {
      return jsonError.getDetails().getMessage();
    }
    return e.getStatusMessage() != null ? e.getStatusMessage() : "";
  }
}
