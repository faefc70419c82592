package io.breland.calhub.server.calendar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.breland.calhub.server.calendar.exceptions.BackendErrorKind;
import io.breland.calhub.server.calendar.exceptions.BackendException;
import io.breland.calhub.server.calendar.exceptions.InvalidRequestException;
import io.breland.calhub.server.calendar.model.EventSource;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class BackendRetryTest {
  private final BackendRetry retry = CalendarTestSupport.retry(CalendarTestSupport.properties());

  @Test
  void retriesTransientFailuresUntilSuccess() {
    AtomicInteger attempts = new AtomicInteger();

    String result =
        retry.call(
            EventSource.CLOUD,
            "listEvents",
            () -> {
              if (attempts.incrementAndGet() < 3) {
                throw new BackendException(
                    EventSource.CLOUD, BackendErrorKind.RATE_LIMITED, "slow down");
              }
              return "ok";
            });

    assertEquals("ok", result);
    assertEquals(3, attempts.get());
  }

  @Test
  void givesUpAfterMaxAttempts() {
    AtomicInteger attempts = new AtomicInteger();

    BackendException error =
        assertThrows(
            BackendException.class,
            () ->
                retry.run(
                    EventSource.OS,
                    "listEvents",
                    () -> {
                      attempts.incrementAndGet();
                      throw new BackendException(
                          EventSource.OS, BackendErrorKind.NETWORK, "timeout");
                    }));

    assertEquals(BackendErrorKind.NETWORK, error.getKind());
    assertEquals(3, attempts.get());
  }

  @Test
  void terminalFailuresAreNotRetried() {
    AtomicInteger attempts = new AtomicInteger();

    assertThrows(
        BackendException.class,
        () ->
            retry.run(
                EventSource.CLOUD,
                "getEvent",
                () -> {
                  attempts.incrementAndGet();
                  throw new BackendException(
                      EventSource.CLOUD, BackendErrorKind.NOT_FOUND, "missing");
                }));

    assertEquals(1, attempts.get());
  }

  @Test
  void onlyTransientBackendErrorsAreRetryable() {
    assertTrue(
        BackendRetry.isRetryable(
            new BackendException(EventSource.CLOUD, BackendErrorKind.SERVER_ERROR, "x")));
    assertFalse(
        BackendRetry.isRetryable(
            new BackendException(EventSource.CLOUD, BackendErrorKind.UNAUTHORIZED, "x")));
    assertFalse(BackendRetry.isRetryable(new InvalidRequestException("x")));
    assertFalse(BackendRetry.isRetryable(new IllegalStateException("x")));
  }
}
