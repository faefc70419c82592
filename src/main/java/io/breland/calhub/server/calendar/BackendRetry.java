package io.breland.calhub.server.calendar;

import io.breland.calhub.server.calendar.exceptions.BackendException;
import io.breland.calhub.server.calendar.model.EventSource;
import io.breland.calhub.server.config.CalendarProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Wraps outbound backend calls in an exponential-backoff retry. Only {@link BackendException}s
 * of a transient kind are retried; everything else is rethrown on the first attempt.
 */
@Slf4j
@Component
public class BackendRetry {
  private final RetryRegistry registry;

  public BackendRetry(RetryRegistry registry) {
    this.registry = registry;
    registry
        .getEventPublisher()
        .onEntryAdded(
            added ->
                added
                    .getAddedEntry()
                    .getEventPublisher()
                    .onRetry(
                        event ->
                            log.warn(
                                "Retrying {} (attempt {}) after {}",
                                event.getName(),
                                event.getNumberOfRetryAttempts(),
                                event.getLastThrowable() != null
                                    ? event.getLastThrowable().getMessage()
                                    : "unknown error")));
  }

  public static RetryRegistry registryFor(CalendarProperties.Retry settings) {
    RetryConfig config =
        RetryConfig.custom()
            .maxAttempts(Math.max(1, settings.getMaxAttempts()))
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(
                    settings.getInitialDelay().toMillis(),
                    settings.getMultiplier(),
                    settings.getMaxDelay().toMillis()))
            .retryOnException(BackendRetry::isRetryable)
            .build();
    return RetryRegistry.of(config);
  }

  static boolean isRetryable(Throwable throwable) {
    return throwable instanceof BackendException backendException
        && backendException.isTransient();
  }

  public <T> T call(EventSource source, String operation, Supplier<T> call) {
    Retry retry = registry.retry(source.apiValue() + "." + operation);
    return retry.executeSupplier(call);
  }

  public void run(EventSource source, String operation, Runnable call) {
    call(
        source,
        operation,
        () -> {
          call.run();
          return null;
        });
  }
}
