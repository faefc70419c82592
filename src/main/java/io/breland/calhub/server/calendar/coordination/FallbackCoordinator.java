package io.breland.calhub.server.calendar.coordination;

import io.breland.calhub.server.calendar.exceptions.AggregateSourceException;
import io.breland.calhub.server.calendar.exceptions.BackendException;
import io.breland.calhub.server.calendar.exceptions.CalendarConfigurationException;
import io.breland.calhub.server.calendar.exceptions.SourceFailure;
import io.breland.calhub.server.calendar.exceptions.UnsupportedSourceOperationException;
import io.breland.calhub.server.calendar.model.CalendarEvent;
import io.breland.calhub.server.calendar.model.EventSource;
import io.breland.calhub.server.calendar.source.SourceCapability;
import io.breland.calhub.server.config.CalendarProperties;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs an operation against the enabled sources. Reads fan out concurrently and fail only when
 * every source fails; writes go to one source at a time until one succeeds.
 */
@Slf4j
@Component
public class FallbackCoordinator {
  private final List<SourceCapability> sources;
  private final CalendarProperties properties;
  private final ExecutorService executor;

  public FallbackCoordinator(
      List<SourceCapability> sources,
      CalendarProperties properties,
      @Qualifier("calendarSourceExecutor") ExecutorService executor) {
    this.sources =
        sources.stream().sorted(Comparator.comparing(SourceCapability::source)).toList();
    this.properties = properties;
    this.executor = executor;
  }

  public record FanOut<T>(
      List<T> items, List<EventSource> respondedSources, List<SourceFailure> failures) {}

  public record Routed<T>(T value, SourceCapability source) {

    public EventSource sourceId() {
      return source.source();
    }
  }

  /** Every registered source in registration order, enabled or not. */
  public List<SourceCapability> registeredSources() {
    return sources;
  }

  public List<SourceCapability> enabledSources() {
    return sources.stream().filter(source -> properties.isEnabled(source.source())).toList();
  }

  public Optional<SourceCapability> registered(EventSource id) {
    return sources.stream().filter(source -> source.source() == id).findFirst();
  }

  public SourceCapability requireEnabled(EventSource id) {
    if (!properties.isEnabled(id)) {
      throw new CalendarConfigurationException("Calendar source " + id + " is not enabled");
    }
    return registered(id)
        .orElseThrow(
            () ->
                new CalendarConfigurationException("Calendar source " + id + " is not available"));
  }

  /**
   * Calls every enabled source concurrently and concatenates the results in registration
   * order. Sources that do not support the operation are skipped.
   */
  public <T> FanOut<T> readAll(String operation, Function<SourceCapability, List<T>> call) {
    List<SourceCapability> enabled = requireAnyEnabled();
    List<CompletableFuture<List<T>>> futures = new ArrayList<>(enabled.size());
    for (SourceCapability source : enabled) {
      futures.add(CompletableFuture.supplyAsync(() -> call.apply(source), executor));
    }

    List<T> items = new ArrayList<>();
    List<EventSource> responded = new ArrayList<>();
    List<SourceFailure> failures = new ArrayList<>();
    for (int i = 0; i < enabled.size(); i++) {
      SourceCapability source = enabled.get(i);
      try {
        items.addAll(futures.get(i).join());
        responded.add(source.source());
      } catch (CompletionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof UnsupportedSourceOperationException) {
          log.debug("Source {} does not support {}", source.source(), operation);
          continue;
        }
        log.warn("Source {} failed to {}: {}", source.source(), operation, cause.getMessage());
        failures.add(SourceFailure.of(source.source(), cause));
      }
    }
    if (responded.isEmpty()) {
      if (failures.isEmpty()) {
        throw new CalendarConfigurationException(
            "No enabled calendar source supports " + operation);
      }
      log.error("All calendar sources failed to {}: {}", operation, failures);
      throw new AggregateSourceException(operation, failures);
    }
    return new FanOut<>(items, responded, failures);
  }

  /**
   * Tries {@code preferred} first when it is enabled, then the other enabled sources in
   * registration order, returning the first success.
   */
  public <T> Routed<T> firstSuccess(
      String operation, EventSource preferred, Function<SourceCapability, T> call) {
    List<SourceFailure> failures = new ArrayList<>();
    for (SourceCapability source : preferenceOrder(preferred)) {
      try {
        T value = call.apply(source);
        return new Routed<>(value, source);
      } catch (RuntimeException e) {
        log.warn("Source {} failed to {}: {}", source.source(), operation, e.getMessage());
        failures.add(SourceFailure.of(source.source(), e));
      }
    }
    log.error("All calendar sources failed to {}: {}", operation, failures);
    throw new AggregateSourceException(operation, failures);
  }

  /**
   * Deletes from every enabled source that supports deletion. A source that no longer has the
   * event counts as a success.
   */
  public List<EventSource> deleteEverywhere(String eventId) {
    String operation = "delete event " + eventId;
    List<EventSource> deleted = new ArrayList<>();
    List<SourceFailure> failures = new ArrayList<>();
    for (SourceCapability source : requireAnyEnabled()) {
      try {
        source.deleteEvent(eventId);
        deleted.add(source.source());
      } catch (UnsupportedSourceOperationException e) {
        log.debug("Source {} does not support delete", source.source());
      } catch (BackendException e) {
        if (e.isNotFound()) {
          log.info("Event {} already absent from {}", eventId, source.source());
          deleted.add(source.source());
        } else {
          log.warn("Source {} failed to {}: {}", source.source(), operation, e.getMessage());
          failures.add(SourceFailure.of(source.source(), e));
        }
      } catch (RuntimeException e) {
        log.warn("Source {} failed to {}: {}", source.source(), operation, e.getMessage());
        failures.add(SourceFailure.of(source.source(), e));
      }
    }
    if (deleted.isEmpty()) {
      log.error("No calendar source could {}: {}", operation, failures);
      throw new AggregateSourceException(operation, failures);
    }
    return deleted;
  }

  /** Deletes from one named source. A missing event counts as a success. */
  public void deleteFrom(EventSource id, String eventId) {
    SourceCapability source = requireEnabled(id);
    try {
      source.deleteEvent(eventId);
    } catch (BackendException e) {
      if (!e.isNotFound()) {
        throw e;
      }
      log.info("Event {} already absent from {}", eventId, id);
    }
  }

  /** The event as held by the first enabled source that can return it. */
  public Routed<CalendarEvent> locate(String eventId) {
    List<SourceFailure> failures = new ArrayList<>();
    for (SourceCapability source : requireAnyEnabled()) {
      try {
        return new Routed<>(source.getEvent(eventId), source);
      } catch (UnsupportedSourceOperationException e) {
        log.debug("Source {} cannot look up events", source.source());
      } catch (RuntimeException e) {
        log.debug(
            "Source {} did not return event {}: {}", source.source(), eventId, e.getMessage());
        failures.add(SourceFailure.of(source.source(), e));
      }
    }
    throw new AggregateSourceException("find event " + eventId, failures);
  }

  private List<SourceCapability> preferenceOrder(EventSource preferred) {
    List<SourceCapability> enabled = requireAnyEnabled();
    List<SourceCapability> ordered = new ArrayList<>(enabled.size());
    for (SourceCapability source : enabled) {
      if (source.source() == preferred) {
        ordered.add(source);
      }
    }
    for (SourceCapability source : enabled) {
      if (source.source() != preferred) {
        ordered.add(source);
      }
    }
    return ordered;
  }

  private List<SourceCapability> requireAnyEnabled() {
    List<SourceCapability> enabled = enabledSources();
    if (enabled.isEmpty()) {
      throw new CalendarConfigurationException("No calendar sources are enabled");
    }
    return enabled;
  }
}
