package io.breland.calhub.server.calendar.source.os;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.breland.calhub.server.calendar.EventTimes;
import io.breland.calhub.server.calendar.exceptions.BackendErrorKind;
import io.breland.calhub.server.calendar.exceptions.BackendException;
import io.breland.calhub.server.calendar.model.CalendarEvent;
import io.breland.calhub.server.calendar.model.EventSource;
import io.breland.calhub.server.calendar.model.EventType;
import io.breland.calhub.server.calendar.model.TimeWindow;
import io.breland.calhub.server.config.CalendarProperties;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads the macOS Calendar database by running a JavaScript for Automation script through
 * {@code osascript}. The script prints a JSON array of events.
 */
@Slf4j
@Component
public class AppleScriptCalendarStore implements LocalCalendarStore {
  private static final String SCRIPT_RESOURCE = "/osascript/list-events.js";
  private static final List<String> PERMISSION_MARKERS =
      List.of("-1743", "not authorized", "not allowed");

  private final ObjectMapper objectMapper;
  private final CalendarProperties properties;
  private final String script;

  public AppleScriptCalendarStore(ObjectMapper objectMapper, CalendarProperties properties) {
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.script = loadScript();
  }

  @Override
  public List<CalendarEvent> fetchEvents(TimeWindow window, String calendarName) {
    List<String> args = new ArrayList<>();
    args.add("list");
    args.add(window.start().toString());
    args.add(window.end().toString());
    if (calendarName != null && !calendarName.isBlank()) {
      args.add(calendarName);
    }
    return parseEvents(runScript(args));
  }

  @Override
  public boolean isAccessible() {
    String output = runScript(List.of("probe"));
    return output.contains("\"ok\":true");
  }

  List<CalendarEvent> parseEvents(String json) {
    List<ScriptEvent> rows;
    try {
      rows = objectMapper.readValue(json, new TypeReference<List<ScriptEvent>>() {});
    } catch (JsonProcessingException e) {
      throw new BackendException(
          EventSource.OS,
          BackendErrorKind.SERVER_ERROR,
          "Calendar script returned malformed output: " + e.getOriginalMessage(),
          e);
    }
    ZoneId zone = properties.zoneId();
    List<CalendarEvent> events = new ArrayList<>(rows.size());
    for (ScriptEvent row : rows) {
      events.add(toCalendarEvent(row, zone));
    }
    return events;
  }

  private CalendarEvent toCalendarEvent(ScriptEvent row, ZoneId zone) {
    String start = row.start();
    String end = row.end();
    if (row.allDay()) {
      start = asLocalDate(start, zone);
      end = asLocalDate(end, zone);
    }
    return CalendarEvent.builder()
        .id(row.uid())
        .iCalUID(row.uid())
        .title(row.title())
        .start(start)
        .end(end)
        .allDay(row.allDay())
        .source(EventSource.OS)
        .eventType(EventType.DEFAULT)
        .calendar(row.calendar())
        .location(row.location())
        .description(row.notes())
        .status(row.status())
        .attendees(List.of())
        .build();
  }

  private static String asLocalDate(String value, ZoneId zone) {
    Instant instant = EventTimes.toInstant(value, zone);
    return instant != null ? instant.atZone(zone).toLocalDate().toString() : value;
  }

  private String runScript(List<String> args) {
    List<String> command = new ArrayList<>();
    command.add(properties.getOs().getCommand());
    command.add("-l");
    command.add("JavaScript");
    command.add("-");
    command.addAll(args);
    Process process;
    try {
      process = new ProcessBuilder(command).start();
    } catch (IOException e) {
      throw new BackendException(
          EventSource.OS,
          BackendErrorKind.FORBIDDEN,
          "Failed to start " + properties.getOs().getCommand() + ": " + e.getMessage(),
          e);
    }
    CompletableFuture<String> stdout = readAsync(process.getInputStream());
    CompletableFuture<String> stderr = readAsync(process.getErrorStream());
    try (OutputStream stdin = process.getOutputStream()) {
      stdin.write(script.getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      process.destroyForcibly();
      throw new BackendException(
          EventSource.OS, BackendErrorKind.NETWORK, "Failed to send calendar script", e);
    }
    try {
      long timeoutMillis = properties.getOs().getScriptTimeout().toMillis();
      if (!process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new BackendException(
            EventSource.OS,
            BackendErrorKind.NETWORK,
            "Calendar script timed out after " + properties.getOs().getScriptTimeout());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new BackendException(
          EventSource.OS, BackendErrorKind.NETWORK, "Interrupted waiting for calendar script", e);
    }
    if (process.exitValue() != 0) {
      String error = stderr.join().trim();
      throw new BackendException(
          EventSource.OS,
          classifyFailure(error),
          "Calendar script exited with " + process.exitValue() + ": " + error);
    }
    return stdout.join().trim();
  }

  static BackendErrorKind classifyFailure(String stderr) {
    String lower = stderr.toLowerCase(Locale.ROOT);
    for (String marker : PERMISSION_MARKERS) {
      if (lower.contains(marker)) {
        return BackendErrorKind.FORBIDDEN;
      }
    }
    return BackendErrorKind.SERVER_ERROR;
  }

  private static CompletableFuture<String> readAsync(InputStream stream) {
    return CompletableFuture.supplyAsync(
        () -> {
          try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
        });
  }

  private static String loadScript() {
    try (InputStream input = AppleScriptCalendarStore.class.getResourceAsStream(SCRIPT_RESOURCE)) {
      if (input == null) {
        throw new IllegalStateException("Missing calendar script " + SCRIPT_RESOURCE);
      }
      return new String(input.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load calendar script " + SCRIPT_RESOURCE, e);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ScriptEvent(
      String uid,
      String title,
      String start,
      String end,
      boolean allDay,
      String calendar,
      String location,
      String notes,
      String status) {}
}
