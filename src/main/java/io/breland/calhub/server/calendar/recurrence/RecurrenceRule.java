package io.breland.calhub.server.calendar.recurrence;

import io.breland.calhub.server.calendar.exceptions.InvalidRequestException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One {@code RRULE:} line as an ordered map of parts. Parts keep their original order on
 * {@link #serialize()}; parts added later go at the end.
 */
public final class RecurrenceRule {
  static final String PREFIX = "RRULE:";
  public static final String UNTIL = "UNTIL";
  public static final String COUNT = "COUNT";

  private final LinkedHashMap<String, String> parts;

  private RecurrenceRule(LinkedHashMap<String, String> parts) {
    this.parts = parts;
  }

  public static boolean isRule(String line) {
    return line != null && line.regionMatches(true, 0, PREFIX, 0, PREFIX.length());
  }

  public static RecurrenceRule parse(String line) {
    String body = isRule(line) ? line.substring(PREFIX.length()) : line;
    if (body == null || body.isBlank()) {
      throw new InvalidRequestException("Empty recurrence rule");
    }
    LinkedHashMap<String, String> parts = new LinkedHashMap<>();
    for (String part : body.trim().split(";")) {
      int eq = part.indexOf('=');
      if (eq <= 0 || eq == part.length() - 1) {
        throw new InvalidRequestException(
            "Invalid rule part \"" + part + "\" in " + line + ", expected KEY=VALUE");
      }
      String key = part.substring(0, eq).trim().toUpperCase(Locale.ROOT);
      parts.put(key, part.substring(eq + 1).trim());
    }
    return new RecurrenceRule(parts);
  }

  public Optional<String> get(String key) {
    return Optional.ofNullable(parts.get(key));
  }

  public boolean has(String key) {
    return parts.containsKey(key);
  }

  public Map<String, String> parts() {
    return Map.copyOf(parts);
  }

  public RecurrenceRule with(String key, String value) {
    LinkedHashMap<String, String> copy = new LinkedHashMap<>(parts);
    copy.put(key, value);
    return new RecurrenceRule(copy);
  }

  public RecurrenceRule without(String key) {
    LinkedHashMap<String, String> copy = new LinkedHashMap<>(parts);
    copy.remove(key);
    return new RecurrenceRule(copy);
  }

  public String serialize() {
    return PREFIX
        + parts.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(";"));
  }

  @Override
  public String toString() {
    return serialize();
  }

  /** Ends every RRULE at {@code until}, dropping COUNT. Other lines pass through untouched. */
  public static List<String> truncate(List<String> recurrence, String until) {
    List<String> result = new ArrayList<>(recurrence.size());
    for (String line : recurrence) {
      if (isRule(line)) {
        result.add(parse(line).without(COUNT).with(UNTIL, until).serialize());
      } else {
        result.add(line);
      }
    }
    return result;
  }

  /** Removes UNTIL and COUNT from every RRULE so the series runs open-ended. */
  public static List<String> withoutTermination(List<String> recurrence) {
    List<String> result = new ArrayList<>(recurrence.size());
    for (String line : recurrence) {
      if (isRule(line)) {
        result.add(parse(line).without(COUNT).without(UNTIL).serialize());
      } else {
        result.add(line);
      }
    }
    return result;
  }
}
