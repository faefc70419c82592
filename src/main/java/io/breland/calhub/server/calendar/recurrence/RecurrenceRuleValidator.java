package io.breland.calhub.server.calendar.recurrence;

import io.breland.calhub.server.calendar.exceptions.InvalidRequestException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/** Checks recurrence lines before they are sent to a backend. */
public final class RecurrenceRuleValidator {
  private static final Set<String> FREQUENCIES = Set.of("DAILY", "WEEKLY", "MONTHLY", "YEARLY");
  private static final Set<String> DAY_CODES = Set.of("MO", "TU", "WE", "TH", "FR", "SA", "SU");
  private static final Set<String> NON_RULE_PREFIXES = Set.of("EXDATE", "RDATE", "EXRULE");
  private static final Pattern BASIC_DATE = Pattern.compile("\\d{8}");
  private static final Pattern BASIC_DATE_TIME = Pattern.compile("\\d{8}T\\d{6}Z?");
  private static final DateTimeFormatter BASIC_DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;
  private static final DateTimeFormatter BASIC_DATE_TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

  private RecurrenceRuleValidator() {}

  public static void requireValid(List<String> recurrence) {
    List<String> errors = validate(recurrence);
    if (!errors.isEmpty()) {
      throw new InvalidRequestException("Invalid recurrence: " + String.join("; ", errors));
    }
  }

  /** Every problem found, empty when the lines are valid. */
  public static List<String> validate(List<String> recurrence) {
    List<String> errors = new ArrayList<>();
    if (recurrence == null) {
      return errors;
    }
    for (String line : recurrence) {
      if (line == null || line.isBlank()) {
        errors.add("Rule cannot be empty");
      } else if (!isNonRuleLine(line)) {
        errors.addAll(validateRule(line));
      }
    }
    return errors;
  }

  private static boolean isNonRuleLine(String line) {
    String upper = line.toUpperCase(Locale.ROOT);
    for (String prefix : NON_RULE_PREFIXES) {
      if (upper.startsWith(prefix + ":") || upper.startsWith(prefix + ";")) {
        return true;
      }
    }
    return false;
  }

  private static List<String> validateRule(String line) {
    List<String> errors = new ArrayList<>();
    String body =
        RecurrenceRule.isRule(line) ? line.substring(RecurrenceRule.PREFIX.length()) : line;
    if (body.isBlank()) {
      errors.add("Rule cannot be empty: " + line);
      return errors;
    }
    Map<String, String> parts = new LinkedHashMap<>();
    for (String part : body.trim().split(";")) {
      int eq = part.indexOf('=');
      if (eq < 0) {
        errors.add("Invalid rule part format: \"" + part + "\". Expected KEY=VALUE");
        continue;
      }
      String key = part.substring(0, eq).trim().toUpperCase(Locale.ROOT);
      String value = part.substring(eq + 1).trim();
      if (key.isEmpty() || value.isEmpty()) {
        errors.add("Invalid rule part: \"" + part + "\". Both key and value are required");
        continue;
      }
      parts.put(key, value);
    }

    String freq = parts.get("FREQ");
    if (freq == null) {
      errors.add("FREQ is required in RRULE");
    } else if (!FREQUENCIES.contains(freq.toUpperCase(Locale.ROOT))) {
      errors.add(
          "Invalid FREQ value: \"" + freq + "\". Must be one of DAILY, WEEKLY, MONTHLY, YEARLY");
    }
    checkPositive(parts, "INTERVAL", errors);
    checkPositive(parts, "COUNT", errors);
    String until = parts.get("UNTIL");
    if (until != null && !isValidUntil(until)) {
      errors.add("UNTIL must be a valid date (YYYYMMDD or ISO 8601), got: \"" + until + "\"");
    }
    if (parts.containsKey("COUNT") && parts.containsKey("UNTIL")) {
      errors.add("COUNT and UNTIL are mutually exclusive. Use only one of them.");
    }
    String byDay = parts.get("BYDAY");
    if (byDay != null) {
      for (String day : byDay.split(",")) {
        if (!isValidByDay(day.trim().toUpperCase(Locale.ROOT))) {
          errors.add("Invalid BYDAY value: \"" + day.trim() + "\"");
        }
      }
    }
    String byMonthDay = parts.get("BYMONTHDAY");
    if (byMonthDay != null) {
      for (String day : byMonthDay.split(",")) {
        Integer value = parseInt(day.trim());
        if (value == null) {
          errors.add("BYMONTHDAY must contain numbers, got: \"" + day.trim() + "\"");
        } else if (value == 0 || value < -31 || value > 31) {
          errors.add("BYMONTHDAY values must be between 1-31 or -31 to -1, got: " + value);
        }
      }
    }
    return errors;
  }

  private static void checkPositive(Map<String, String> parts, String key, List<String> errors) {
    String raw = parts.get(key);
    if (raw == null) {
      return;
    }
    Integer value = parseInt(raw);
    if (value == null) {
      errors.add(key + " must be a number, got: \"" + raw + "\"");
    } else if (value < 1) {
      errors.add(key + " must be a positive integer, got: " + value);
    }
  }

  static boolean isValidByDay(String day) {
    if (day.length() < 2 || !DAY_CODES.contains(day.substring(day.length() - 2))) {
      return false;
    }
    if (day.length() == 2) {
      return true;
    }
    Integer ordinal = parseInt(day.substring(0, day.length() - 2));
    return ordinal != null && ordinal != 0 && ordinal >= -53 && ordinal <= 53;
  }

  static boolean isValidUntil(String until) {
    try {
      if (BASIC_DATE.matcher(until).matches()) {
        LocalDate.parse(until, BASIC_DATE_FORMAT);
        return true;
      }
      if (BASIC_DATE_TIME.matcher(until).matches()) {
        String local = until.endsWith("Z") ? until.substring(0, until.length() - 1) : until;
        LocalDateTime.parse(local, BASIC_DATE_TIME_FORMAT);
        return true;
      }
      if (until.length() == 10) {
        LocalDate.parse(until);
        return true;
      }
      if (until.endsWith("Z") || until.matches(".*[+-]\\d{2}:\\d{2}$")) {
        OffsetDateTime.parse(until);
      } else {
        LocalDateTime.parse(until);
      }
      return true;
    } catch (DateTimeParseException e) {
      return false;
    }
  }

  private static Integer parseInt(String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
