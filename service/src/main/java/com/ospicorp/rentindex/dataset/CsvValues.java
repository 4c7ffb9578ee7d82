package com.ospicorp.rentindex.dataset;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class CsvValues {
  private static final Set<String> MISSING_TOKENS = Set.of("null", "nan", "na", "<na>");
  private static final List<DateTimeFormatter> DAY_FORMATS = List.of(
      DateTimeFormatter.ISO_LOCAL_DATE,
      DateTimeFormatter.ofPattern("M/d/yyyy", Locale.ROOT));
  private static final DateTimeFormatter MONTH_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM", Locale.ROOT);

  private CsvValues() {
  }

  public static boolean isMissing(String cell) {
    if (cell == null) {
      return true;
    }
    String trimmed = cell.trim();
    return trimmed.isEmpty() || MISSING_TOKENS.contains(trimmed.toLowerCase(Locale.ROOT));
  }

  public static Double parseDouble(String cell) {
    if (isMissing(cell)) {
      return null;
    }
    try {
      double value = Double.parseDouble(cell.trim());
      return Double.isFinite(value) ? value : null;
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  public static LocalDate parseMonth(String cell) {
    if (isMissing(cell)) {
      return null;
    }
    String trimmed = cell.trim();
    // date-time values such as 2020-01-31T00:00:00 or "2020-01-31 00:00:00"
    if (trimmed.length() > 10 && (trimmed.charAt(10) == 'T' || trimmed.charAt(10) == ' ')) {
      trimmed = trimmed.substring(0, 10);
    }
    for (DateTimeFormatter format : DAY_FORMATS) {
      LocalDate day = parseDay(trimmed, format);
      if (day != null) {
        return day.withDayOfMonth(1);
      }
    }
    try {
      return YearMonth.parse(trimmed, MONTH_FORMAT).atDay(1);
    } catch (DateTimeException ex) {
      return null;
    }
  }

  private static LocalDate parseDay(String text, DateTimeFormatter format) {
    try {
      return LocalDate.parse(text, format);
    } catch (DateTimeParseException ex) {
      return null;
    }
  }
}
