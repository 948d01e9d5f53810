package com.ospicorp.abundanceindex.season.service;

import static com.ospicorp.abundanceindex.season.model.SeasonColumns.*;

import com.ospicorp.abundanceindex.common.InputContractException;
import com.ospicorp.abundanceindex.season.model.SeasonColumns;
import com.ospicorp.abundanceindex.season.model.SeasonCount;
import com.ospicorp.abundanceindex.season.model.SeasonTable;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns loosely typed rows (JSON objects, CSV records) into a {@link SeasonTable}. Column names
 * are matched case-insensitively; every column in {@link SeasonColumns#REQUIRED} must be present.
 */
public final class SeasonTableParser {
  private SeasonTableParser() {
  }

  public static SeasonTable parse(List<? extends Map<String, ?>> rawRows) {
    if (rawRows == null || rawRows.isEmpty()) {
      return new SeasonTable(List.of());
    }
    List<Map<String, Object>> rows = new ArrayList<>(rawRows.size());
    Set<String> columns = new LinkedHashSet<>();
    for (Map<String, ?> raw : rawRows) {
      Map<String, Object> normalized = new HashMap<>();
      for (var e : raw.entrySet()) {
        if (e.getKey() != null) {
          normalized.put(e.getKey().trim().toUpperCase(Locale.ROOT), e.getValue());
        }
      }
      columns.addAll(normalized.keySet());
      rows.add(normalized);
    }
    checkColumns(columns);

    List<SeasonCount> out = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      out.add(toSeasonCount(rows.get(i), i + 1));
    }
    return new SeasonTable(out);
  }

  public static void checkColumns(Set<String> columns) {
    List<String> missing = SeasonColumns.REQUIRED.stream()
        .filter(c -> !columns.contains(c))
        .toList();
    if (!missing.isEmpty()) {
      throw InputContractException.of(
          "Season table is missing required columns: " + String.join(", ", missing),
          InputContractException.MISSING_COLUMNS);
    }
  }

  private static SeasonCount toSeasonCount(Map<String, Object> row, int line) {
    return new SeasonCount(
        requiredText(row, SPECIES, line),
        requiredText(row, SITE_ID, line),
        date(row, line),
        requiredInt(row, WEEK, line),
        requiredInt(row, WEEK_DAY, line),
        requiredInt(row, DAY_SINCE, line),
        requiredInt(row, M_YEAR, line),
        requiredInt(row, M_SEASON, line),
        count(row, line),
        requiredInt(row, ANCHOR, line),
        requiredInt(row, COMPLT_SEASON, line));
  }

  private static String requiredText(Map<String, Object> row, String column, int line) {
    Object value = row.get(column);
    if (isMissing(value)) {
      throw invalid(column, line, "value is required");
    }
    return value.toString().trim();
  }

  private static LocalDate date(Map<String, Object> row, int line) {
    Object value = row.get(DATE);
    if (value instanceof LocalDate date) {
      return date;
    }
    String text = requiredText(row, DATE, line);
    try {
      return LocalDate.parse(text);
    } catch (DateTimeParseException ex) {
      throw invalid(DATE, line, "expected an ISO date but got '" + text + "'");
    }
  }

  private static int requiredInt(Map<String, Object> row, String column, int line) {
    Double value = optionalDouble(row, column, line);
    if (value == null) {
      throw invalid(column, line, "value is required");
    }
    if (value.isInfinite() || value != Math.rint(value)) {
      throw invalid(column, line, "expected an integer but got " + value);
    }
    return value.intValue();
  }

  private static Double count(Map<String, Object> row, int line) {
    Double value = optionalDouble(row, COUNT, line);
    if (value != null && (!Double.isFinite(value) || value < 0d)) {
      throw invalid(COUNT, line, "expected a non-negative finite count but got " + value);
    }
    return value;
  }

  private static Double optionalDouble(Map<String, Object> row, String column, int line) {
    Object value = row.get(column);
    if (isMissing(value)) {
      return null;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof Boolean flag) {
      return flag ? 1d : 0d;
    }
    String text = value.toString().trim();
    if ("TRUE".equalsIgnoreCase(text)) {
      return 1d;
    }
    if ("FALSE".equalsIgnoreCase(text)) {
      return 0d;
    }
    try {
      return Double.valueOf(text);
    } catch (NumberFormatException ex) {
      throw invalid(column, line, "expected a number but got '" + text + "'");
    }
  }

  private static boolean isMissing(Object value) {
    if (value == null) {
      return true;
    }
    String text = value.toString().trim();
    return text.isEmpty() || "NA".equalsIgnoreCase(text);
  }

  private static InputContractException invalid(String column, int line, String detail) {
    return InputContractException.of(
        "Invalid value for column " + column + " in row " + line + ": " + detail,
        InputContractException.INVALID_VALUE);
  }
}
