package com.ospicorp.abundanceindex.support;

import com.ospicorp.abundanceindex.flightcurve.model.FlightCurvePoint;
import com.ospicorp.abundanceindex.season.model.SeasonCount;
import com.ospicorp.abundanceindex.season.model.SeasonTable;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Synthetic monitoring data: daily rows from March to October, season from April to September,
 * one weekly visit per site with a bell-shaped count peaking at the end of June.
 */
public final class SeasonTableFixtures {
  public static final String SPECIES = "Pieris napi";
  public static final LocalDate SERIES_START = LocalDate.of(2009, 1, 1);

  private static final int PEAK_DAY_OF_YEAR = 180;
  private static final double PEAK_SPREAD = 20d;
  private static final double PEAK_COUNT = 20d;

  private SeasonTableFixtures() {
  }

  /** Sites mapped to the multiplier of their counts; 0 gives a site that never sees the species. */
  public static SeasonTable table(Map<String, Double> siteScales, int firstYear, int lastYear) {
    List<SeasonCount> rows = new ArrayList<>();
    for (int year = firstYear; year <= lastYear; year++) {
      for (var site : siteScales.entrySet()) {
        rows.addAll(siteYear(site.getKey(), year, site.getValue()));
      }
    }
    return new SeasonTable(rows);
  }

  public static Map<String, Double> sites(Object... siteAndScale) {
    Map<String, Double> out = new LinkedHashMap<>();
    for (int i = 0; i < siteAndScale.length; i += 2) {
      out.put((String) siteAndScale[i], ((Number) siteAndScale[i + 1]).doubleValue());
    }
    return out;
  }

  public static List<SeasonCount> siteYear(String site, int year, double scale) {
    List<SeasonCount> rows = new ArrayList<>();
    LocalDate start = LocalDate.of(year, 3, 1);
    LocalDate end = LocalDate.of(year, 10, 31);
    LocalDate seasonStart = LocalDate.of(year, 4, 1);
    LocalDate seasonEnd = LocalDate.of(year, 9, 30);
    for (LocalDate date = start; !date.isAfter(end); date = date.plusDays(1)) {
      boolean inSeason = !date.isBefore(seasonStart) && !date.isAfter(seasonEnd);
      boolean visited = inSeason && ChronoUnit.DAYS.between(seasonStart, date) % 7 == 0;
      Double count = visited ? (double) Math.round(expected(date, scale)) : null;
      rows.add(count(site, date, inSeason ? 1 : 0, count));
    }
    return rows;
  }

  public static double expected(LocalDate date, double scale) {
    double d = date.getDayOfYear() - PEAK_DAY_OF_YEAR;
    return scale * PEAK_COUNT * Math.exp(-d * d / (2d * PEAK_SPREAD * PEAK_SPREAD));
  }

  public static SeasonCount count(String site, LocalDate date, int season, Double count) {
    return new SeasonCount(SPECIES, site, date, date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR),
        date.getDayOfWeek().getValue(), daySince(date), date.getYear(), season, count, 0, 1);
  }

  public static int daySince(LocalDate date) {
    return (int) ChronoUnit.DAYS.between(SERIES_START, date) + 1;
  }

  public static FlightCurvePoint point(LocalDate date, int trimDayNo, Double nm) {
    return new FlightCurvePoint(SPECIES, date, date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR),
        date.getDayOfWeek().getValue(), daySince(date), date.getYear(), 1, trimDayNo, nm);
  }

  /** The table as loosely typed rows, the way a JSON body arrives. */
  public static List<Map<String, Object>> asRows(SeasonTable table) {
    List<Map<String, Object>> out = new ArrayList<>(table.rows().size());
    for (SeasonCount s : table.rows()) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("SPECIES", s.species());
      row.put("SITE_ID", s.siteId());
      row.put("DATE", s.date().toString());
      row.put("WEEK", s.week());
      row.put("WEEK_DAY", s.weekDay());
      row.put("DAY_SINCE", s.daySince());
      row.put("M_YEAR", s.year());
      row.put("M_SEASON", s.season());
      row.put("COUNT", s.count());
      row.put("ANCHOR", s.anchor());
      row.put("COMPLT_SEASON", s.completeSeason());
      out.add(row);
    }
    return out;
  }
}
