package com.ospicorp.abundanceindex.season.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-site daily (or weekly) count series for one species, as produced by the season builder
 * upstream. Row order is kept as given.
 */
public record SeasonTable(List<SeasonCount> rows) {

  public SeasonTable {
    rows = List.copyOf(rows);
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public Set<String> species() {
    Set<String> out = new LinkedHashSet<>();
    for (SeasonCount row : rows) {
      out.add(row.species());
    }
    return out;
  }

  /** Distinct monitoring years in order of first appearance. */
  public List<Integer> years() {
    Set<Integer> out = new LinkedHashSet<>();
    for (SeasonCount row : rows) {
      out.add(row.year());
    }
    return new ArrayList<>(out);
  }

  public List<SeasonCount> forYear(int year) {
    List<SeasonCount> out = new ArrayList<>();
    for (SeasonCount row : rows) {
      if (row.year() == year) {
        out.add(row);
      }
    }
    return out;
  }

  public SeasonTable completeSeasonsOnly() {
    return new SeasonTable(rows.stream().filter(SeasonCount::hasCompleteSeason).toList());
  }
}
