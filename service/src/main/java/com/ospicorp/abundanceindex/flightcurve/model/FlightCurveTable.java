package com.ospicorp.abundanceindex.flightcurve.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/** Flight curves of one species for every estimated year. */
public record FlightCurveTable(List<FlightCurvePoint> points) {

  public FlightCurveTable {
    points = List.copyOf(points);
  }

  public Set<String> species() {
    Set<String> out = new LinkedHashSet<>();
    for (FlightCurvePoint p : points) {
      out.add(p.species());
    }
    return out;
  }

  public TreeSet<Integer> years() {
    TreeSet<Integer> out = new TreeSet<>();
    for (FlightCurvePoint p : points) {
      out.add(p.year());
    }
    return out;
  }

  public List<FlightCurvePoint> forYear(int year) {
    return points.stream().filter(p -> p.year() == year).toList();
  }

  /** True when the year has curve rows and none of them lacks NM. */
  public boolean isComplete(int year) {
    List<FlightCurvePoint> curve = forYear(year);
    return !curve.isEmpty() && curve.stream().allMatch(p -> p.nm() != null);
  }
}
