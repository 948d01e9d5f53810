package com.ospicorp.abundanceindex.imputation.service;

import com.ospicorp.abundanceindex.common.Diagnostic;
import com.ospicorp.abundanceindex.common.DiagnosticKind;
import com.ospicorp.abundanceindex.flightcurve.model.FlightCurvePoint;
import com.ospicorp.abundanceindex.flightcurve.model.FlightCurveTable;
import com.ospicorp.abundanceindex.imputation.model.ImputationRow;
import com.ospicorp.abundanceindex.imputation.model.PhenologyOutcome;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Borrows the flight curve of the nearest year when a year's own curve is incomplete. Candidates
 * are tried at offsets -1, +1, -2, +2 ... up to {@value #HORIZON} years and must lie strictly
 * between the first and last year of the curve table.
 */
@Component
public class PhenologyResolver {
  private static final Logger log = LoggerFactory.getLogger(PhenologyResolver.class);

  public static final int HORIZON = 5;

  public PhenologyOutcome resolve(String species, int year, List<ImputationRow> rows,
      FlightCurveTable curves) {
    if (!rows.isEmpty() && rows.stream().allMatch(r -> r.nm() != null)) {
      return new PhenologyOutcome(rows, null, true, null);
    }

    TreeSet<Integer> available = curves.years();
    List<Integer> candidates = available.isEmpty()
        ? List.of()
        : candidateYears(year, available.first(), available.last());
    for (int candidate : candidates) {
      if (!curves.isComplete(candidate)) {
        continue;
      }
      String message = "Used the flight curve of " + candidate
          + " to compute abundance indices for year " + year;
      log.warn(message);
      return new PhenologyOutcome(substitute(rows, curves.forYear(candidate)), candidate, true,
          new Diagnostic(DiagnosticKind.PHENOLOGY_SUBSTITUTED, species, year, message));
    }

    String message = "No reliable flight curve available within a " + HORIZON
        + " year horizon of " + year;
    log.warn(message);
    return new PhenologyOutcome(rows, null, false,
        new Diagnostic(DiagnosticKind.UNRESOLVED_PHENOLOGY, species, year, message));
  }

  /** Years to try, nearest first and earlier before later at the same distance. */
  public static List<Integer> candidateYears(int year, int firstYear, int lastYear) {
    List<Integer> out = new ArrayList<>(2 * HORIZON);
    for (int offset = 1; offset <= HORIZON; offset++) {
      for (int candidate : new int[] {year - offset, year + offset}) {
        if (candidate > firstYear && candidate < lastYear) {
          out.add(candidate);
        }
      }
    }
    return out;
  }

  /** Re-numbers the year's days from 1 and takes NM of the donor day with the same number. */
  static List<ImputationRow> substitute(List<ImputationRow> rows, List<FlightCurvePoint> donor) {
    Map<Integer, Double> donorNm = new HashMap<>();
    for (FlightCurvePoint p : donor) {
      donorNm.putIfAbsent(p.trimDayNo(), p.nm());
    }
    int first = rows.stream().mapToInt(r -> r.source().daySince()).min().orElse(1);
    List<ImputationRow> out = new ArrayList<>(rows.size());
    for (ImputationRow row : rows) {
      int trimDayNo = row.source().daySince() - first + 1;
      out.add(row.withCurve(trimDayNo, donorNm.get(trimDayNo)));
    }
    return out;
  }
}
