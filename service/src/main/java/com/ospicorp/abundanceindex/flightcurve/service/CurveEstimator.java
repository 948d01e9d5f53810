package com.ospicorp.abundanceindex.flightcurve.service;

import com.ospicorp.abundanceindex.common.Diagnostic;
import com.ospicorp.abundanceindex.common.DiagnosticKind;
import com.ospicorp.abundanceindex.common.ModelKeys;
import com.ospicorp.abundanceindex.flightcurve.model.CurveEstimationOptions;
import com.ospicorp.abundanceindex.flightcurve.model.CurveEstimationResult;
import com.ospicorp.abundanceindex.flightcurve.model.CurveFitResult;
import com.ospicorp.abundanceindex.flightcurve.model.CurveWorkingRow;
import com.ospicorp.abundanceindex.flightcurve.model.FlightCurvePoint;
import com.ospicorp.abundanceindex.flightcurve.model.FlightCurveTable;
import com.ospicorp.abundanceindex.season.model.SeasonCount;
import com.ospicorp.abundanceindex.season.model.SeasonTable;
import com.ospicorp.abundanceindex.stats.FitResult;
import com.ospicorp.abundanceindex.stats.SmoothCurveModel;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Estimates one flight curve per requested year. Sites take part in a year's fit only when they
 * were visited and seen often enough that year.
 */
@Service
public class CurveEstimator {
  private static final Logger log = LoggerFactory.getLogger(CurveEstimator.class);

  private final CurveFitter fitter;

  public CurveEstimator(CurveFitter fitter) {
    this.fitter = fitter;
  }

  public CurveEstimationResult estimate(SeasonTable seasonTable, CurveEstimationOptions options) {
    Random random = options.seed() != null ? new Random(options.seed()) : new Random();
    return estimate(seasonTable, options, random);
  }

  public CurveEstimationResult estimate(SeasonTable seasonTable, CurveEstimationOptions options,
      Random random) {
    SeasonTable table = options.restrictToCompleteSeasons()
        ? seasonTable.completeSeasonsOnly()
        : seasonTable;

    List<FlightCurvePoint> curves = new ArrayList<>();
    Map<String, FitResult<SmoothCurveModel>> models = new LinkedHashMap<>();
    List<CurveWorkingRow> workingData = new ArrayList<>();
    List<Diagnostic> diagnostics = new ArrayList<>();

    for (int year : selectYears(table, options.years())) {
      List<CurveWorkingRow> yearRows = withTrimmedDay(table.forYear(year));
      String species = yearRows.get(0).source().species();
      Set<String> qualifying = qualifyingSites(yearRows, options);

      CurveFitResult result;
      if (qualifying.size() < options.minSites()) {
        String message = "Not enough sites with observations for estimating the flight curve for species "
            + species + " in " + year + " (" + qualifying.size() + " of " + options.minSites()
            + " required)";
        log.warn(message);
        List<CurveWorkingRow> unfitted = yearRows.stream()
            .map(r -> r.withEstimates(null, null))
            .toList();
        result = new CurveFitResult(CurveFitter.toCurve(unfitted), FitResult.failure(message),
            List.of(), List.of(new Diagnostic(DiagnosticKind.INSUFFICIENT_SITES, species, year,
                message)));
      } else {
        List<CurveWorkingRow> siteRows = yearRows.stream()
            .filter(r -> qualifying.contains(r.siteId()))
            .toList();
        result = fitter.fit(species, year, siteRows, options, random);
      }

      curves.addAll(result.curve());
      diagnostics.addAll(result.diagnostics());
      if (options.retainModels()) {
        models.put(ModelKeys.flightModel(species, year), result.model());
      }
      if (options.retainWorkingData()) {
        workingData.addAll(result.workingData());
      }
    }
    return new CurveEstimationResult(new FlightCurveTable(curves), models, workingData,
        diagnostics);
  }

  static List<Integer> selectYears(SeasonTable table, Set<Integer> requested) {
    List<Integer> years = table.years();
    if (requested == null || requested.isEmpty()) {
      return years;
    }
    return years.stream().filter(requested::contains).toList();
  }

  /** Day number counted from 1 at the first day of the year slice, across all its sites. */
  static List<CurveWorkingRow> withTrimmedDay(List<SeasonCount> yearRows) {
    int first = yearRows.stream().mapToInt(SeasonCount::daySince).min().orElse(1);
    List<CurveWorkingRow> out = new ArrayList<>(yearRows.size());
    for (SeasonCount row : yearRows) {
      out.add(new CurveWorkingRow(row, row.daySince() - first + 1, null, null));
    }
    return out;
  }

  static Set<String> qualifyingSites(List<CurveWorkingRow> yearRows,
      CurveEstimationOptions options) {
    Map<String, Integer> visits = new HashMap<>();
    Map<String, Integer> occurrences = new HashMap<>();
    Set<String> sites = new LinkedHashSet<>();
    for (CurveWorkingRow row : yearRows) {
      SeasonCount s = row.source();
      sites.add(s.siteId());
      if (!s.isObserved() || s.isAnchor()) {
        continue;
      }
      visits.merge(s.siteId(), 1, Integer::sum);
      if (s.count() > 0) {
        occurrences.merge(s.siteId(), 1, Integer::sum);
      }
    }
    Set<String> out = new LinkedHashSet<>();
    for (String site : sites) {
      if (visits.getOrDefault(site, 0) >= options.minVisits()
          && occurrences.getOrDefault(site, 0) >= options.minOccurrences()) {
        out.add(site);
      }
    }
    return out;
  }
}
