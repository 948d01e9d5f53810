package com.ospicorp.abundanceindex.flightcurve.service;

import com.ospicorp.abundanceindex.common.Diagnostic;
import com.ospicorp.abundanceindex.common.DiagnosticKind;
import com.ospicorp.abundanceindex.flightcurve.model.CurveEstimationOptions;
import com.ospicorp.abundanceindex.flightcurve.model.CurveFitResult;
import com.ospicorp.abundanceindex.flightcurve.model.CurveWorkingRow;
import com.ospicorp.abundanceindex.flightcurve.model.FlightCurvePoint;
import com.ospicorp.abundanceindex.season.model.SeasonCount;
import com.ospicorp.abundanceindex.stats.FitResult;
import com.ospicorp.abundanceindex.stats.SmoothCurveModel;
import com.ospicorp.abundanceindex.stats.SmoothingObservation;
import com.ospicorp.abundanceindex.stats.SmoothingRegressionSolver;
import com.ospicorp.abundanceindex.stats.SolveMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fits the regional flight curve of one species-year from the pooled counts of its qualifying
 * sites.
 */
@Component
public class CurveFitter {
  private static final Logger log = LoggerFactory.getLogger(CurveFitter.class);

  /** Below this many sites the automatic switch keeps the standard solve. */
  static final int FAST_MODE_MIN_SITES = 100;

  private final SmoothingRegressionSolver solver;

  public CurveFitter(SmoothingRegressionSolver solver) {
    this.solver = solver;
  }

  /**
   * @param rows site-days of the year, already restricted to qualifying sites, with their
   *     trimmed day number
   * @param random source of the site subsampling
   */
  public CurveFitResult fit(String species, int year, List<CurveWorkingRow> rows,
      CurveEstimationOptions options, Random random) {
    List<String> sites = distinctSites(rows);
    List<CurveWorkingRow> working = rows;
    FitResult<SmoothCurveModel> model = FitResult.failure("no fit attempted");

    for (int trial = 1; trial <= options.maxRetries(); trial++) {
      working = subsample(rows, sites, options.maxSitesPerFit(), random);
      int siteCount = Math.min(sites.size(), options.maxSitesPerFit());
      SolveMode mode = solveMode(siteCount, options);
      log.info("Fitting the regional flight curve for species {} and year {} with {} sites, using {} -> trial {}",
          species, year, siteCount, mode, trial);
      model = solver.fit(toObservations(working), options.family(), mode);
      if (model.succeeded()) {
        break;
      }
      log.debug("Trial {} for species {} and year {} failed: {}", trial, species, year,
          ((FitResult.Failure<SmoothCurveModel>) model).reason());
    }

    List<Diagnostic> diagnostics = new ArrayList<>();
    List<CurveWorkingRow> estimated;
    if (model instanceof FitResult.Success<SmoothCurveModel> success) {
      estimated = normalise(species, year, working, success.model(), diagnostics);
    } else {
      String reason = ((FitResult.Failure<SmoothCurveModel>) model).reason();
      String message = "Error in fitting the regional flight curve for species " + species
          + " and year " + year + "; model did not converge after " + options.maxRetries()
          + " trials: " + reason;
      log.warn(message);
      diagnostics.add(new Diagnostic(DiagnosticKind.FIT_FAILURE, species, year, message));
      estimated = working.stream().map(r -> r.withEstimates(null, null)).toList();
    }
    return new CurveFitResult(toCurve(estimated), model, estimated, diagnostics);
  }

  static SolveMode solveMode(int siteCount, CurveEstimationOptions options) {
    if (!options.fastMode()) {
      return SolveMode.STANDARD;
    }
    if (options.autoFastModeThreshold() && siteCount < FAST_MODE_MIN_SITES) {
      return SolveMode.STANDARD;
    }
    return SolveMode.FAST;
  }

  private static List<CurveWorkingRow> subsample(List<CurveWorkingRow> rows, List<String> sites,
      int cap, Random random) {
    if (sites.size() <= cap) {
      return rows;
    }
    List<String> shuffled = new ArrayList<>(sites);
    Collections.shuffle(shuffled, random);
    Set<String> drawn = new HashSet<>(shuffled.subList(0, cap));
    return rows.stream().filter(r -> drawn.contains(r.siteId())).toList();
  }

  private List<CurveWorkingRow> normalise(String species, int year, List<CurveWorkingRow> working,
      SmoothCurveModel model, List<Diagnostic> diagnostics) {
    double[] fitted = new double[working.size()];
    boolean finite = true;
    Map<String, Double> siteSums = new HashMap<>();
    for (int i = 0; i < working.size(); i++) {
      CurveWorkingRow row = working.get(i);
      fitted[i] = row.source().inSeason() ? model.predict(row.siteId(), row.trimDayNo()) : 0d;
      if (!Double.isFinite(fitted[i])) {
        finite = false;
        break;
      }
      siteSums.merge(row.siteId(), fitted[i], Double::sum);
    }

    List<CurveWorkingRow> out = new ArrayList<>(working.size());
    if (finite) {
      for (int i = 0; i < working.size(); i++) {
        CurveWorkingRow row = working.get(i);
        double share = fitted[i] / siteSums.get(row.siteId());
        if (!Double.isFinite(share)) {
          finite = false;
          break;
        }
        out.add(row.withEstimates(fitted[i], round5(share)));
      }
    }
    if (!finite) {
      String message = "Flight curve for species " + species + " and year " + year
          + " has non-finite fitted values and was discarded";
      log.warn(message);
      diagnostics.add(new Diagnostic(DiagnosticKind.NUMERIC_DEGENERACY, species, year, message));
      return working.stream().map(r -> r.withEstimates(null, null)).toList();
    }
    return out;
  }

  /** One point per day, first site wins, ordered by day. */
  static List<FlightCurvePoint> toCurve(List<CurveWorkingRow> rows) {
    Map<Integer, FlightCurvePoint> byDay = new LinkedHashMap<>();
    for (CurveWorkingRow row : rows) {
      SeasonCount s = row.source();
      byDay.putIfAbsent(s.daySince(), new FlightCurvePoint(s.species(), s.date(), s.week(),
          s.weekDay(), s.daySince(), s.year(), s.season(), row.trimDayNo(), row.nm()));
    }
    List<FlightCurvePoint> curve = new ArrayList<>(byDay.values());
    curve.sort(Comparator.comparingInt(FlightCurvePoint::daySince));
    return curve;
  }

  private static List<SmoothingObservation> toObservations(List<CurveWorkingRow> rows) {
    List<SmoothingObservation> out = new ArrayList<>(rows.size());
    for (CurveWorkingRow row : rows) {
      out.add(new SmoothingObservation(row.siteId(), row.trimDayNo(), row.source().count()));
    }
    return out;
  }

  private static List<String> distinctSites(List<CurveWorkingRow> rows) {
    Set<String> sites = new LinkedHashSet<>();
    for (CurveWorkingRow row : rows) {
      sites.add(row.siteId());
    }
    return new ArrayList<>(sites);
  }

  private static double round5(double value) {
    double scaled = Math.round(value * 100_000d);
    return scaled / 100_000d;
  }
}
