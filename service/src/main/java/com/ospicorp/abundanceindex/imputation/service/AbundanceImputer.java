package com.ospicorp.abundanceindex.imputation.service;

import com.ospicorp.abundanceindex.common.Diagnostic;
import com.ospicorp.abundanceindex.common.InputContractException;
import com.ospicorp.abundanceindex.common.ModelKeys;
import com.ospicorp.abundanceindex.flightcurve.model.FlightCurvePoint;
import com.ospicorp.abundanceindex.flightcurve.model.FlightCurveTable;
import com.ospicorp.abundanceindex.imputation.model.ImputationOptions;
import com.ospicorp.abundanceindex.imputation.model.ImputationResult;
import com.ospicorp.abundanceindex.imputation.model.ImputationRow;
import com.ospicorp.abundanceindex.imputation.model.ImputedCount;
import com.ospicorp.abundanceindex.imputation.model.PhenologyOutcome;
import com.ospicorp.abundanceindex.imputation.model.SiteRegressionOutcome;
import com.ospicorp.abundanceindex.season.model.SeasonCount;
import com.ospicorp.abundanceindex.season.model.SeasonTable;
import com.ospicorp.abundanceindex.stats.CountRegressionModel;
import com.ospicorp.abundanceindex.stats.FitResult;
import com.ospicorp.abundanceindex.stats.ModelFamily;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fills the unvisited days of every site with counts expected from the flight curve, year by
 * year. The curve table must hold the curves of all years before this runs, since a year may
 * borrow another year's curve.
 */
@Service
public class AbundanceImputer {
  private static final Logger log = LoggerFactory.getLogger(AbundanceImputer.class);

  static final double MIN_NM = 0.000001;
  // leap-year tail day, allowed to miss in the donor curve
  private static final int LEAP_DAY_NO = 366;

  private final PhenologyResolver phenologyResolver;
  private final SiteRegressionFitter siteRegressionFitter;

  public AbundanceImputer(PhenologyResolver phenologyResolver,
      SiteRegressionFitter siteRegressionFitter) {
    this.phenologyResolver = phenologyResolver;
    this.siteRegressionFitter = siteRegressionFitter;
  }

  public ImputationResult impute(SeasonTable seasonTable, FlightCurveTable curves,
      ImputationOptions options) {
    checkSpecies(seasonTable, curves);
    if (options.family() == ModelFamily.NEGATIVE_BINOMIAL) {
      throw InputContractException.of(
          "Negative binomial distribution is not supported for imputation, use quasipoisson instead",
          InputContractException.UNSUPPORTED_FAMILY);
    }

    SeasonTable table = options.restrictToCompleteSeasons()
        ? seasonTable.completeSeasonsOnly()
        : seasonTable;
    Map<LocalDate, FlightCurvePoint> curveByDate = new HashMap<>();
    for (FlightCurvePoint p : curves.points()) {
      curveByDate.putIfAbsent(p.date(), p);
    }

    Map<String, ImputedCount> estimates = new HashMap<>();
    Map<String, FitResult<CountRegressionModel>> models = new LinkedHashMap<>();
    List<Diagnostic> diagnostics = new ArrayList<>();

    for (int year : selectYears(table, options.years())) {
      List<ImputationRow> rows = new ArrayList<>();
      for (SeasonCount s : table.forYear(year)) {
        FlightCurvePoint p = curveByDate.get(s.date());
        rows.add(ImputationRow.joined(s, p == null ? null : p.trimDayNo(),
            p == null ? null : p.nm()));
      }
      String species = rows.get(0).source().species();

      if (options.useNearestPhenology()) {
        PhenologyOutcome outcome = phenologyResolver.resolve(species, year, rows, curves);
        rows = outcome.rows();
        if (outcome.diagnostic() != null) {
          diagnostics.add(outcome.diagnostic());
        }
      }

      boolean curveMissing = rows.stream().anyMatch(AbundanceImputer::lacksCurve);
      if (curveMissing) {
        log.warn("No glm model will be fitted for {} in {}", species, year);
      } else {
        log.info("Computing abundance indices for {} in {} across {} sites", species, year,
            rows.stream().map(ImputationRow::siteId).distinct().count());
      }

      rows = prepare(rows);
      SiteRegressionOutcome regression = curveMissing
          ? siteRegressionFitter.skip(species, year, rows, "No glm fitted for " + year)
          : siteRegressionFitter.fit(species, year, rows, options.family());
      diagnostics.addAll(regression.diagnostics());

      for (ImputationRow row : regression.rows()) {
        estimates.put(key(row.siteId(), row.source().daySince()), toImputed(row));
      }
      if (options.retainModels()) {
        models.put(ModelKeys.siteModel(species, year), regression.model());
      }
    }

    Set<Integer> requested = options.years();
    List<ImputedCount> out = new ArrayList<>(table.rows().size());
    for (SeasonCount s : table.rows()) {
      if (!requested.isEmpty() && !requested.contains(s.year())) {
        continue;
      }
      ImputedCount estimate = estimates.get(key(s.siteId(), s.daySince()));
      out.add(estimate != null ? estimate : ImputedCount.unprocessed(s));
    }
    return new ImputationResult(out, models, diagnostics);
  }

  /** Out-of-season counts leave the model; a zero curve value is floored for the log offset. */
  static List<ImputationRow> prepare(List<ImputationRow> rows) {
    List<ImputationRow> out = new ArrayList<>(rows.size());
    for (ImputationRow row : rows) {
      ImputationRow prepared = row;
      if (!row.source().inSeason()) {
        prepared = prepared.withCount(null);
      } else if (row.nm() != null && row.nm() == 0d) {
        prepared = prepared.withNm(MIN_NM);
      }
      out.add(prepared);
    }
    return out;
  }

  static ImputedCount toImputed(ImputationRow row) {
    SeasonCount s = row.source();
    Double imputed;
    if (!s.inSeason()) {
      imputed = 0d;
    } else if (s.count() != null) {
      imputed = s.count();
    } else {
      imputed = row.fitted();
    }
    return ImputedCount.of(s, row.trimDayNo(), row.nm(), row.fitted(), imputed);
  }

  private static boolean lacksCurve(ImputationRow row) {
    return row.nm() == null && (row.trimDayNo() == null || row.trimDayNo() != LEAP_DAY_NO);
  }

  private static void checkSpecies(SeasonTable seasonTable, FlightCurveTable curves) {
    if (seasonTable.isEmpty()) {
      return;
    }
    Set<String> counted = seasonTable.species();
    Set<String> curved = curves.species();
    if (counted.size() != 1 || !counted.equals(curved)) {
      throw InputContractException.of(
          "Species in count data " + counted + " and flight curve " + curved + " must be the same",
          InputContractException.SPECIES_MISMATCH);
    }
  }

  private static List<Integer> selectYears(SeasonTable table, Set<Integer> requested) {
    List<Integer> years = table.years();
    if (requested.isEmpty()) {
      return years;
    }
    return years.stream().filter(requested::contains).toList();
  }

  private static String key(String siteId, int daySince) {
    return siteId + '\u0000' + daySince;
  }
}
