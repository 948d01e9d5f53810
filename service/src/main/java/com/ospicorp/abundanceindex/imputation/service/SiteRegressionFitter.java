package com.ospicorp.abundanceindex.imputation.service;

import com.ospicorp.abundanceindex.common.Diagnostic;
import com.ospicorp.abundanceindex.common.DiagnosticKind;
import com.ospicorp.abundanceindex.imputation.model.ImputationRow;
import com.ospicorp.abundanceindex.imputation.model.SiteRegressionOutcome;
import com.ospicorp.abundanceindex.stats.CountObservation;
import com.ospicorp.abundanceindex.stats.CountRegressionModel;
import com.ospicorp.abundanceindex.stats.CountRegressionSolver;
import com.ospicorp.abundanceindex.stats.FitResult;
import com.ospicorp.abundanceindex.stats.ModelFamily;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scales the flight curve to each site: a count GLM with the curve as offset is fitted on the
 * sites that saw the species that year. Sites with only zero counts are given a fitted value of 0
 * without going through the model.
 */
@Component
public class SiteRegressionFitter {
  private static final Logger log = LoggerFactory.getLogger(SiteRegressionFitter.class);

  private final CountRegressionSolver solver;

  public SiteRegressionFitter(CountRegressionSolver solver) {
    this.solver = solver;
  }

  public SiteRegressionOutcome fit(String species, int year, List<ImputationRow> rows,
      ModelFamily family) {
    List<String> nonZero = new ArrayList<>();
    List<String> zero = new ArrayList<>();
    partition(rows, nonZero, zero);

    if (nonZero.isEmpty()) {
      return skip(species, year, rows, "No glm fitted for " + year);
    }

    Set<String> fitted = new HashSet<>(nonZero);
    List<CountObservation> observations = new ArrayList<>();
    for (ImputationRow row : rows) {
      if (fitted.contains(row.siteId()) && row.nm() != null) {
        observations.add(new CountObservation(row.siteId(), row.count(), offset(row.nm(), family)));
      }
    }

    List<Diagnostic> diagnostics = new ArrayList<>();
    FitResult<CountRegressionModel> model = solver.fit(observations, family);
    List<ImputationRow> out = new ArrayList<>(rows.size());
    if (model instanceof FitResult.Success<CountRegressionModel> success) {
      boolean finite = true;
      for (ImputationRow row : rows) {
        if (!fitted.contains(row.siteId())) {
          out.add(row.withFitted(0d));
          continue;
        }
        Double value = row.nm() == null
            ? null
            : success.model().predict(row.siteId(), offset(row.nm(), family));
        if (value != null && !Double.isFinite(value)) {
          finite = false;
        }
        out.add(row.withFitted(value));
      }
      if (finite) {
        return new SiteRegressionOutcome(out, model, nonZero, zero, diagnostics);
      }
      String message = "Site regression for year " + year
          + " produced non-finite fitted values; fitted counts were discarded";
      log.warn(message);
      diagnostics.add(new Diagnostic(DiagnosticKind.NUMERIC_DEGENERACY, species, year, message));
      out.clear();
    } else {
      String reason = ((FitResult.Failure<CountRegressionModel>) model).reason();
      String message = "Computation of abundance indices for year " + year
          + " failed, verify the data provided for that year: " + reason;
      log.warn(message);
      diagnostics.add(new Diagnostic(DiagnosticKind.FIT_FAILURE, species, year, message));
    }

    for (ImputationRow row : rows) {
      out.add(row.withFitted(fitted.contains(row.siteId()) ? null : 0d));
    }
    return new SiteRegressionOutcome(out, model, nonZero, zero, diagnostics);
  }

  /** Leaves non-zero sites without estimates and only sets the zero sites to 0. */
  public SiteRegressionOutcome skip(String species, int year, List<ImputationRow> rows,
      String reason) {
    List<String> nonZero = new ArrayList<>();
    List<String> zero = new ArrayList<>();
    partition(rows, nonZero, zero);
    Set<String> zeroSites = new HashSet<>(zero);
    List<ImputationRow> out = rows.stream()
        .map(r -> r.withFitted(zeroSites.contains(r.siteId()) ? 0d : null))
        .toList();
    return new SiteRegressionOutcome(out, FitResult.failure(reason), nonZero, zero,
        List.of(new Diagnostic(DiagnosticKind.NO_MODEL_FITTED, species, year, reason)));
  }

  /** Log of NM for the Poisson families; the negative binomial variant takes NM as is. */
  static double offset(double nm, ModelFamily family) {
    return family == ModelFamily.NEGATIVE_BINOMIAL ? nm : Math.log(nm);
  }

  /** Splits sites by whether their counts of the year add up to more than zero. */
  private static void partition(List<ImputationRow> rows, List<String> nonZero,
      List<String> zero) {
    Map<String, Double> totals = new LinkedHashMap<>();
    for (ImputationRow row : rows) {
      totals.merge(row.siteId(), row.count() == null ? 0d : row.count(), Double::sum);
    }
    totals.forEach((site, total) -> (total > 0 ? nonZero : zero).add(site));
  }
}
