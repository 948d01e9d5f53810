package com.ospicorp.abundanceindex.stats;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * P-spline smoother: cubic B-spline basis in day with a second-difference penalty and
 * treatment-coded site effects. The smoothing parameter is picked from a log-spaced grid by
 * UBRE (known scale) or GCV (quasi-Poisson).
 */
public class PenalizedSplineSolver implements SmoothingRegressionSolver {
  private static final Logger log = LoggerFactory.getLogger(PenalizedSplineSolver.class);

  public static final int DEFAULT_BASIS_SIZE = 10;
  public static final int DEFAULT_MAX_ITERATIONS = 200;
  public static final double[] DEFAULT_LAMBDAS = {1e-2, 1e-1, 1d, 1e1, 1e2, 1e3, 1e4, 1e5};

  private final int basisSize;
  private final int maxIterations;
  private final double[] lambdas;

  public PenalizedSplineSolver() {
    this(DEFAULT_BASIS_SIZE, DEFAULT_MAX_ITERATIONS, DEFAULT_LAMBDAS);
  }

  public PenalizedSplineSolver(int basisSize, int maxIterations, double[] lambdas) {
    if (lambdas == null || lambdas.length == 0) {
      throw new IllegalArgumentException("at least one smoothing parameter is required");
    }
    this.basisSize = basisSize;
    this.maxIterations = maxIterations;
    this.lambdas = lambdas.clone();
  }

  @Override
  public FitResult<SmoothCurveModel> fit(List<SmoothingObservation> data, ModelFamily family,
      SolveMode mode) {
    if (data == null || data.isEmpty()) {
      return FitResult.failure("no site-days to fit");
    }
    // first observed site is the reference level (-1), the other observed sites get a column
    // after the basis
    Map<String, Integer> siteColumns = new LinkedHashMap<>();
    int minDay = Integer.MAX_VALUE;
    int maxDay = Integer.MIN_VALUE;
    for (SmoothingObservation o : data) {
      if (o.count() != null && !siteColumns.containsKey(o.siteId())) {
        siteColumns.put(o.siteId(), siteColumns.isEmpty() ? -1 : basisSize + siteColumns.size() - 1);
      }
      minDay = Math.min(minDay, o.day());
      maxDay = Math.max(maxDay, o.day());
    }
    if (siteColumns.isEmpty()) {
      return FitResult.failure("no observed counts to fit");
    }
    int p = basisSize + siteColumns.size() - 1;
    // sites without a single count have no identifiable effect and take the reference level
    for (SmoothingObservation o : data) {
      if (!siteColumns.containsKey(o.siteId())) {
        siteColumns.put(o.siteId(), -1);
        log.debug("Site {} has no observed counts, predicting at the reference level", o.siteId());
      }
    }
    BSplineBasis basis = new BSplineBasis(minDay, maxDay, basisSize);

    List<double[]> rows = new ArrayList<>();
    List<Double> counts = new ArrayList<>();
    for (SmoothingObservation o : data) {
      if (o.count() == null) {
        continue;
      }
      double[] row = new double[p];
      System.arraycopy(basis.evaluate(o.day()), 0, row, 0, basisSize);
      int site = siteColumns.get(o.siteId());
      if (site >= 0) {
        row[site] = 1d;
      }
      rows.add(row);
      counts.add(o.count());
    }
    if (rows.isEmpty()) {
      return FitResult.failure("no observed counts to fit");
    }
    double[][] x = rows.toArray(new double[0][]);
    double[] y = counts.stream().mapToDouble(Double::doubleValue).toArray();
    double[] offset = new double[y.length];
    double[][] penaltyRoot = padColumns(basis.differencePenalty(), p);

    IrlsFit best = null;
    double bestLambda = Double.NaN;
    double bestScore = Double.POSITIVE_INFINITY;
    String lastFailure = null;
    for (double lambda : lambdas) {
      FitResult<IrlsFit> attempt = IrlsEngine.fit(x, y, offset, penaltyRoot, lambda, family, mode,
          maxIterations);
      if (attempt instanceof FitResult.Failure<IrlsFit> failure) {
        lastFailure = failure.reason();
        log.debug("Smoother failed for lambda {}: {}", lambda, failure.reason());
        continue;
      }
      IrlsFit fit = ((FitResult.Success<IrlsFit>) attempt).model();
      double score = score(fit, family);
      if (Double.isFinite(score) && score < bestScore) {
        bestScore = score;
        best = fit;
        bestLambda = lambda;
      }
    }
    if (best == null) {
      return FitResult.failure(lastFailure != null ? lastFailure : "no smoothing parameter gave a usable fit");
    }
    log.debug("Smoother selected lambda {} (edf {}, deviance {})", bestLambda, best.edf(),
        best.deviance());
    return FitResult.success(new PenalizedSplineModel(basis, best.coefficients(),
        Map.copyOf(siteColumns), family, bestLambda, best.edf(), best.deviance(),
        best.observations()));
  }

  private static double score(IrlsFit fit, ModelFamily family) {
    double n = fit.observations();
    if (family == ModelFamily.QUASI_POISSON) {
      double residualDf = n - fit.edf();
      return residualDf <= 0d ? Double.POSITIVE_INFINITY : n * fit.deviance() / (residualDf * residualDf);
    }
    return fit.deviance() / n + 2d * fit.edf() / n - 1d;
  }

  private static double[][] padColumns(double[][] d, int p) {
    double[][] out = new double[d.length][p];
    for (int r = 0; r < d.length; r++) {
      System.arraycopy(d[r], 0, out[r], 0, d[r].length);
    }
    return out;
  }
}
