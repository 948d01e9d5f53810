package com.ospicorp.abundanceindex.stats;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class IrlsGlmSolver implements CountRegressionSolver {
  public static final int DEFAULT_MAX_ITERATIONS = 100;

  private final int maxIterations;

  public IrlsGlmSolver() {
    this(DEFAULT_MAX_ITERATIONS);
  }

  public IrlsGlmSolver(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  @Override
  public FitResult<CountRegressionModel> fit(List<CountObservation> data, ModelFamily family) {
    Map<String, Integer> columns = new LinkedHashMap<>();
    List<CountObservation> usable = new ArrayList<>();
    for (CountObservation o : data) {
      if (o.count() == null || !Double.isFinite(o.offset())) {
        continue;
      }
      columns.putIfAbsent(o.siteId(), columns.size());
      usable.add(o);
    }
    if (usable.isEmpty()) {
      return FitResult.failure("no observed counts with a finite offset");
    }

    int n = usable.size();
    int p = columns.size();
    double[][] x = new double[n][p];
    double[] y = new double[n];
    double[] offset = new double[n];
    for (int i = 0; i < n; i++) {
      CountObservation o = usable.get(i);
      x[i][columns.get(o.siteId())] = 1d;
      y[i] = o.count();
      offset[i] = o.offset();
    }

    FitResult<IrlsFit> result = IrlsEngine.fit(x, y, offset, null, 0d, family,
        SolveMode.STANDARD, maxIterations);
    if (result instanceof FitResult.Failure<IrlsFit> failure) {
      return FitResult.failure(failure.reason());
    }
    IrlsFit fit = ((FitResult.Success<IrlsFit>) result).model();
    Map<String, Double> effects = new LinkedHashMap<>();
    columns.forEach((site, column) -> effects.put(site, fit.coefficients()[column]));
    double dispersion = 1d;
    if (family == ModelFamily.QUASI_POISSON) {
      dispersion = n > p ? fit.pearsonChi2() / (n - p) : Double.NaN;
    }
    return FitResult.success(new SiteEffectGlmModel(Map.copyOf(effects), family, fit.deviance(),
        dispersion, fit.theta(), fit.iterations(), n));
  }
}
