package com.ospicorp.abundanceindex.stats;

import java.util.List;

/** Log-link GLM with one coefficient per site, no intercept, and a fixed offset. */
public interface CountRegressionSolver {

  FitResult<CountRegressionModel> fit(List<CountObservation> data, ModelFamily family);
}
