package com.ospicorp.abundanceindex.stats;

import java.util.List;

/**
 * Fits {@code count ~ s(day)}, plus a fixed site effect when the data hold more than one site.
 */
public interface SmoothingRegressionSolver {

  FitResult<SmoothCurveModel> fit(List<SmoothingObservation> data, ModelFamily family,
      SolveMode mode);
}
