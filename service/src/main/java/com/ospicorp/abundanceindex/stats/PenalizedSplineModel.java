package com.ospicorp.abundanceindex.stats;

import java.util.Map;

public record PenalizedSplineModel(
    BSplineBasis basis,
    double[] coefficients,
    Map<String, Integer> siteColumns,
    ModelFamily family,
    double lambda,
    double edf,
    double deviance,
    int observations
) implements SmoothCurveModel {

  @Override
  public double predict(String siteId, double day) {
    Integer site = siteColumns.get(siteId);
    if (site == null) {
      throw new IllegalArgumentException("site " + siteId + " was not part of the fit");
    }
    double[] b = basis.evaluate(day);
    double eta = 0d;
    for (int j = 0; j < b.length; j++) {
      eta += b[j] * coefficients[j];
    }
    if (site >= 0) {
      eta += coefficients[site];
    }
    return Math.exp(eta);
  }
}
