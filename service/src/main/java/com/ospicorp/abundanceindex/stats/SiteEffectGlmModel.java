package com.ospicorp.abundanceindex.stats;

import java.util.Map;

public record SiteEffectGlmModel(
    Map<String, Double> siteEffects,
    ModelFamily family,
    double deviance,
    double dispersion,
    double theta,
    int iterations,
    int observations
) implements CountRegressionModel {

  @Override
  public double predict(String siteId, double offset) {
    Double effect = siteEffects.get(siteId);
    if (effect == null) {
      throw new IllegalArgumentException("site " + siteId + " was not part of the fit");
    }
    return Math.exp(effect + offset);
  }
}
