package com.ospicorp.abundanceindex.stats;

/** Fitted {@code log E[count] = site effect + offset} model. */
public interface CountRegressionModel {

  double predict(String siteId, double offset);
}
