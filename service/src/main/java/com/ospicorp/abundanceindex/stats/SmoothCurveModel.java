package com.ospicorp.abundanceindex.stats;

/** Fitted seasonal smoother, {@code log E[count] = s(day) + site effect}. */
public interface SmoothCurveModel {

  /** Expected count on the response scale for a site that took part in the fit. */
  double predict(String siteId, double day);
}
