package com.ospicorp.abundanceindex.stats;

/**
 * One site-day for the site regression. {@code offset} is on the linear-predictor scale; a null
 * count or a non-finite offset keeps the row out of the fit.
 */
public record CountObservation(String siteId, Double count, double offset) {}
