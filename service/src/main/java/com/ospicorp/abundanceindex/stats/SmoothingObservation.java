package com.ospicorp.abundanceindex.stats;

/** One site-day for the seasonal smoother; a null count is predicted but not fitted. */
public record SmoothingObservation(String siteId, int day, Double count) {}
