package com.ospicorp.abundanceindex.imputation.model;

import com.ospicorp.abundanceindex.season.model.SeasonCount;

/**
 * Working state of one site-day while a year is imputed. {@code count} starts as the observed
 * count and is cleared outside the season so those days stay out of the model.
 */
public record ImputationRow(
    SeasonCount source,
    Integer trimDayNo,
    Double nm,
    Double count,
    Double fitted
) {

  public static ImputationRow joined(SeasonCount source, Integer trimDayNo, Double nm) {
    return new ImputationRow(source, trimDayNo, nm, source.count(), null);
  }

  public ImputationRow withCurve(Integer trimDayNo, Double nm) {
    return new ImputationRow(source, trimDayNo, nm, count, fitted);
  }

  public ImputationRow withNm(Double nm) {
    return new ImputationRow(source, trimDayNo, nm, count, fitted);
  }

  public ImputationRow withCount(Double count) {
    return new ImputationRow(source, trimDayNo, nm, count, fitted);
  }

  public ImputationRow withFitted(Double fitted) {
    return new ImputationRow(source, trimDayNo, nm, count, fitted);
  }

  public String siteId() {
    return source.siteId();
  }
}
