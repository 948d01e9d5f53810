package com.ospicorp.abundanceindex.flightcurve.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.abundanceindex.season.model.SeasonCount;

/** A site-day of the data a flight curve was fitted on, with the fitted and normalised values. */
public record CurveWorkingRow(
    @JsonProperty("SEASON") SeasonCount source,
    @JsonProperty("TRIM_DAY_NO") int trimDayNo,
    @JsonProperty("FITTED") Double fitted,
    @JsonProperty("NM") Double nm
) {

  public CurveWorkingRow withEstimates(Double fitted, Double nm) {
    return new CurveWorkingRow(source, trimDayNo, fitted, nm);
  }

  public String siteId() {
    return source.siteId();
  }
}
