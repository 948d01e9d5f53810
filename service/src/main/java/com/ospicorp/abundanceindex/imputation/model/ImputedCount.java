package com.ospicorp.abundanceindex.imputation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.ospicorp.abundanceindex.season.model.SeasonCount;
import java.time.LocalDate;

/**
 * A season row with the curve it was joined to and the model estimates. {@code imputedCount} is
 * the observed count when there is one, the fitted value otherwise, and 0 outside the season.
 */
@JsonPropertyOrder({"SPECIES", "SITE_ID", "DATE", "WEEK", "WEEK_DAY", "DAY_SINCE", "M_YEAR",
    "M_SEASON", "COUNT", "ANCHOR", "COMPLT_SEASON", "TRIM_DAY_NO", "NM", "FITTED",
    "COUNT_IMPUTED"})
public record ImputedCount(
    @JsonProperty("SPECIES") String species,
    @JsonProperty("SITE_ID") String siteId,
    @JsonProperty("DATE") LocalDate date,
    @JsonProperty("WEEK") int week,
    @JsonProperty("WEEK_DAY") int weekDay,
    @JsonProperty("DAY_SINCE") int daySince,
    @JsonProperty("M_YEAR") int year,
    @JsonProperty("M_SEASON") int season,
    @JsonProperty("COUNT") Double count,
    @JsonProperty("ANCHOR") int anchor,
    @JsonProperty("COMPLT_SEASON") int completeSeason,
    @JsonProperty("TRIM_DAY_NO") Integer trimDayNo,
    @JsonProperty("NM") Double nm,
    @JsonProperty("FITTED") Double fitted,
    @JsonProperty("COUNT_IMPUTED") Double imputedCount
) {

  public static ImputedCount of(SeasonCount s, Integer trimDayNo, Double nm, Double fitted,
      Double imputedCount) {
    return new ImputedCount(s.species(), s.siteId(), s.date(), s.week(), s.weekDay(),
        s.daySince(), s.year(), s.season(), s.count(), s.anchor(), s.completeSeason(), trimDayNo,
        nm, fitted, imputedCount);
  }

  public static ImputedCount unprocessed(SeasonCount s) {
    return of(s, null, null, null, null);
  }
}
