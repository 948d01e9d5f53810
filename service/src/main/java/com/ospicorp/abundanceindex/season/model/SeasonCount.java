package com.ospicorp.abundanceindex.season.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDate;

/**
 * One monitored day at one site. {@code count} is null when the site was not visited that day.
 * {@code daySince} increases strictly within a site across the whole monitoring series.
 */
@JsonPropertyOrder({"SPECIES", "SITE_ID", "DATE", "WEEK", "WEEK_DAY", "DAY_SINCE", "M_YEAR",
    "M_SEASON", "COUNT", "ANCHOR", "COMPLT_SEASON"})
public record SeasonCount(
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
    @JsonProperty("COMPLT_SEASON") int completeSeason
) {

  @JsonIgnore
  public boolean inSeason() {
    return season != 0;
  }

  @JsonIgnore
  public boolean isAnchor() {
    return anchor != 0;
  }

  @JsonIgnore
  public boolean hasCompleteSeason() {
    return completeSeason == 1;
  }

  @JsonIgnore
  public boolean isObserved() {
    return count != null;
  }
}
