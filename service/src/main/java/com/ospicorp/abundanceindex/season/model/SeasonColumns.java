package com.ospicorp.abundanceindex.season.model;

import java.util.List;

public final class SeasonColumns {
  public static final String SPECIES = "SPECIES";
  public static final String SITE_ID = "SITE_ID";
  public static final String DATE = "DATE";
  public static final String WEEK = "WEEK";
  public static final String WEEK_DAY = "WEEK_DAY";
  public static final String DAY_SINCE = "DAY_SINCE";
  public static final String M_YEAR = "M_YEAR";
  public static final String M_SEASON = "M_SEASON";
  public static final String COUNT = "COUNT";
  public static final String ANCHOR = "ANCHOR";
  public static final String COMPLT_SEASON = "COMPLT_SEASON";

  public static final List<String> REQUIRED = List.of(SPECIES, SITE_ID, DATE, WEEK, WEEK_DAY,
      DAY_SINCE, M_YEAR, M_SEASON, COUNT, ANCHOR, COMPLT_SEASON);

  private SeasonColumns() {
  }
}
