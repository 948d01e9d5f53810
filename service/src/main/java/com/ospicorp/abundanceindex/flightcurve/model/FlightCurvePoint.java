package com.ospicorp.abundanceindex.flightcurve.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDate;

/**
 * Relative abundance expected on one day of one species-year. Over a year NM sums to one, or is
 * null on every day when the curve could not be estimated.
 */
@JsonPropertyOrder({"SPECIES", "DATE", "WEEK", "WEEK_DAY", "DAY_SINCE", "M_YEAR", "M_SEASON",
    "TRIM_DAY_NO", "NM"})
public record FlightCurvePoint(
    @JsonProperty("SPECIES") String species,
    @JsonProperty("DATE") LocalDate date,
    @JsonProperty("WEEK") int week,
    @JsonProperty("WEEK_DAY") int weekDay,
    @JsonProperty("DAY_SINCE") int daySince,
    @JsonProperty("M_YEAR") int year,
    @JsonProperty("M_SEASON") int season,
    @JsonProperty("TRIM_DAY_NO") int trimDayNo,
    @JsonProperty("NM") Double nm
) {}
