package com.ospicorp.abundanceindex.flightcurve.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.abundanceindex.common.Diagnostic;
import java.util.List;

public record FlightCurveResponse(
    List<String> species,
    List<Integer> years,
    @JsonProperty("complete_years") List<Integer> completeYears,
    List<FlightCurvePoint> points,
    List<Diagnostic> diagnostics
) {}
