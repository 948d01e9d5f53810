package com.ospicorp.abundanceindex.flightcurve.model;

import com.ospicorp.abundanceindex.common.Diagnostic;
import com.ospicorp.abundanceindex.stats.FitResult;
import com.ospicorp.abundanceindex.stats.SmoothCurveModel;
import java.util.List;
import java.util.Map;

/**
 * Curves for every requested year. {@code models} and {@code workingData} are empty unless the
 * options asked to retain them.
 */
public record CurveEstimationResult(
    FlightCurveTable curves,
    Map<String, FitResult<SmoothCurveModel>> models,
    List<CurveWorkingRow> workingData,
    List<Diagnostic> diagnostics
) {}
