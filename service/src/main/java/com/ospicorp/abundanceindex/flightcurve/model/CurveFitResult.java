package com.ospicorp.abundanceindex.flightcurve.model;

import com.ospicorp.abundanceindex.common.Diagnostic;
import com.ospicorp.abundanceindex.stats.FitResult;
import com.ospicorp.abundanceindex.stats.SmoothCurveModel;
import java.util.List;

public record CurveFitResult(
    List<FlightCurvePoint> curve,
    FitResult<SmoothCurveModel> model,
    List<CurveWorkingRow> workingData,
    List<Diagnostic> diagnostics
) {}
