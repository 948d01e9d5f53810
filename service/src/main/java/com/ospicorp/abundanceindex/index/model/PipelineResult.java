package com.ospicorp.abundanceindex.index.model;

import com.ospicorp.abundanceindex.common.Diagnostic;
import com.ospicorp.abundanceindex.flightcurve.model.CurveEstimationResult;
import com.ospicorp.abundanceindex.imputation.model.ImputationResult;
import java.util.List;

public record PipelineResult(
    CurveEstimationResult curves,
    ImputationResult imputation,
    List<AbundanceIndex> indices,
    List<Diagnostic> diagnostics
) {}
