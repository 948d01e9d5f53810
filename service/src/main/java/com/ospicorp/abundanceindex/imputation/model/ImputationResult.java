package com.ospicorp.abundanceindex.imputation.model;

import com.ospicorp.abundanceindex.common.Diagnostic;
import com.ospicorp.abundanceindex.stats.CountRegressionModel;
import com.ospicorp.abundanceindex.stats.FitResult;
import java.util.List;
import java.util.Map;

public record ImputationResult(
    List<ImputedCount> rows,
    Map<String, FitResult<CountRegressionModel>> models,
    List<Diagnostic> diagnostics
) {}
