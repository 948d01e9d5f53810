package com.ospicorp.abundanceindex.imputation.model;

import com.ospicorp.abundanceindex.common.Diagnostic;
import com.ospicorp.abundanceindex.stats.CountRegressionModel;
import com.ospicorp.abundanceindex.stats.FitResult;
import java.util.List;

public record SiteRegressionOutcome(
    List<ImputationRow> rows,
    FitResult<CountRegressionModel> model,
    List<String> nonZeroSites,
    List<String> zeroSites,
    List<Diagnostic> diagnostics
) {}
