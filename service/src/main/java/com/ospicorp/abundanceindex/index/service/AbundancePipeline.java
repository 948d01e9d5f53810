package com.ospicorp.abundanceindex.index.service;

import com.ospicorp.abundanceindex.common.Diagnostic;
import com.ospicorp.abundanceindex.flightcurve.model.CurveEstimationOptions;
import com.ospicorp.abundanceindex.flightcurve.model.CurveEstimationResult;
import com.ospicorp.abundanceindex.flightcurve.service.CurveEstimator;
import com.ospicorp.abundanceindex.imputation.model.ImputationOptions;
import com.ospicorp.abundanceindex.imputation.model.ImputationResult;
import com.ospicorp.abundanceindex.imputation.service.AbundanceImputer;
import com.ospicorp.abundanceindex.index.model.AbundanceIndex;
import com.ospicorp.abundanceindex.index.model.PipelineResult;
import com.ospicorp.abundanceindex.season.model.SeasonTable;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs curve estimation for every year to completion, then imputation, then aggregation.
 */
@Service
public class AbundancePipeline {
  private static final Logger log = LoggerFactory.getLogger(AbundancePipeline.class);

  private final CurveEstimator curveEstimator;
  private final AbundanceImputer imputer;

  public AbundancePipeline(CurveEstimator curveEstimator, AbundanceImputer imputer) {
    this.curveEstimator = curveEstimator;
    this.imputer = imputer;
  }

  public PipelineResult run(SeasonTable seasonTable, CurveEstimationOptions curveOptions,
      ImputationOptions imputationOptions, boolean byWeek, int weekDay) {
    long started = System.currentTimeMillis();
    CurveEstimationResult curves = curveEstimator.estimate(seasonTable, curveOptions);
    ImputationResult imputation = imputer.impute(seasonTable, curves.curves(), imputationOptions);
    List<AbundanceIndex> indices = IndexAggregator.aggregate(imputation.rows(), byWeek, weekDay);

    List<Diagnostic> diagnostics = new ArrayList<>(curves.diagnostics());
    diagnostics.addAll(imputation.diagnostics());
    log.info("Computed {} abundance indices from {} season rows in {} ms ({} warnings)",
        indices.size(), seasonTable.rows().size(), System.currentTimeMillis() - started,
        diagnostics.size());
    return new PipelineResult(curves, imputation, indices, diagnostics);
  }
}
