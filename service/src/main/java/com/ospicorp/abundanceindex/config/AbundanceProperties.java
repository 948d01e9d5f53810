package com.ospicorp.abundanceindex.config;

import com.ospicorp.abundanceindex.flightcurve.model.CurveEstimationOptions;
import com.ospicorp.abundanceindex.imputation.model.ImputationOptions;
import com.ospicorp.abundanceindex.stats.ModelFamily;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** Defaults applied to HTTP requests that do not override them, bound from {@code abundance.*}. */
@ConfigurationProperties(prefix = "abundance")
public record AbundanceProperties(
    @DefaultValue FlightCurve flightCurve,
    @DefaultValue Imputation imputation,
    @DefaultValue Index index,
    @DefaultValue Solver solver
) {

  public record FlightCurve(
      @DefaultValue("100") int maxSitesPerFit,
      @DefaultValue("3") int minVisits,
      @DefaultValue("2") int minOccurrences,
      @DefaultValue("1") int minSites,
      @DefaultValue("3") int maxRetries,
      @DefaultValue("poisson") ModelFamily family,
      @DefaultValue("true") boolean restrictToCompleteSeasons,
      @DefaultValue("true") boolean fastMode,
      @DefaultValue("true") boolean autoFastModeThreshold,
      @DefaultValue("true") boolean retainModels,
      @DefaultValue("false") boolean retainWorkingData,
      Long seed
  ) {

    public CurveEstimationOptions toOptions() {
      return CurveEstimationOptions.builder()
          .maxSitesPerFit(maxSitesPerFit)
          .minVisits(minVisits)
          .minOccurrences(minOccurrences)
          .minSites(minSites)
          .maxRetries(maxRetries)
          .family(family)
          .restrictToCompleteSeasons(restrictToCompleteSeasons)
          .fastMode(fastMode)
          .autoFastModeThreshold(autoFastModeThreshold)
          .retainModels(retainModels)
          .retainWorkingData(retainWorkingData)
          .seed(seed)
          .build();
    }
  }

  public record Imputation(
      @DefaultValue("quasi-poisson") ModelFamily family,
      @DefaultValue("true") boolean restrictToCompleteSeasons,
      @DefaultValue("true") boolean useNearestPhenology,
      @DefaultValue("true") boolean retainModels
  ) {

    public ImputationOptions toOptions() {
      return new ImputationOptions(family, restrictToCompleteSeasons, Set.of(),
          useNearestPhenology, retainModels);
    }
  }

  public record Index(
      @DefaultValue("true") boolean byWeek,
      @DefaultValue("4") int weekDay
  ) {}

  public record Solver(
      @DefaultValue("10") int basisSize,
      @DefaultValue("200") int smootherMaxIterations,
      @DefaultValue("100") int glmMaxIterations,
      @DefaultValue({"0.01", "0.1", "1", "10", "100", "1000", "10000", "100000"}) double[] lambdas
  ) {}
}
