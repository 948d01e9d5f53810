package com.ospicorp.abundanceindex.imputation.model;

import com.ospicorp.abundanceindex.stats.ModelFamily;
import java.util.Set;

public record ImputationOptions(
    ModelFamily family,
    boolean restrictToCompleteSeasons,
    Set<Integer> years,
    boolean useNearestPhenology,
    boolean retainModels
) {

  public ImputationOptions {
    if (family == null) {
      throw new IllegalArgumentException("family must be provided");
    }
    years = years == null ? Set.of() : Set.copyOf(years);
  }

  public static ImputationOptions defaults() {
    return new ImputationOptions(ModelFamily.QUASI_POISSON, true, Set.of(), true, true);
  }

  public ImputationOptions withFamily(ModelFamily value) {
    return new ImputationOptions(value, restrictToCompleteSeasons, years, useNearestPhenology,
        retainModels);
  }

  public ImputationOptions withYears(Set<Integer> value) {
    return new ImputationOptions(family, restrictToCompleteSeasons, value, useNearestPhenology,
        retainModels);
  }

  public ImputationOptions withNearestPhenology(boolean value) {
    return new ImputationOptions(family, restrictToCompleteSeasons, years, value, retainModels);
  }
}
