package com.ospicorp.abundanceindex.flightcurve.model;

import com.ospicorp.abundanceindex.stats.ModelFamily;
import java.util.Set;

/**
 * Settings of one flight-curve estimation run.
 *
 * @param maxSitesPerFit sites drawn at random when a year has more than this many
 * @param minVisits visits (non-anchor days with a count) a site needs in the year
 * @param minOccurrences days with a positive count a site needs in the year
 * @param minSites qualifying sites needed before a curve is fitted at all
 * @param maxRetries fit attempts per year, each on a fresh subsample
 * @param years years to estimate; null or empty means every year present
 * @param fastMode use the cheaper solve
 * @param autoFastModeThreshold only use the cheaper solve when there are many sites
 * @param seed seed of the site subsampling; null draws a fresh one
 */
public record CurveEstimationOptions(
    int maxSitesPerFit,
    int minVisits,
    int minOccurrences,
    int minSites,
    int maxRetries,
    ModelFamily family,
    boolean restrictToCompleteSeasons,
    Set<Integer> years,
    boolean fastMode,
    boolean autoFastModeThreshold,
    boolean retainModels,
    boolean retainWorkingData,
    Long seed
) {

  public CurveEstimationOptions {
    if (maxSitesPerFit < 1) {
      throw new IllegalArgumentException("maxSitesPerFit must be positive");
    }
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be positive");
    }
    if (family == null) {
      throw new IllegalArgumentException("family must be provided");
    }
    years = years == null ? Set.of() : Set.copyOf(years);
  }

  public static CurveEstimationOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .maxSitesPerFit(maxSitesPerFit)
        .minVisits(minVisits)
        .minOccurrences(minOccurrences)
        .minSites(minSites)
        .maxRetries(maxRetries)
        .family(family)
        .restrictToCompleteSeasons(restrictToCompleteSeasons)
        .years(years)
        .fastMode(fastMode)
        .autoFastModeThreshold(autoFastModeThreshold)
        .retainModels(retainModels)
        .retainWorkingData(retainWorkingData)
        .seed(seed);
  }

  public static final class Builder {
    private int maxSitesPerFit = 100;
    private int minVisits = 3;
    private int minOccurrences = 2;
    private int minSites = 1;
    private int maxRetries = 3;
    private ModelFamily family = ModelFamily.POISSON;
    private boolean restrictToCompleteSeasons = true;
    private Set<Integer> years = Set.of();
    private boolean fastMode = true;
    private boolean autoFastModeThreshold = true;
    private boolean retainModels = true;
    private boolean retainWorkingData = true;
    private Long seed;

    private Builder() {
    }

    public Builder maxSitesPerFit(int value) {
      this.maxSitesPerFit = value;
      return this;
    }

    public Builder minVisits(int value) {
      this.minVisits = value;
      return this;
    }

    public Builder minOccurrences(int value) {
      this.minOccurrences = value;
      return this;
    }

    public Builder minSites(int value) {
      this.minSites = value;
      return this;
    }

    public Builder maxRetries(int value) {
      this.maxRetries = value;
      return this;
    }

    public Builder family(ModelFamily value) {
      this.family = value;
      return this;
    }

    public Builder restrictToCompleteSeasons(boolean value) {
      this.restrictToCompleteSeasons = value;
      return this;
    }

    public Builder years(Set<Integer> value) {
      this.years = value;
      return this;
    }

    public Builder fastMode(boolean value) {
      this.fastMode = value;
      return this;
    }

    public Builder autoFastModeThreshold(boolean value) {
      this.autoFastModeThreshold = value;
      return this;
    }

    public Builder retainModels(boolean value) {
      this.retainModels = value;
      return this;
    }

    public Builder retainWorkingData(boolean value) {
      this.retainWorkingData = value;
      return this;
    }

    public Builder seed(Long value) {
      this.seed = value;
      return this;
    }

    public CurveEstimationOptions build() {
      return new CurveEstimationOptions(maxSitesPerFit, minVisits, minOccurrences, minSites,
          maxRetries, family, restrictToCompleteSeasons, years, fastMode, autoFastModeThreshold,
          retainModels, retainWorkingData, seed);
    }
  }
}
