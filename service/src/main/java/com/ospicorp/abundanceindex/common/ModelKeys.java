package com.ospicorp.abundanceindex.common;

/** Labels under which retained per-year models are stored. */
public final class ModelKeys {
  private ModelKeys() {
  }

  public static String flightModel(String species, int year) {
    return "FlightModel_" + label(species) + '_' + year;
  }

  public static String siteModel(String species, int year) {
    return "glm_mod_" + label(species) + '_' + year;
  }

  private static String label(String species) {
    return species == null ? "NA" : species.replace(' ', '_');
  }
}
