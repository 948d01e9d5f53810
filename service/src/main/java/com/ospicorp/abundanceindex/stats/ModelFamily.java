package com.ospicorp.abundanceindex.stats;

import java.util.Locale;

/** Error distributions supported by the log-link count models. */
public enum ModelFamily {
  POISSON("poisson"),
  NEGATIVE_BINOMIAL("nb"),
  QUASI_POISSON("quasipoisson");

  private final String code;

  ModelFamily(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /** Accepts the short codes as well as the enum names, case-insensitively. */
  public static ModelFamily fromCode(String value) {
    if (value == null) {
      throw new IllegalArgumentException("model family must be provided");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
    for (ModelFamily family : values()) {
      if (family.code.equals(normalized)
          || family.name().replace("_", "").toLowerCase(Locale.ROOT).equals(normalized)) {
        return family;
      }
    }
    throw new IllegalArgumentException("Unknown model family '" + value
        + "'. Supported values: poisson,nb,quasipoisson.");
  }
}
