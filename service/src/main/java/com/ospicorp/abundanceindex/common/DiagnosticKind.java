package com.ospicorp.abundanceindex.common;

public enum DiagnosticKind {
  INSUFFICIENT_SITES,
  FIT_FAILURE,
  NUMERIC_DEGENERACY,
  PHENOLOGY_SUBSTITUTED,
  UNRESOLVED_PHENOLOGY,
  NO_MODEL_FITTED
}
