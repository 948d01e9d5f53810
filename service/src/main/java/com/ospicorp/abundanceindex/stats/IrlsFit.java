package com.ospicorp.abundanceindex.stats;

/** Converged state of one penalised IRLS run. */
record IrlsFit(
    double[] coefficients,
    double deviance,
    double edf,
    double pearsonChi2,
    double theta,
    int iterations,
    int observations
) {}
