package com.ospicorp.abundanceindex.imputation.model;

import com.ospicorp.abundanceindex.common.Diagnostic;
import java.util.List;

/**
 * Rows of a year after the curve check. {@code donorYear} is set when another year's curve was
 * substituted; {@code resolved} is false when the year still lacks a usable curve.
 */
public record PhenologyOutcome(
    List<ImputationRow> rows,
    Integer donorYear,
    boolean resolved,
    Diagnostic diagnostic
) {}
