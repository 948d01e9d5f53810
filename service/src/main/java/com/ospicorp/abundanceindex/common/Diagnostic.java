package com.ospicorp.abundanceindex.common;

import com.fasterxml.jackson.annotation.JsonProperty;

// Non-fatal condition met while processing one species-year
public record Diagnostic(
    DiagnosticKind kind,
    String species,
    @JsonProperty("year") int year,
    String message
) {}
