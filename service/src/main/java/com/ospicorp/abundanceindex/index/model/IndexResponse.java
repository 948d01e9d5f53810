package com.ospicorp.abundanceindex.index.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.abundanceindex.common.Diagnostic;
import java.util.List;

public record IndexResponse(
    List<String> species,
    @JsonProperty("by_week") boolean byWeek,
    @JsonProperty("index_count") int indexCount,
    List<AbundanceIndex> indices,
    List<Diagnostic> diagnostics
) {}
