package com.ospicorp.abundanceindex.index.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Yearly abundance index of one site; null when a contributing day has no fitted value. */
@JsonPropertyOrder({"SITE_ID", "M_YEAR", "ABUNDANCE_INDEX"})
public record AbundanceIndex(
    @JsonProperty("SITE_ID") String siteId,
    @JsonProperty("M_YEAR") int year,
    @JsonProperty("ABUNDANCE_INDEX") Double abundanceIndex
) {}
