package com.structcheck.common.slenderness;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Mc = δ · max(|M2|, M2,min). Moments in N·mm, eccentricity in mm.
 */
public record DesignMoment(
    @JsonProperty("M2")             double m2,
    @JsonProperty("M2min")          double m2Min,
    @JsonProperty("eMin")           double minEccentricity,
    @JsonProperty("M2design")       double m2Design,
    @JsonProperty("delta")          double delta,
    @JsonProperty("Mc")             double mc,
    @JsonProperty("controlsM2min")  boolean controlsMinimum
) {}
