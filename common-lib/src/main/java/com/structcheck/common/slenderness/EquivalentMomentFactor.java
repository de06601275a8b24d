package com.structcheck.common.slenderness;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cm with the end moments it was derived from, M2 being the larger in magnitude.
 *
 * @param ratio M1/M2, NaN when transverse loads govern
 */
public record EquivalentMomentFactor(
    @JsonProperty("Cm")        double cm,
    @JsonProperty("M1")        double m1,
    @JsonProperty("M2")        double m2,
    @JsonProperty("M1M2Ratio") double ratio,
    @JsonProperty("curvature") Curvature curvature
) {}
