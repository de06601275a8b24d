package com.structcheck.common.slenderness;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Factor on the compressive side of the curve and the policy that produced it.
 * For {@link ReductionPolicy#REJECTED} the factor is 0 and must not be applied.
 */
public record CompressionReduction(
    @JsonProperty("factor")      double factor,
    @JsonProperty("policy")      ReductionPolicy policy,
    @JsonProperty("lambda")      double lambdaRatio
) {
    public boolean isRejected() {
        return policy == ReductionPolicy.REJECTED;
    }
}
