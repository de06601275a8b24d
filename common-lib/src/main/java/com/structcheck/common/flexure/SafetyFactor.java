package com.structcheck.common.flexure;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ray-cast safety factor of one demand point.
 *
 * @param value  factor by which the demand vector can grow before reaching the boundary;
 *               {@code +∞} for a demand at the origin
 * @param inside true when the demand lies on or within the capacity boundary
 * @param tier   how the value was obtained
 */
public record SafetyFactor(
    @JsonProperty("value")  double value,
    @JsonProperty("inside") boolean inside,
    @JsonProperty("tier")   RayCastTier tier
) {
    /** Demand/capacity ratio 1/SF; 0 for an unbounded safety factor. */
    public double dcr() {
        return toDcr(value);
    }

    static double toDcr(double sf) {
        return sf > 0 && !Double.isInfinite(sf) ? 1.0 / sf : 0.0;
    }
}
