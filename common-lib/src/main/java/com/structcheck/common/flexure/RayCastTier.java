package com.structcheck.common.flexure;

/**
 * How a safety factor was obtained, ordered from most to least precise.
 *
 * <p>The fallback tiers are not errors, but they signal reduced precision and are
 * reported with every result.
 */
public enum RayCastTier {
    /** Demand at the origin; the safety factor is unbounded. */
    ORIGIN,
    /** Exact intersection of the demand ray with a boundary segment. */
    INTERSECTION,
    /** No intersection; nearest curve point within the angular tolerance was used. */
    ANGULAR_NEAREST,
    /** Nothing near the ray; placeholder safety factor chosen by a crossing-number test. */
    POINT_IN_POLYGON;

    public boolean isFallback() {
        return this == ANGULAR_NEAREST || this == POINT_IN_POLYGON;
    }

    /** The safety factor is a fixed placeholder, not a measured distance to the curve. */
    public boolean isPlaceholder() {
        return this == POINT_IN_POLYGON;
    }

    /** The less precise of the two tiers. */
    public static RayCastTier worst(RayCastTier a, RayCastTier b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
