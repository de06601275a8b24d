package com.structcheck.common.model;

/**
 * Which moment of a {@link LoadCombination} is checked against a single-axis curve.
 * Axis selection is an upstream concern; the core consumes one axis at a time.
 */
public enum MomentAxis {
    M2,
    M3,
    /** M3·cos θ + M2·sin θ for a given moment-plane angle θ. */
    COMBINED,
    /** √(M2² + M3²). */
    SRSS;

    /** Moment magnitude of {@code combo} on this axis; {@code angleDeg} is used by COMBINED only. */
    public double moment(LoadCombination combo, double angleDeg) {
        return switch (this) {
            case M2 -> Math.abs(combo.m2());
            case M3 -> Math.abs(combo.m3());
            case COMBINED -> {
                double rad = Math.toRadians(angleDeg);
                yield Math.abs(combo.m3() * Math.cos(rad) + combo.m2() * Math.sin(rad));
            }
            case SRSS -> combo.momentResultant();
        };
    }
}
