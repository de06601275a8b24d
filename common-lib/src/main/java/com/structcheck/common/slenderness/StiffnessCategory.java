package com.structcheck.common.slenderness;

/**
 * Effective moment-of-inertia factors (I_eff = factor · Ig) for buckling and
 * magnification at factored load level.
 */
public enum StiffnessCategory {
    /** Walls are taken as cracked for seismic design. */
    CRACKED_WALL(0.35),
    UNCRACKED_WALL(0.70),
    COLUMN(0.70),
    BEAM(0.35),
    FLAT_SLAB(0.25);

    private final double factor;

    StiffnessCategory(double factor) {
        this.factor = factor;
    }

    public double factor() {
        return factor;
    }
}
