package com.structcheck.common.slenderness;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Moment magnification δns at one axial demand. Buckling instability
 * (Pu ≥ 0.75·Pc) is a distinct outcome, carried as δ = +∞ with {@code unstable} set.
 */
public record Magnification(
    @JsonProperty("delta")    double delta,
    @JsonProperty("unstable") boolean unstable
) {
    public static final Magnification NONE = new Magnification(1.0, false);
    public static final Magnification UNSTABLE = new Magnification(Double.POSITIVE_INFINITY, true);

    public static Magnification of(double delta) {
        return new Magnification(delta, false);
    }

    /** Moment after magnification; undefined (+∞) when unstable. */
    public double apply(double moment) {
        return unstable ? Double.POSITIVE_INFINITY : delta * moment;
    }
}
