package com.structcheck.common.slenderness;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Geometry and stiffness data for one member in one buckling direction.
 *
 * @param lu       unsupported length (mm)
 * @param t        section dimension in the buckling direction (mm)
 * @param width    section dimension perpendicular to it (mm)
 * @param fc       f'c (MPa)
 * @param k        effective length factor
 * @param cm       equivalent moment factor
 * @param braced   whether the frame is braced against sidesway
 * @param category stiffness reduction category
 */
public record SlendernessInput(
    @JsonProperty("lu")       double lu,
    @JsonProperty("t")        double t,
    @JsonProperty("width")    double width,
    @JsonProperty("fc")       double fc,
    @JsonProperty("k")        double k,
    @JsonProperty("Cm")       double cm,
    @JsonProperty("braced")   boolean braced,
    @JsonProperty("category") StiffnessCategory category
) {
    /** Typical k for a wall braced top and bottom. */
    public static final double K_WALL_BRACED = 0.8;
    public static final double K_COLUMN = 1.0;
    public static final double K_CANTILEVER = 2.0;

    /** Braced member with the conservative Cm = 1.0. */
    public static SlendernessInput braced(double lu, double t, double width, double fc,
                                          double k, StiffnessCategory category) {
        return new SlendernessInput(lu, t, width, fc, k, 1.0, true, category);
    }
}
