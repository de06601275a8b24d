package com.structcheck.common.slenderness;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Slenderness analysis of one member. Instability depends on the axial demand and is
 * reported per demand through {@link Magnification}, never here.
 *
 * @param lu             unsupported length (mm)
 * @param t              thickness in the buckling direction (mm)
 * @param k              effective length factor
 * @param r              radius of gyration t/√12 (mm)
 * @param lambdaRatio    λ = k·lu/r
 * @param slender        λ &gt; λ limit
 * @param lambdaLimit    slenderness limit applied
 * @param pc             Euler critical load (N)
 * @param cm             equivalent moment factor
 * @param deltaNs        magnification at Pu = 0; 1.0 by construction
 * @param bucklingFactor 1 − (k·lu/32t)², 0 once the ratio reaches 1
 */
public record SlendernessResult(
    @JsonProperty("lu")             double lu,
    @JsonProperty("t")              double t,
    @JsonProperty("k")              double k,
    @JsonProperty("r")              double r,
    @JsonProperty("lambda")         double lambdaRatio,
    @JsonProperty("isSlender")      boolean slender,
    @JsonProperty("lambdaLimit")    double lambdaLimit,
    @JsonProperty("Pc")             double pc,
    @JsonProperty("Cm")             double cm,
    @JsonProperty("deltaNs")        double deltaNs,
    @JsonProperty("bucklingFactor") double bucklingFactor
) {}
