package com.structcheck.common.slenderness;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * (EI)eff = factor · Ec · Ig.
 *
 * @param ec     Ec (MPa)
 * @param ig     gross moment of inertia (mm⁴)
 * @param factor stiffness reduction factor
 * @param eiEff  effective flexural stiffness (N·mm²)
 */
public record EffectiveStiffness(
    @JsonProperty("Ec")     double ec,
    @JsonProperty("Ig")     double ig,
    @JsonProperty("factor") double factor,
    @JsonProperty("EIeff")  double eiEff
) {}
