package com.structcheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One point of a P-M interaction curve.
 *
 * <p>Forces in N, moments in N·mm. {@code mn} is never negative and {@code phi}
 * lies between the compression- and tension-controlled factors.
 *
 * @param pn               nominal axial strength, + = compression
 * @param mn               nominal moment strength
 * @param phi              strength-reduction factor at this strain state
 * @param phiPn            design axial strength
 * @param phiMn            design moment strength
 * @param neutralAxisDepth c (mm); +∞ at the compression apex, 0 at the tension apex
 * @param tensionStrain    strain of the extreme tension steel; +∞ at the tension apex
 */
public record CapacityPoint(
    @JsonProperty("Pn")        double pn,
    @JsonProperty("Mn")        double mn,
    @JsonProperty("phi")       double phi,
    @JsonProperty("phiPn")     double phiPn,
    @JsonProperty("phiMn")     double phiMn,
    @JsonProperty("c")         double neutralAxisDepth,
    @JsonProperty("epsilonT")  double tensionStrain
) {
    public static CapacityPoint of(double pn, double mn, double phi,
                                   double neutralAxisDepth, double tensionStrain) {
        return new CapacityPoint(pn, mn, phi, phi * pn, phi * mn, neutralAxisDepth, tensionStrain);
    }

    /** Copy with nominal and design axial strength scaled by {@code factor}. */
    public CapacityPoint scaleAxial(double factor) {
        return new CapacityPoint(pn * factor, mn, phi, phiPn * factor, phiMn,
            neutralAxisDepth, tensionStrain);
    }

    public DesignPoint designPoint() {
        return new DesignPoint(phiMn, phiPn);
    }
}
