package com.structcheck.common.material;

/**
 * Strength-reduction factors for axial load and flexure (ACI 318 §21.2.2).
 *
 * <pre>
 *   εt ≤ 0.002           → compression-controlled (0.65, or 0.75 with spirals)
 *   εt ≥ 0.005           → tension-controlled (0.90)
 *   0.002 &lt; εt &lt; 0.005 → linear transition
 * </pre>
 */
public final class PhiFactors {

    public static final double PHI_COMPRESSION = 0.65;
    public static final double PHI_COMPRESSION_SPIRAL = 0.75;
    public static final double PHI_TENSION = 0.90;

    /** Net tensile strain at the compression-controlled limit. */
    public static final double EPSILON_TY = 0.002;

    /** Net tensile strain at the tension-controlled limit (εty + 0.003). */
    public static final double EPSILON_T_LIMIT = 0.005;

    private PhiFactors() {}

    public static double flexure(double epsilonT) {
        return flexure(epsilonT, false);
    }

    /**
     * @param epsilonT net tensile strain of the extreme tension steel (sign ignored)
     * @param spiral   true when the member is spirally reinforced
     */
    public static double flexure(double epsilonT, boolean spiral) {
        double strain = Math.abs(epsilonT);
        double phiC = spiral ? PHI_COMPRESSION_SPIRAL : PHI_COMPRESSION;

        if (strain >= EPSILON_T_LIMIT) return PHI_TENSION;
        if (strain <= EPSILON_TY) return phiC;
        return phiC + (PHI_TENSION - phiC) * (strain - EPSILON_TY) / (EPSILON_T_LIMIT - EPSILON_TY);
    }
}
