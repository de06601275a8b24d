package com.structcheck.common.material;

/**
 * Material and stress-block constants for strain-compatibility analysis (ACI 318).
 *
 * <p>All values are SI: stresses and moduli in MPa, strains dimensionless.
 */
public final class MaterialConstants {

    /** Ultimate concrete compressive strain. */
    public static final double EPSILON_CU = 0.003;

    /** Reinforcing steel modulus of elasticity (MPa). */
    public static final double ES = 200_000.0;

    /** Whitney stress-block intensity factor. */
    public static final double WHITNEY_STRESS_FACTOR = 0.85;

    /** Pn,max / P0 for tied members. */
    public static final double PN_MAX_FACTOR_TIED = 0.80;

    /** Pn,max / P0 for spirally reinforced members. */
    public static final double PN_MAX_FACTOR_SPIRAL = 0.85;

    private static final double BETA1_MAX = 0.85;
    private static final double BETA1_MIN = 0.65;
    private static final double BETA1_REFERENCE_FC = 28.0;
    private static final double BETA1_STEP = 0.05;
    private static final double BETA1_STEP_FC = 7.0;

    private static final double EC_COEFFICIENT = 4700.0;

    private MaterialConstants() {}

    /**
     * Stress-block depth factor β1 for the given concrete strength.
     *
     * <pre>
     *   f'c ≤ 28 MPa        → 0.85
     *   28 < f'c < 55 MPa   → 0.85 − 0.05·(f'c − 28)/7
     *   f'c ≥ 55 MPa        → 0.65
     * </pre>
     */
    public static double beta1(double fc) {
        if (fc <= BETA1_REFERENCE_FC) return BETA1_MAX;
        double beta1 = BETA1_MAX - BETA1_STEP * (fc - BETA1_REFERENCE_FC) / BETA1_STEP_FC;
        return Math.max(BETA1_MIN, Math.min(BETA1_MAX, beta1));
    }

    /** Normal-weight concrete modulus Ec = 4700·√f'c (MPa). */
    public static double concreteModulus(double fc) {
        return EC_COEFFICIENT * Math.sqrt(fc);
    }

    /** Steel yield strain fy / Es. */
    public static double yieldStrain(double fy) {
        return fy / ES;
    }
}
