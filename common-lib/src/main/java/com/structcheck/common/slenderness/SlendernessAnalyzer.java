package com.structcheck.common.slenderness;

import com.structcheck.common.exception.ExcessiveSlendernessException;
import com.structcheck.common.exception.InvalidGeometryException;
import com.structcheck.common.exception.InvalidMaterialException;
import com.structcheck.common.material.MaterialConstants;
import com.structcheck.common.model.InteractionCurve;

/**
 * Slenderness of compression members: λ, Euler load, moment magnification and the
 * empirical compressive-capacity reduction.
 *
 * <h3>Core relations</h3>
 * <pre>
 *   r       = t / √12
 *   λ       = k·lu / r            slender when λ &gt; 22
 *   EIeff   = factor · Ec · Ig    Ec = 4700·√f'c, Ig = width·t³/12
 *   Pc      = π²·EIeff / (k·lu)²
 *   δns     = Cm / (1 − Pu / 0.75·Pc) ≥ 1.0
 *   buckling factor = 1 − (k·lu / 32t)²
 * </pre>
 *
 * <p>Stateless; every method is a pure function of its arguments.
 */
public final class SlendernessAnalyzer {

    public static final double LAMBDA_LIMIT_BRACED = 22.0;
    public static final double LAMBDA_LIMIT_UNBRACED = 22.0;

    /** Up to this λ no compressive reduction applies. */
    public static final double LAMBDA_NO_REDUCTION = 25.0;

    /** Above this λ the member is rejected. */
    public static final double LAMBDA_MAX = 100.0;

    static final double STABILITY_FACTOR = 0.75;
    static final double BUCKLING_DIVISOR = 32.0;

    static final double CM_BASE = 0.6;
    static final double CM_FACTOR = 0.4;
    static final double CM_MIN = 0.4;
    static final double CM_TRANSVERSE = 1.0;

    static final double MIN_ECCENTRICITY_BASE = 15.0;
    static final double MIN_ECCENTRICITY_FACTOR = 0.03;

    public static final double SECOND_ORDER_LIMIT = 1.4;

    private static final double NEGLIGIBLE = 1e-10;

    private SlendernessAnalyzer() {}

    // ── Analysis ───────────────────────────────────────────────────

    /**
     * @throws InvalidGeometryException when lu, t, width, k or Cm is not positive
     * @throws InvalidMaterialException when f'c is not positive
     */
    public static SlendernessResult analyze(SlendernessInput input) {
        validate(input);

        double t = input.t();
        double lu = input.lu();
        double k = input.k();

        double r = t / Math.sqrt(12.0);
        double lambda = k * lu / r;
        double limit = input.braced() ? LAMBDA_LIMIT_BRACED : LAMBDA_LIMIT_UNBRACED;

        EffectiveStiffness stiffness = effectiveStiffness(input.fc(), input.width(), t, input.category());
        double effectiveLength = k * lu;
        double pc = Math.PI * Math.PI * stiffness.eiEff() / (effectiveLength * effectiveLength);

        double bucklingRatio = effectiveLength / (BUCKLING_DIVISOR * t);
        double bucklingFactor = bucklingRatio >= 1.0 ? 0.0 : 1.0 - bucklingRatio * bucklingRatio;

        return new SlendernessResult(lu, t, k, r, lambda, lambda > limit, limit,
            pc, input.cm(), 1.0, bucklingFactor);
    }

    /**
     * δns at axial demand {@code pu} (N, + = compression).
     */
    public static Magnification magnification(SlendernessResult result, double pu) {
        if (!result.slender() || pu <= 0 || result.pc() <= 0) {
            return Magnification.NONE;
        }
        double denominator = 1.0 - pu / (STABILITY_FACTOR * result.pc());
        if (denominator <= 0) {
            return Magnification.UNSTABLE;
        }
        return Magnification.of(Math.max(result.cm() / denominator, 1.0));
    }

    // ── Capacity reduction ─────────────────────────────────────────

    public static CompressionReduction compressionReduction(SlendernessResult result) {
        double lambda = result.lambdaRatio();
        if (lambda <= LAMBDA_NO_REDUCTION) {
            return new CompressionReduction(1.0, ReductionPolicy.NONE, lambda);
        }
        if (lambda > LAMBDA_MAX) {
            return new CompressionReduction(0.0, ReductionPolicy.REJECTED, lambda);
        }
        return new CompressionReduction(Math.max(result.bucklingFactor(), 0.0),
            ReductionPolicy.EMPIRICAL, lambda);
    }

    /**
     * New curve with the compressive side reduced; the input curve is not touched.
     *
     * @throws ExcessiveSlendernessException when λ exceeds {@value #LAMBDA_MAX}
     */
    public static InteractionCurve applyCompressionReduction(InteractionCurve curve,
                                                             SlendernessResult result) {
        CompressionReduction reduction = compressionReduction(result);
        return switch (reduction.policy()) {
            case NONE -> curve;
            case EMPIRICAL -> curve.reduceCompression(reduction.factor());
            case REJECTED -> throw new ExcessiveSlendernessException(result.lambdaRatio(), LAMBDA_MAX);
        };
    }

    // ── Design moments ─────────────────────────────────────────────

    /**
     * Cm from signed end moments; the larger magnitude is taken as M2 whatever the
     * argument order.
     */
    public static EquivalentMomentFactor equivalentMomentFactor(double m1, double m2,
                                                                boolean transverseLoads) {
        if (transverseLoads) {
            return new EquivalentMomentFactor(CM_TRANSVERSE, m1, m2, Double.NaN,
                Curvature.TRANSVERSE_LOADS);
        }

        double small = m1;
        double large = m2;
        if (Math.abs(m1) > Math.abs(m2)) {
            small = m2;
            large = m1;
        }

        if (Math.abs(large) < NEGLIGIBLE) {
            return new EquivalentMomentFactor(CM_TRANSVERSE, small, large, 0.0,
                Curvature.NEGLIGIBLE_MOMENT);
        }

        double ratio = small / large;
        double cm = Math.max(CM_BASE - CM_FACTOR * ratio, CM_MIN);

        Curvature curvature;
        if (ratio > 0) {
            curvature = Curvature.DOUBLE;
        } else if (ratio < 0) {
            curvature = Curvature.SINGLE;
        } else {
            curvature = Curvature.ZERO_M1;
        }
        return new EquivalentMomentFactor(cm, small, large, ratio, curvature);
    }

    /** Minimum eccentricity 15 + 0.03·h (mm). */
    public static double minimumEccentricity(double h) {
        return MIN_ECCENTRICITY_BASE + MIN_ECCENTRICITY_FACTOR * h;
    }

    /** M2,min = |Pu| · (15 + 0.03·h), N·mm. */
    public static double minimumMoment(double pu, double h) {
        return Math.abs(pu) * minimumEccentricity(h);
    }

    public static DesignMoment designMoment(double m2, double pu, double h, double delta) {
        double m2Abs = Math.abs(m2);
        double m2Min = minimumMoment(pu, h);
        double m2Design = Math.max(m2Abs, m2Min);
        return new DesignMoment(m2Abs, m2Min, minimumEccentricity(h), m2Design,
            delta, delta * m2Design, m2Min > m2Abs);
    }

    /**
     * Mu,2nd / Mu,1st against the 1.4 limit. Two zero moments give a ratio of 1.
     */
    public static SecondOrderCheck secondOrderCheck(double firstOrder, double secondOrder) {
        double mu1 = Math.abs(firstOrder);
        double mu2 = Math.abs(secondOrder);

        double ratio;
        if (mu1 == 0) {
            ratio = mu2 == 0 ? 1.0 : Double.POSITIVE_INFINITY;
        } else {
            ratio = mu2 / mu1;
        }
        return new SecondOrderCheck(mu1, mu2, ratio, SECOND_ORDER_LIMIT, ratio <= SECOND_ORDER_LIMIT);
    }

    public static EffectiveStiffness effectiveStiffness(double fc, double width, double t,
                                                        StiffnessCategory category) {
        double ec = MaterialConstants.concreteModulus(fc);
        double ig = width * t * t * t / 12.0;
        double factor = category.factor();
        return new EffectiveStiffness(ec, ig, factor, factor * ec * ig);
    }

    // ── Validation ─────────────────────────────────────────────────

    static void validate(SlendernessInput input) {
        if (input == null) {
            throw new InvalidGeometryException("slenderness", "input must not be null");
        }
        if (!(input.lu() > 0)) throw InvalidGeometryException.nonPositive("lu", input.lu());
        if (!(input.t() > 0)) throw InvalidGeometryException.nonPositive("t", input.t());
        if (!(input.width() > 0)) throw InvalidGeometryException.nonPositive("width", input.width());
        if (!(input.k() > 0)) throw InvalidGeometryException.nonPositive("k", input.k());
        if (!(input.cm() > 0)) throw InvalidGeometryException.nonPositive("Cm", input.cm());
        if (!(input.fc() > 0)) throw InvalidMaterialException.nonPositive("fc", input.fc());
        if (input.category() == null) {
            throw new InvalidGeometryException("category", "must not be null");
        }
    }
}
