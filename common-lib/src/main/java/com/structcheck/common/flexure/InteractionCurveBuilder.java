package com.structcheck.common.flexure;

import com.structcheck.common.exception.InvalidGeometryException;
import com.structcheck.common.exception.InvalidMaterialException;
import com.structcheck.common.material.MaterialConstants;
import com.structcheck.common.material.PhiFactors;
import com.structcheck.common.model.CapacityPoint;
import com.structcheck.common.model.InteractionCurve;
import com.structcheck.common.model.RectangularSection;
import com.structcheck.common.model.SteelLayer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Builds the P-M interaction curve of a rectangular reinforced-concrete section by
 * strain compatibility.
 *
 * <h3>Assumptions</h3>
 * <ul>
 *   <li>Plane sections; extreme concrete fiber at ε_cu = 0.003.</li>
 *   <li>Whitney stress block 0.85·f'c over a = β1·c, capped at the section depth.</li>
 *   <li>Elasto-perfectly-plastic steel, Es = 200 000 MPa. Bars inside the stress block
 *       have the displaced concrete deducted.</li>
 * </ul>
 *
 * <h3>Curve assembly</h3>
 * <ol>
 *   <li>Compression apex: 0.80·P0 with φ = 0.65, M = 0.</li>
 *   <li>Neutral-axis depths sampled in three zones: compression-dominant (10d → d),
 *       transition (d → c_b) and tension-controlled (c_b → 0.05d).</li>
 *   <li>Tension apex: −As·fy with φ = 0.90, M = 0.</li>
 *   <li>Stable sort by φPn descending, so equal values keep their sampling order.</li>
 * </ol>
 *
 * <p>Pure function of its inputs: no state, no logging, safe to call concurrently.
 * Units: N, mm, MPa in; N and N·mm out.
 */
public final class InteractionCurveBuilder {

    /** Default number of neutral-axis samples. */
    public static final int DEFAULT_SAMPLE_POINTS = 50;

    /** Smallest sample count that still gives every zone one point. */
    public static final int MIN_SAMPLE_POINTS = 4;

    /** Neutral-axis depths at or below this are skipped (mm). */
    static final double MIN_NEUTRAL_AXIS_DEPTH = 1.0;

    private static final double COMPRESSION_ZONE_SPAN = 10.0;
    private static final double TENSION_ZONE_FLOOR = 0.05;

    private InteractionCurveBuilder() {}

    /**
     * Curve for the default two-layer idealization.
     *
     * @param width   b, perpendicular to bending (mm)
     * @param depth   h, along the bending direction (mm)
     * @param fc      f'c (MPa)
     * @param fy      fy (MPa)
     * @param asTotal total longitudinal steel (mm²), split equally between both faces
     * @param cover   cover to the bar centre (mm)
     */
    public static InteractionCurve build(double width, double depth, double fc, double fy,
                                         double asTotal, double cover) {
        return build(RectangularSection.twoLayer(width, depth, fc, fy, asTotal, cover));
    }

    public static InteractionCurve build(RectangularSection section) {
        return build(section, DEFAULT_SAMPLE_POINTS);
    }

    /**
     * @param section      validated section with its reinforcement layers
     * @param samplePoints neutral-axis sample budget, at least {@value #MIN_SAMPLE_POINTS}
     * @return the ordered curve; never null
     * @throws InvalidGeometryException for non-positive dimensions or misplaced layers
     * @throws InvalidMaterialException for non-positive f'c or fy
     */
    public static InteractionCurve build(RectangularSection section, int samplePoints) {
        validate(section);
        if (samplePoints < MIN_SAMPLE_POINTS) {
            throw new IllegalArgumentException(
                "samplePoints must be >= " + MIN_SAMPLE_POINTS + " but was " + samplePoints);
        }

        double fc = section.fc();
        double fy = section.fy();
        double asTotal = section.totalSteelArea();

        // Effective depth: farthest layer from the compression face
        double d = section.layers().stream()
            .mapToDouble(SteelLayer::position)
            .max()
            .orElse(section.depth());

        double beta1 = MaterialConstants.beta1(fc);
        double epsilonY = MaterialConstants.yieldStrain(fy);

        double p0 = nominalAxialCapacity(section);
        double p0Max = MaterialConstants.PN_MAX_FACTOR_TIED * p0;

        List<CapacityPoint> points = new ArrayList<>(samplePoints + 2);
        points.add(CapacityPoint.of(p0Max, 0.0, PhiFactors.PHI_COMPRESSION,
            Double.POSITIVE_INFINITY, 0.0));

        for (double c : neutralAxisDepths(d, epsilonY, samplePoints)) {
            if (c <= MIN_NEUTRAL_AXIS_DEPTH) continue;
            points.add(sectionStrength(section, c, beta1, p0Max));
        }

        double pt = asTotal > 0 ? -asTotal * fy : 0.0;
        points.add(CapacityPoint.of(pt, 0.0, PhiFactors.PHI_TENSION,
            0.0, Double.POSITIVE_INFINITY));

        // List.sort is stable: ties keep apex-first / sampling order
        points.sort(Comparator.comparingDouble(CapacityPoint::phiPn).reversed());
        return new InteractionCurve(points);
    }

    /**
     * P0 = 0.85·f'c·(Ag − As) + fy·As, before the 0.80 cap (N).
     */
    public static double nominalAxialCapacity(RectangularSection section) {
        double asTotal = section.totalSteelArea();
        return MaterialConstants.WHITNEY_STRESS_FACTOR * section.fc() * (section.grossArea() - asTotal)
            + section.fy() * asTotal;
    }

    /**
     * Balanced neutral-axis depth c_b = d·ε_cu / (ε_cu + ε_y).
     */
    public static double balancedDepth(double d, double fy) {
        double epsilonCu = MaterialConstants.EPSILON_CU;
        return d * epsilonCu / (epsilonCu + MaterialConstants.yieldStrain(fy));
    }

    /**
     * Neutral-axis depths for the three sampling zones, deduplicated and descending.
     */
    static List<Double> neutralAxisDepths(double d, double epsilonY, int samplePoints) {
        double epsilonCu = MaterialConstants.EPSILON_CU;
        double cBalanced = d * epsilonCu / (epsilonCu + epsilonY);
        NavigableSet<Double> depths = new TreeSet<>(Comparator.reverseOrder());

        int nCompression = samplePoints / 4;
        for (int i = 0; i < nCompression; i++) {
            double ratio = (double) i / nCompression;
            depths.add(d * (COMPRESSION_ZONE_SPAN - (COMPRESSION_ZONE_SPAN - 1.0) * ratio));
        }

        int nTransition = samplePoints / 3;
        for (int i = 0; i <= nTransition; i++) {
            double ratio = (double) i / nTransition;
            depths.add(d - (d - cBalanced) * ratio);
        }

        int nTension = samplePoints / 3;
        double cMin = TENSION_ZONE_FLOOR * d;
        for (int i = 0; i <= nTension; i++) {
            double ratio = (double) i / nTension;
            double c = cBalanced - (cBalanced - cMin) * ratio;
            if (c > 0) depths.add(c);
        }

        return new ArrayList<>(depths);
    }

    /**
     * Nominal strength for one neutral-axis depth {@code c} (mm).
     */
    static CapacityPoint sectionStrength(RectangularSection section, double c,
                                         double beta1, double p0Max) {
        double b = section.width();
        double h = section.depth();
        double fc = section.fc();
        double fy = section.fy();
        double blockStress = MaterialConstants.WHITNEY_STRESS_FACTOR * fc;
        double centroid = h / 2;

        double a = Math.min(beta1 * c, h);
        double concreteForce = blockStress * a * b;
        double concreteMoment = concreteForce * (centroid - a / 2);

        double steelAxial = 0.0;
        double steelMoment = 0.0;
        double maxTensionStrain = 0.0;

        for (SteelLayer layer : section.layers()) {
            double di = layer.position();
            double asi = layer.area();

            // + = tension
            double strain = MaterialConstants.EPSILON_CU * (di - c) / c;
            double stress = Math.min(Math.abs(strain) * MaterialConstants.ES, fy);
            if (strain < 0) stress = -stress;

            double force;
            if (di <= a && stress < 0) {
                force = asi * (stress + blockStress);
            } else {
                force = asi * stress;
            }

            steelAxial -= force;
            steelMoment += force * (di - centroid);
            if (strain > maxTensionStrain) maxTensionStrain = strain;
        }

        double pn = Math.min(concreteForce + steelAxial, p0Max);
        double mn = Math.abs(concreteMoment + steelMoment);
        double phi = PhiFactors.flexure(maxTensionStrain);

        return CapacityPoint.of(pn, mn, phi, c, maxTensionStrain);
    }

    /**
     * Rejects sections no curve can be built for. Deterministic bad input: the caller
     * must not retry.
     */
    public static void validate(RectangularSection section) {
        if (section == null) {
            throw new InvalidGeometryException("section", "must not be null");
        }
        if (!(section.width() > 0)) throw InvalidGeometryException.nonPositive("width", section.width());
        if (!(section.depth() > 0)) throw InvalidGeometryException.nonPositive("depth", section.depth());
        if (!(section.fc() > 0)) throw InvalidMaterialException.nonPositive("fc", section.fc());
        if (!(section.fy() > 0)) throw InvalidMaterialException.nonPositive("fy", section.fy());

        for (SteelLayer layer : section.layers()) {
            if (layer.area() < 0) {
                throw new InvalidGeometryException("layer.area",
                    "must be >= 0 but was " + layer.area());
            }
            if (layer.position() < 0 || layer.position() > section.depth()) {
                throw new InvalidGeometryException("layer.position",
                    "must lie within [0, " + section.depth() + "] but was " + layer.position());
            }
        }
    }
}
