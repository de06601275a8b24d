package com.structcheck.common.flexure;

import com.structcheck.common.model.CapacityPoint;
import com.structcheck.common.model.DemandPoint;
import com.structcheck.common.model.DesignPoint;
import com.structcheck.common.model.InteractionCurve;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Checks demand points against a design interaction curve.
 *
 * <h3>Safety factor by ray casting</h3>
 * <p>The design boundary is a polyline of (φMn, φPn) points, star-shaped around the
 * origin. A ray is cast from the origin through the demand (Mu, Pu); the safety factor
 * is the ray parameter at the first boundary crossing when the demand sits at 1.
 * When no segment is crossed two fallbacks apply, each reported through
 * {@link RayCastTier}:
 * <ol>
 *   <li>nearest curve point within {@value #ANGULAR_TOLERANCE_DEG}° of the ray,</li>
 *   <li>a crossing-number inside/outside test with fixed safety factors.</li>
 * </ol>
 *
 * <p>Never throws for numerical edge cases. Stateless and thread-safe.
 */
public final class CapacityEvaluator {

    static final double ZERO_TOLERANCE = 1e-6;
    static final double PARALLEL_TOLERANCE = 1e-10;

    /** Slack on the segment parameter: −0.001 ≤ s ≤ 1.001. */
    static final double SEGMENT_PARAM_TOLERANCE = 0.001;

    /** A demand counts as inside when SF ≥ this. */
    static final double INSIDE_SF_THRESHOLD = 0.999;

    /** 0.1 % slack before flagging an axial capacity exceedance. */
    static final double AXIAL_CAPACITY_TOLERANCE = 1.001;

    static final double ANGULAR_TOLERANCE_DEG = 15.0;

    /**
     * Placeholder safety factors for the point-in-polygon tier, used when neither an
     * intersection nor a nearby curve point exists. They have no derivation: the inside
     * value is the smallest passing factor, the outside value a clearly failing one.
     * Results that use them are marked through {@link RayCastTier#isPlaceholder()}.
     */
    static final double PLACEHOLDER_INSIDE_SF = 1.0;
    static final double PLACEHOLDER_OUTSIDE_SF = 0.5;

    static final String NO_DEMAND_LABEL = "N/A";

    private CapacityEvaluator() {}

    // ── Safety factor ──────────────────────────────────────────────

    public static SafetyFactor safetyFactor(InteractionCurve curve, double pu, double mu) {
        return safetyFactor(curve.designPoints(), pu, mu);
    }

    /**
     * @param boundary design boundary as (φMn, φPn) points in curve order
     * @param pu       axial demand, + = compression
     * @param mu       moment demand; the sign is ignored
     * @return the safety factor with the tier that produced it; never null
     */
    public static SafetyFactor safetyFactor(List<DesignPoint> boundary, double pu, double mu) {
        double m = Math.abs(mu);
        double demandDistance = Math.hypot(m, pu);

        if (demandDistance < ZERO_TOLERANCE) {
            return new SafetyFactor(Double.POSITIVE_INFINITY, true, RayCastTier.ORIGIN);
        }

        double dirM = m / demandDistance;
        double dirP = pu / demandDistance;

        double bestT = rayIntersection(boundary, dirM, dirP);
        if (!Double.isNaN(bestT)) {
            double sf = bestT / demandDistance;
            return new SafetyFactor(sf, sf >= INSIDE_SF_THRESHOLD, RayCastTier.INTERSECTION);
        }

        // Fallback 1: nearest curve point in angle
        double capacityDistance = nearestInAngle(boundary, Math.atan2(pu, m));
        if (capacityDistance > 0) {
            double sf = capacityDistance / demandDistance;
            return new SafetyFactor(sf, sf >= INSIDE_SF_THRESHOLD, RayCastTier.ANGULAR_NEAREST);
        }

        // Fallback 2: inside/outside only, placeholder values
        boolean inside = pointInPolygon(m, pu, boundary);
        return new SafetyFactor(inside ? PLACEHOLDER_INSIDE_SF : PLACEHOLDER_OUTSIDE_SF,
            inside, RayCastTier.POINT_IN_POLYGON);
    }

    /**
     * Distance along the unit ray (dirM, dirP) to the closest boundary crossing, or NaN
     * when the ray misses every segment.
     */
    static double rayIntersection(List<DesignPoint> boundary, double dirM, double dirP) {
        double bestT = Double.NaN;

        for (int i = 0; i < boundary.size() - 1; i++) {
            DesignPoint a = boundary.get(i);
            DesignPoint b = boundary.get(i + 1);

            double dM = b.moment() - a.moment();
            double dP = b.axial() - a.axial();

            // t·dir = a + s·(b − a)
            double det = dirM * (-dP) - dirP * (-dM);
            if (Math.abs(det) < PARALLEL_TOLERANCE) continue;

            double t = (a.moment() * (-dP) - a.axial() * (-dM)) / det;
            double s = (dirM * a.axial() - dirP * a.moment()) / det;

            if (t > 0 && s >= -SEGMENT_PARAM_TOLERANCE && s <= 1 + SEGMENT_PARAM_TOLERANCE) {
                if (Double.isNaN(bestT) || t < bestT) {
                    bestT = t;
                }
            }
        }
        return bestT;
    }

    /**
     * Distance from the origin of the curve point closest in angle to the demand ray,
     * considering only points within the angular tolerance. 0 when there is none.
     */
    static double nearestInAngle(List<DesignPoint> boundary, double demandAngle) {
        double tolerance = Math.toRadians(ANGULAR_TOLERANCE_DEG);
        double bestDiff = Double.POSITIVE_INFINITY;
        double bestDistance = 0.0;

        for (DesignPoint point : boundary) {
            double distance = point.distanceFromOrigin();
            if (distance < ZERO_TOLERANCE) continue;

            double diff = Math.abs(Math.atan2(point.axial(), point.moment()) - demandAngle);
            if (diff > Math.PI) diff = 2 * Math.PI - diff;

            if (diff <= tolerance && diff < bestDiff) {
                bestDiff = diff;
                bestDistance = distance;
            }
        }
        return bestDistance;
    }

    /**
     * Crossing-number test of (m, p) against the boundary closed back to its first point.
     */
    static boolean pointInPolygon(double m, double p, List<DesignPoint> polygon) {
        int n = polygon.size();
        boolean inside = false;

        for (int i = 0, j = n - 1; i < n; j = i++) {
            double mi = polygon.get(i).moment();
            double pi = polygon.get(i).axial();
            double mj = polygon.get(j).moment();
            double pj = polygon.get(j).axial();

            if ((pi > p) != (pj > p)
                    && m < (mj - mi) * (p - pi) / (pj - pi + PARALLEL_TOLERANCE) + mi) {
                inside = !inside;
            }
        }
        return inside;
    }

    // ── Capacity interpolation ─────────────────────────────────────

    /** Moment capacity at P = 0 (pure flexure). */
    public static double phiMnAtP0(InteractionCurve curve) {
        return phiMnAtP(curve, 0.0);
    }

    public static double phiMnAtP(InteractionCurve curve, double pu) {
        return momentAtAxial(curve.designPoints(), pu);
    }

    /**
     * Nominal Mn at a given Pn, interpolated on the unreduced curve. Used where the
     * strength-reduction factor must not apply, e.g. strong-column/weak-beam ratios.
     */
    public static double nominalMnAtP(InteractionCurve curve, double pn) {
        List<DesignPoint> nominal = new ArrayList<>(curve.size());
        for (CapacityPoint p : curve.points()) {
            nominal.add(new DesignPoint(p.mn(), p.pn()));
        }
        return momentAtAxial(nominal, pn);
    }

    /**
     * Moment on the boundary at axial level {@code pu}: linear interpolation between the
     * closest points above and below; outside the curve's range the nearest point's
     * moment is returned (clamped, never extrapolated). Never negative.
     */
    static double momentAtAxial(List<DesignPoint> points, double pu) {
        if (points.isEmpty()) return 0.0;

        DesignPoint above = null;
        DesignPoint below = null;
        for (DesignPoint p : points) {
            if (p.axial() >= pu && (above == null || p.axial() < above.axial())) {
                above = p;
            }
            if (p.axial() <= pu && (below == null || p.axial() > below.axial())) {
                below = p;
            }
        }

        if (above == null || below == null) {
            DesignPoint closest = points.get(0);
            for (DesignPoint p : points) {
                if (Math.abs(p.axial() - pu) < Math.abs(closest.axial() - pu)) {
                    closest = p;
                }
            }
            return closest.moment();
        }

        if (Math.abs(above.axial() - below.axial()) < ZERO_TOLERANCE) {
            return below.moment();
        }

        double moment = below.moment()
            + (above.moment() - below.moment()) * (pu - below.axial()) / (above.axial() - below.axial());
        return Math.max(0.0, moment);
    }

    /**
     * Neutral-axis depth of the curve point closest to a demand, comparing relative
     * differences so that forces and moments of different magnitude weigh alike.
     * Empty when the closest point is an apex.
     */
    public static OptionalDouble neutralAxisDepthNear(InteractionCurve curve, double pu, double mu) {
        double m = Math.abs(mu);
        double minDistance = Double.POSITIVE_INFINITY;
        CapacityPoint closest = null;

        for (CapacityPoint point : curve.points()) {
            double dP = (point.phiPn() - pu) / Math.max(Math.abs(point.phiPn()), 1.0);
            double dM = (point.phiMn() - m) / Math.max(Math.abs(point.phiMn()), 1.0);
            double distance = Math.hypot(dP, dM);
            if (distance < minDistance) {
                minDistance = distance;
                closest = point;
            }
        }

        if (closest == null) return OptionalDouble.empty();
        double c = closest.neutralAxisDepth();
        return c > 0 && !Double.isInfinite(c) ? OptionalDouble.of(c) : OptionalDouble.empty();
    }

    // ── Demand set ─────────────────────────────────────────────────

    /**
     * Checks every demand against the curve and reports the governing one.
     *
     * @param curve   design interaction curve
     * @param demands demand points; may be empty
     * @return the governing result; never null
     */
    public static FlexureCheckResult checkFlexure(InteractionCurve curve, List<DemandPoint> demands) {
        List<DesignPoint> boundary = curve.designPoints();

        double minSf = Double.POSITIVE_INFINITY;
        DemandPoint critical = null;
        int tensionCount = 0;
        RayCastTier lowestTier = null;
        List<ComboResult> combos = new ArrayList<>(demands.size());

        for (DemandPoint demand : demands) {
            if (demand.isTension()) tensionCount++;

            SafetyFactor sf = safetyFactor(boundary, demand.pu(), demand.mu());
            lowestTier = RayCastTier.worst(lowestTier, sf.tier());
            combos.add(new ComboResult(demand.label(), demand.pu(), demand.mu(),
                sf.value(), sf.dcr(), momentAtAxial(boundary, demand.pu()),
                demand.isTension(), sf.tier()));

            if (critical == null || sf.value() < minSf) {
                minSf = sf.value();
                critical = demand;
            }
        }

        double criticalPu = critical != null ? critical.pu() : 0.0;
        double criticalMu = critical != null ? critical.mu() : 0.0;
        String criticalLabel = critical != null ? critical.label() : NO_DEMAND_LABEL;

        double phiPnMax = curve.maxPhiPn();
        double phiPtMin = curve.minPhiPn();

        return new FlexureCheckResult(
            minSf,
            CheckStatus.of(minSf),
            criticalLabel,
            momentAtAxial(boundary, 0.0),
            momentAtAxial(boundary, criticalPu),
            criticalPu,
            criticalMu,
            criticalPu > phiPnMax * AXIAL_CAPACITY_TOLERANCE,
            phiPnMax,
            tensionCount > 0,
            tensionCount,
            criticalPu < phiPtMin * AXIAL_CAPACITY_TOLERANCE,
            phiPtMin,
            combos,
            lowestTier != null ? lowestTier : RayCastTier.ORIGIN
        );
    }
}
