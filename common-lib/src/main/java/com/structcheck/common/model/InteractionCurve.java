package com.structcheck.common.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Immutable P-M interaction curve for one section and one bending axis.
 *
 * <p>Points run from the pure-compression apex (M = 0, maximum φPn) to the
 * pure-tension apex (M = 0, minimum φPn) with φPn non-increasing. A curve is a pure
 * function of its section, so callers may cache and share it freely across threads.
 * Adjustments such as a slenderness reduction go through {@link #map} and always
 * produce a new curve.
 */
public final class InteractionCurve {

    private final List<CapacityPoint> points;

    public InteractionCurve(List<CapacityPoint> points) {
        this.points = List.copyOf(points);
    }

    public List<CapacityPoint> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public CapacityPoint first() {
        return points.get(0);
    }

    public CapacityPoint last() {
        return points.get(points.size() - 1);
    }

    /** Design boundary as (φMn, φPn) pairs, in curve order. */
    public List<DesignPoint> designPoints() {
        List<DesignPoint> design = new ArrayList<>(points.size());
        for (CapacityPoint p : points) {
            design.add(p.designPoint());
        }
        return design;
    }

    public double maxPhiPn() {
        return points.stream().mapToDouble(CapacityPoint::phiPn).max().orElse(0.0);
    }

    public double minPhiPn() {
        return points.stream().mapToDouble(CapacityPoint::phiPn).min().orElse(0.0);
    }

    /** New curve with every point transformed; this curve is left untouched. */
    public InteractionCurve map(UnaryOperator<CapacityPoint> transform) {
        List<CapacityPoint> mapped = new ArrayList<>(points.size());
        for (CapacityPoint p : points) {
            mapped.add(transform.apply(p));
        }
        return new InteractionCurve(mapped);
    }

    /**
     * New curve with the compressive side (Pn &gt; 0) scaled by {@code factor};
     * tension-side points are kept as they are. Ordering is preserved because all
     * compressive values shrink by the same ratio and stay above the tension side.
     */
    public InteractionCurve reduceCompression(double factor) {
        return map(p -> p.pn() > 0 ? p.scaleAxial(factor) : p);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InteractionCurve other)) return false;
        return points.equals(other.points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "InteractionCurve[points=" + points.size()
            + ", maxPhiPn=" + maxPhiPn() + ", minPhiPn=" + minPhiPn() + "]";
    }
}
