package com.structcheck.common.flexure;

import com.structcheck.common.model.CapacityPoint;
import com.structcheck.common.model.DemandPoint;
import com.structcheck.common.model.DesignPoint;
import com.structcheck.common.model.InteractionCurve;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CapacityEvaluatorTest {

    /** φ = 1 polygon (M, P): (0, 100) → (50, 50) → (60, 0) → (0, −40). */
    private static final InteractionCurve POLYGON = new InteractionCurve(List.of(
        point(100, 0),
        point(50, 50),
        point(0, 60),
        point(-40, 0)
    ));

    private static CapacityPoint point(double p, double m) {
        return CapacityPoint.of(p, m, 1.0, 1.0, 0.0);
    }

    @Nested
    @DisplayName("safetyFactor(): ray intersection")
    class Intersection {

        @Test
        @DisplayName("pure moment demand hits the P = 0 vertex")
        void pureMoment() {
            SafetyFactor sf = CapacityEvaluator.safetyFactor(POLYGON, 0, 30);
            assertEquals(2.0, sf.value(), 1e-9);
            assertTrue(sf.inside());
            assertEquals(RayCastTier.INTERSECTION, sf.tier());
            assertEquals(0.5, sf.dcr(), 1e-9);
        }

        @Test
        @DisplayName("demand outside the curve gives SF < 1")
        void outside() {
            SafetyFactor sf = CapacityEvaluator.safetyFactor(POLYGON, 0, 120);
            assertEquals(0.5, sf.value(), 1e-9);
            assertFalse(sf.inside());
        }

        @Test
        @DisplayName("demand on the boundary gives SF ≈ 1")
        void onBoundary() {
            SafetyFactor sf = CapacityEvaluator.safetyFactor(POLYGON, 25, 55);
            assertEquals(1.0, sf.value(), 1e-9);
            assertTrue(sf.inside());
        }

        @Test
        @DisplayName("pure compression and pure tension rays")
        void axialRays() {
            assertEquals(1.25, CapacityEvaluator.safetyFactor(POLYGON, 80, 0).value(), 1e-9);
            assertEquals(2.0, CapacityEvaluator.safetyFactor(POLYGON, -20, 0).value(), 1e-9);
        }

        @Test
        @DisplayName("sign of Mu is ignored")
        void negativeMoment() {
            assertEquals(CapacityEvaluator.safetyFactor(POLYGON, 10, 30).value(),
                CapacityEvaluator.safetyFactor(POLYGON, 10, -30).value(), 1e-12);
        }

        @Test
        @DisplayName("scaling the demand by k divides SF by k")
        void monotoneUnderScaling() {
            InteractionCurve curve = InteractionCurveBuilder.build(300, 600, 30, 420, 2400, 50);
            double pu = 800_000;
            double mu = 150_000_000;
            double base = CapacityEvaluator.safetyFactor(curve, pu, mu).value();

            for (double k : new double[] {0.5, 2.0, 4.0}) {
                double scaled = CapacityEvaluator.safetyFactor(curve, k * pu, k * mu).value();
                assertEquals(base / k, scaled, base * 1e-9);
            }
        }

        @Test
        @DisplayName("a vertex of a built curve has SF ≈ 1")
        void builtCurveVertex() {
            InteractionCurve curve = InteractionCurveBuilder.build(300, 600, 30, 420, 2400, 50);
            CapacityPoint vertex = curve.points().get(curve.size() / 2);

            SafetyFactor sf = CapacityEvaluator.safetyFactor(curve, vertex.phiPn(), vertex.phiMn());
            assertEquals(1.0, sf.value(), 1e-6);
            assertTrue(sf.inside());
        }
    }

    @Nested
    @DisplayName("safetyFactor(): degenerate demand and fallbacks")
    class Fallbacks {

        @Test
        @DisplayName("zero demand → +∞, inside, ORIGIN")
        void zeroDemand() {
            SafetyFactor sf = CapacityEvaluator.safetyFactor(POLYGON, 0, 0);
            assertTrue(Double.isInfinite(sf.value()));
            assertTrue(sf.inside());
            assertEquals(RayCastTier.ORIGIN, sf.tier());
            assertEquals(0.0, sf.dcr());
        }

        @Test
        @DisplayName("no segment crossed → nearest point within 15°")
        void angularNearest() {
            List<DesignPoint> single = List.of(new DesignPoint(50, 50));
            SafetyFactor sf = CapacityEvaluator.safetyFactor(single, 40, 40);

            assertEquals(1.25, sf.value(), 1e-9);
            assertEquals(RayCastTier.ANGULAR_NEAREST, sf.tier());
            assertTrue(sf.tier().isFallback());
        }

        @Test
        @DisplayName("nothing nearby → point-in-polygon placeholder 0.5 outside")
        void pointInPolygon() {
            List<DesignPoint> single = List.of(new DesignPoint(50, 50));
            SafetyFactor sf = CapacityEvaluator.safetyFactor(single, -40, 10);

            assertEquals(0.5, sf.value(), 1e-12);
            assertFalse(sf.inside());
            assertEquals(RayCastTier.POINT_IN_POLYGON, sf.tier());
        }

        @Test
        @DisplayName("checkFlexure marks a placeholder SF, not an ordinary fallback")
        void placeholderFlag() {
            InteractionCurve single = new InteractionCurve(List.of(CapacityPoint.of(50, 50, 1.0, 10, 0.002)));
            FlexureCheckResult result = CapacityEvaluator.checkFlexure(single,
                List.of(new DemandPoint(-40, 10, "T1")));

            assertEquals(RayCastTier.POINT_IN_POLYGON, result.lowestTier());
            assertTrue(result.usedFallback());
            assertTrue(result.usedPlaceholderSf());
            assertFalse(RayCastTier.ANGULAR_NEAREST.isPlaceholder());
        }

        @Test
        @DisplayName("crossing-number test on the closed polygon")
        void crossingNumber() {
            List<DesignPoint> boundary = POLYGON.designPoints();
            assertTrue(CapacityEvaluator.pointInPolygon(10, 10, boundary));
            assertFalse(CapacityEvaluator.pointInPolygon(100, 10, boundary));
        }
    }

    @Nested
    @DisplayName("phiMnAtP()")
    class MomentAtAxial {

        @Test
        @DisplayName("interpolates between bracketing points")
        void interpolates() {
            assertEquals(55.0, CapacityEvaluator.phiMnAtP(POLYGON, 25), 1e-9);
            assertEquals(25.0, CapacityEvaluator.phiMnAtP(POLYGON, 75), 1e-9);
            assertEquals(60.0, CapacityEvaluator.phiMnAtP0(POLYGON), 1e-9);
        }

        @Test
        @DisplayName("clamps to the nearest apex outside the P range")
        void clamps() {
            assertEquals(0.0, CapacityEvaluator.phiMnAtP(POLYGON, 500));
            assertEquals(0.0, CapacityEvaluator.phiMnAtP(POLYGON, -500));
        }

        @Test
        @DisplayName("empty curve → 0")
        void emptyCurve() {
            assertEquals(0.0, CapacityEvaluator.phiMnAtP(new InteractionCurve(List.of()), 10));
        }
    }

    @Nested
    @DisplayName("checkFlexure()")
    class CheckFlexure {

        @Test
        @DisplayName("governing combination, axial flags and per-combo results")
        void governing() {
            List<DemandPoint> demands = List.of(
                new DemandPoint(0, 30, "D1"),
                new DemandPoint(120, 0, "D2"),
                new DemandPoint(-20, 0, "T1"));

            FlexureCheckResult result = CapacityEvaluator.checkFlexure(POLYGON, demands);

            assertEquals(100.0 / 120.0, result.safetyFactor(), 1e-9);
            assertEquals(CheckStatus.NOT_OK, result.status());
            assertEquals("D2", result.criticalCombo());
            assertEquals(120.0, result.criticalPu());
            assertTrue(result.exceedsAxialCapacity());
            assertFalse(result.exceedsTensionCapacity());
            assertTrue(result.hasTension());
            assertEquals(1, result.tensionCombos());
            assertEquals(100.0, result.phiPnMax());
            assertEquals(-40.0, result.phiPtMin());
            assertEquals(60.0, result.phiMnAtP0(), 1e-9);
            assertEquals(0.0, result.phiMnAtPu());
            assertEquals(3, result.comboResults().size());
            assertEquals(RayCastTier.INTERSECTION, result.lowestTier());
            assertFalse(result.usedFallback());
            assertEquals(1.2, result.dcr(), 1e-9);
        }

        @Test
        @DisplayName("all demands inside → OK")
        void allInside() {
            FlexureCheckResult result = CapacityEvaluator.checkFlexure(POLYGON,
                List.of(new DemandPoint(10, 20, "A"), new DemandPoint(40, 10, "B")));
            assertEquals(CheckStatus.OK, result.status());
            assertEquals("OK", result.status().label());
        }

        @Test
        @DisplayName("empty demand set → SF +∞, OK, N/A")
        void noDemand() {
            FlexureCheckResult result = CapacityEvaluator.checkFlexure(POLYGON, List.of());
            assertTrue(Double.isInfinite(result.safetyFactor()));
            assertEquals(CheckStatus.OK, result.status());
            assertEquals("N/A", result.criticalCombo());
            assertEquals(0.0, result.dcr());
            assertTrue(result.comboResults().isEmpty());
        }
    }
}
