package com.structcheck.common.verification;

import com.structcheck.common.exception.ExcessiveSlendernessException;
import com.structcheck.common.flexure.CapacityEvaluator;
import com.structcheck.common.flexure.FlexureCheckResult;
import com.structcheck.common.model.CapacityPoint;
import com.structcheck.common.model.DemandPoint;
import com.structcheck.common.model.InteractionCurve;
import com.structcheck.common.slenderness.ReductionPolicy;
import com.structcheck.common.slenderness.SlendernessResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DemandVerifierTest {

    /** φ = 1 curve (M, P): (0, 600) → (60 000, 300) → (72 000, 0) → (0, −400). */
    private static final InteractionCurve CURVE = new InteractionCurve(List.of(
        point(600, 0),
        point(300, 60_000),
        point(0, 72_000),
        point(-400, 0)
    ));

    private static CapacityPoint point(double p, double m) {
        return CapacityPoint.of(p, m, 1.0, 1.0, 0.0);
    }

    /** Slender member, t = 200 mm, Pc = 1000 N (0.75·Pc = 750), buckling factor 0.8. */
    private static SlendernessResult slender(double lambda) {
        return new SlendernessResult(3000, 200, 1.0, 57.7, lambda, true, 22, 1000, 1.0, 1.0, 0.8);
    }

    private static SlendernessResult shortMember() {
        return new SlendernessResult(1000, 200, 1.0, 57.7, 17.3, false, 22, 1000, 1.0, 1.0, 0.9);
    }

    @Test
    @DisplayName("verify(curve, demands) is the plain flexure check")
    void plainWrapper() {
        List<DemandPoint> demands = List.of(new DemandPoint(300, 30_000, "D1"));
        assertEquals(CapacityEvaluator.checkFlexure(CURVE, demands), DemandVerifier.verify(CURVE, demands));
    }

    @Nested
    @DisplayName("MAGNIFY_DEMAND")
    class Magnify {

        @Test
        @DisplayName("compressive demand checked with Mc = δ·max(Mu, M2,min)")
        void magnifiesMoment() {
            // δ = 1 / (1 − 300/750) = 5/3; M2,min = 300·(15 + 6) = 6300 < 30 000
            DemandPoint demand = new DemandPoint(300, 30_000, "D1");
            VerificationResult result = DemandVerifier.verify(CURVE, List.of(demand),
                slender(40), SlendernessMode.MAGNIFY_DEMAND);

            assertEquals(50_000.0, result.flexure().comboResults().get(0).mu(), 1e-6);
            assertEquals(VerificationStatus.OK, result.status());
            assertTrue(result.flexure().safetyFactor()
                < CapacityEvaluator.safetyFactor(CURVE, 300, 30_000).value());
            assertTrue(result.secondOrderLimitExceeded());
            assertTrue(result.unstableCombos().isEmpty());
        }

        @Test
        @DisplayName("minimum moment governs a small first-order moment")
        void minimumMomentGoverns() {
            // M2,min = 150·21 = 3150; δ = 1 / (1 − 150/750) = 1.25
            VerificationResult result = DemandVerifier.verify(CURVE,
                List.of(new DemandPoint(150, 100, "D1")), slender(40), SlendernessMode.MAGNIFY_DEMAND);

            assertEquals(1.25 * 3150, result.flexure().comboResults().get(0).mu(), 1e-6);
        }

        @Test
        @DisplayName("tension demands are not magnified")
        void tensionUnchanged() {
            VerificationResult result = DemandVerifier.verify(CURVE,
                List.of(new DemandPoint(-100, 10_000, "T1")), slender(40), SlendernessMode.MAGNIFY_DEMAND);

            assertEquals(10_000.0, result.flexure().comboResults().get(0).mu());
            assertFalse(result.secondOrderLimitExceeded());
        }

        @Test
        @DisplayName("demand beyond the buckling load → UNSTABLE, not folded into SF")
        void unstable() {
            List<DemandPoint> demands = List.of(
                new DemandPoint(300, 30_000, "D1"),
                new DemandPoint(800, 1_000, "D2"));
            VerificationResult result = DemandVerifier.verify(CURVE, demands,
                slender(40), SlendernessMode.MAGNIFY_DEMAND);

            assertEquals(VerificationStatus.UNSTABLE, result.status());
            assertEquals(List.of("D2"), result.unstableCombos());
            assertEquals(1, result.flexure().comboResults().size());
            assertTrue(Double.isInfinite(result.dcr()));
            assertFalse(result.status().passes());
        }

        @Test
        @DisplayName("λ > 100 is a hard failure here too")
        void rejected() {
            ExcessiveSlendernessException e = assertThrows(ExcessiveSlendernessException.class,
                () -> DemandVerifier.verify(CURVE, List.of(new DemandPoint(100, 1_000, "D1")),
                    slender(120), SlendernessMode.MAGNIFY_DEMAND));
            assertEquals(120.0, e.getLambdaRatio());
        }

        @Test
        @DisplayName("IGNORE skips the λ cap")
        void ignoreSkipsCap() {
            VerificationResult result = DemandVerifier.verify(CURVE,
                List.of(new DemandPoint(100, 1_000, "D1")), slender(120), SlendernessMode.IGNORE);
            assertEquals(SlendernessMode.IGNORE, result.mode());
        }

        @Test
        @DisplayName("short member → first-order check")
        void shortMemberNotMagnified() {
            DemandPoint demand = new DemandPoint(300, 30_000, "D1");
            VerificationResult result = DemandVerifier.verify(CURVE, List.of(demand),
                shortMember(), SlendernessMode.MAGNIFY_DEMAND);

            assertEquals(30_000.0, result.flexure().comboResults().get(0).mu());
            assertEquals(SlendernessMode.MAGNIFY_DEMAND, result.mode());
        }
    }

    @Nested
    @DisplayName("REDUCE_CAPACITY")
    class Reduce {

        @Test
        @DisplayName("compressive side reduced; input curve untouched")
        void reducesCapacity() {
            List<DemandPoint> demands = List.of(new DemandPoint(500, 0, "P1"));

            FlexureCheckResult plain = DemandVerifier.verify(CURVE, demands);
            VerificationResult reduced = DemandVerifier.verify(CURVE, demands,
                slender(40), SlendernessMode.REDUCE_CAPACITY);

            assertEquals(1.2, plain.safetyFactor(), 1e-9);
            assertEquals(0.96, reduced.flexure().safetyFactor(), 1e-9);
            assertEquals(VerificationStatus.NOT_OK, reduced.status());
            assertEquals(ReductionPolicy.EMPIRICAL, reduced.compressionReduction().policy());
            assertEquals(600.0, CURVE.first().pn());
        }

        @Test
        @DisplayName("λ > 100 is a hard failure")
        void rejected() {
            assertThrows(ExcessiveSlendernessException.class, () -> DemandVerifier.verify(CURVE,
                List.of(new DemandPoint(100, 0, "P1")), slender(120), SlendernessMode.REDUCE_CAPACITY));
        }
    }

    @Test
    @DisplayName("no slenderness analysis → IGNORE")
    void noSlenderness() {
        VerificationResult result = DemandVerifier.verify(CURVE,
            List.of(new DemandPoint(300, 30_000, "D1")), null, SlendernessMode.MAGNIFY_DEMAND);

        assertEquals(SlendernessMode.IGNORE, result.mode());
        assertNull(result.slenderness());
        assertEquals(VerificationStatus.OK, result.status());
    }
}
