package com.structcheck.verification.behavior;

import com.structcheck.common.slenderness.StiffnessCategory;
import com.structcheck.verification.MemberFixtures;
import com.structcheck.verification.model.MemberDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DesignBehaviorResolverTest {

    private final ElementClassifier classifier = new ElementClassifier();
    private final DesignBehaviorResolver resolver = new DesignBehaviorResolver();

    private ResolvedBehavior resolve(MemberDefinition member) {
        return resolver.resolve(classifier.classify(member), member);
    }

    @Nested
    @DisplayName("pier classification")
    class PierClassification {

        @Test
        @DisplayName("lw/tw < 4 → seismic column")
        void columnProportioned() {
            assertEquals(ElementType.COLUMN_SEISMIC, classifier.classifyPier(600, 200, 3000));
        }

        @Test
        @DisplayName("hw/lw ≥ 2 → wall")
        void slenderWall() {
            assertEquals(ElementType.WALL, classifier.classifyPier(3000, 200, 9000));
        }

        @Test
        @DisplayName("hw/lw < 2 and 4 ≤ lw/tw ≤ 6 → wall pier, alternate method")
        void wallPier() {
            assertEquals(ElementType.WALL_PIER_ALTERNATE, classifier.classifyPier(1000, 200, 1000));
        }

        @Test
        @DisplayName("hw/lw < 2 and lw/tw > 6 → squat wall")
        void squat() {
            assertEquals(ElementType.WALL_SQUAT, classifier.classifyPier(3000, 200, 3000));
        }
    }

    @Nested
    @DisplayName("beams")
    class Beams {

        // Ag·f'c/10 = 300·600·25/10 = 450 000 N

        @Test
        @DisplayName("seismic beam with Pu > Ag·f'c/10 → beam-column")
        void seismicBeamColumn() {
            ResolvedBehavior resolved = resolve(MemberFixtures.beam("B1", true, -500_000));
            assertEquals(DesignBehavior.SEISMIC_BEAM_COLUMN, resolved.behavior());
            assertTrue(resolved.significantAxial());
            assertTrue(resolved.requiresPmDiagram());
            assertTrue(resolved.behavior().requiresColumnChecks());
            assertFalse(resolved.slendernessApplies());
        }

        @Test
        @DisplayName("non-seismic beam with significant axial → flexure-compression")
        void nonSeismicWithAxial() {
            assertEquals(DesignBehavior.FLEXURE_COMPRESSION,
                resolve(MemberFixtures.beam("B2", false, 500_000)).behavior());
        }

        @Test
        @DisplayName("axial exactly at the threshold is not significant")
        void atThreshold() {
            ResolvedBehavior resolved = resolve(MemberFixtures.beam("B3", true, -450_000));
            assertEquals(DesignBehavior.SEISMIC_BEAM, resolved.behavior());
            assertFalse(resolved.requiresPmDiagram());
        }

        @Test
        @DisplayName("non-seismic beam without axial → flexure only")
        void flexureOnly() {
            ResolvedBehavior resolved = resolve(MemberFixtures.beam("B4", false, 0));
            assertEquals(DesignBehavior.FLEXURE_ONLY, resolved.behavior());
            assertEquals(StiffnessCategory.BEAM, resolved.stiffnessCategory());
        }
    }

    @Nested
    @DisplayName("vertical elements")
    class Vertical {

        @Test
        @DisplayName("squat wall → seismic wall, cracked stiffness, k = 0.8")
        void wall() {
            ResolvedBehavior resolved = resolve(MemberFixtures.squatWall("W1"));
            assertEquals(ElementType.WALL_SQUAT, resolved.elementType());
            assertEquals(DesignBehavior.SEISMIC_WALL, resolved.behavior());
            assertEquals(StiffnessCategory.CRACKED_WALL, resolved.stiffnessCategory());
            assertEquals(0.8, resolved.defaultK());
            assertTrue(resolved.slendernessApplies());
            assertTrue(resolved.behavior().requiresWallChecks());
        }

        @Test
        @DisplayName("non-seismic column → flexure-compression, column stiffness, k = 1")
        void column() {
            ResolvedBehavior resolved = resolve(MemberFixtures.tallColumn("C1"));
            assertEquals(DesignBehavior.FLEXURE_COMPRESSION, resolved.behavior());
            assertEquals(StiffnessCategory.COLUMN, resolved.stiffnessCategory());
            assertEquals(1.0, resolved.defaultK());
            assertFalse(resolved.behavior().requiresSeismicChecks());
        }
    }
}
