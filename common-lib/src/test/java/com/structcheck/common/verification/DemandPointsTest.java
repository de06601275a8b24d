package com.structcheck.common.verification;

import com.structcheck.common.model.DemandPoint;
import com.structcheck.common.model.LoadCombination;
import com.structcheck.common.model.MomentAxis;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DemandPointsTest {

    private static final List<LoadCombination> COMBOS = List.of(
        new LoadCombination("1.2D+1.6L", "Top", -500, 30, -40),
        new LoadCombination("0.9D+E", "", 200, 0, 10));

    @Test
    @DisplayName("axial sign flipped to compression-positive, labels built from location")
    void convertsCombinations() {
        List<DemandPoint> demands = DemandPoints.from(COMBOS, MomentAxis.M3);

        assertEquals(500.0, demands.get(0).pu());
        assertEquals(40.0, demands.get(0).mu());
        assertEquals("1.2D+1.6L (Top)", demands.get(0).label());
        assertEquals(-200.0, demands.get(1).pu());
        assertTrue(demands.get(1).isTension());
        assertEquals("0.9D+E", demands.get(1).label());
    }

    @Test
    @DisplayName("moment per axis")
    void axes() {
        assertEquals(30.0, DemandPoints.from(COMBOS, MomentAxis.M2).get(0).mu());
        assertEquals(50.0, DemandPoints.from(COMBOS, MomentAxis.SRSS).get(0).mu(), 1e-12);
        assertEquals(30.0, DemandPoints.from(COMBOS, MomentAxis.COMBINED, 90.0).get(0).mu(), 1e-9);
    }
}
