package com.structcheck.common.reinforcement;

import com.structcheck.common.model.SteelLayer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SteelLayerCalculatorTest {

    @Test
    @DisplayName("twoLayer() splits As equally between both faces")
    void twoLayer() {
        List<SteelLayer> layers = SteelLayerCalculator.twoLayer(600, 50, 2000);
        assertEquals(List.of(new SteelLayer(50, 1000), new SteelLayer(550, 1000)), layers);
    }

    @Nested
    @DisplayName("columnLayers()")
    class ColumnLayers {

        @Test
        @DisplayName("three evenly spaced layers")
        void evenlySpaced() {
            List<SteelLayer> layers = SteelLayerCalculator.columnLayers(500, 50, 3, 2, 100);

            assertEquals(3, layers.size());
            assertEquals(50.0, layers.get(0).position(), 1e-12);
            assertEquals(250.0, layers.get(1).position(), 1e-12);
            assertEquals(450.0, layers.get(2).position(), 1e-12);
            assertEquals(200.0, layers.get(1).area());
        }

        @Test
        @DisplayName("single central bar")
        void singleBar() {
            assertEquals(List.of(new SteelLayer(250, 314.2)),
                SteelLayerCalculator.columnLayers(500, 50, 1, 1, 314.2));
        }

        @Test
        @DisplayName("one layer of several bars → no layers")
        void degenerate() {
            assertTrue(SteelLayerCalculator.columnLayers(500, 50, 1, 3, 100).isEmpty());
        }
    }

    @Test
    @DisplayName("wallLayers() puts edge bars at both ends and mesh layers in between")
    void wallLayers() {
        // span 900 at 200 → 5 intervals of 180
        List<SteelLayer> layers = SteelLayerCalculator.wallLayers(1000, 50, 2, 200, 2, 50, 200);

        assertEquals(6, layers.size());
        assertEquals(50.0, layers.get(0).position());
        assertEquals(400.0, layers.get(0).area());
        assertEquals(230.0, layers.get(1).position(), 1e-9);
        assertEquals(100.0, layers.get(1).area());
        assertEquals(950.0, layers.get(5).position());
        assertEquals(1200.0, SteelLayerCalculator.totalArea(layers), 1e-9);
        for (int i = 1; i < layers.size(); i++) {
            assertTrue(layers.get(i).position() > layers.get(i - 1).position());
        }
    }
}
