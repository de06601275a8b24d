package com.structcheck.common.material;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** Nominal areas (mm²) of standard metric reinforcing bars keyed by diameter (mm). */
public final class BarAreas {

    private static final Map<Integer, Double> AREAS;

    static {
        Map<Integer, Double> areas = new TreeMap<>();
        areas.put(6, 28.3);
        areas.put(8, 50.3);
        areas.put(10, 78.5);
        areas.put(12, 113.1);
        areas.put(16, 201.1);
        areas.put(18, 254.5);
        areas.put(20, 314.2);
        areas.put(22, 380.1);
        areas.put(25, 490.9);
        areas.put(28, 615.8);
        areas.put(32, 804.2);
        areas.put(36, 1017.9);
        AREAS = Collections.unmodifiableMap(areas);
    }

    private BarAreas() {}

    /**
     * Area of a standard bar, or π·d²/4 for a diameter outside the table.
     */
    public static double of(int diameter) {
        Double area = AREAS.get(diameter);
        if (area != null) return area;
        return Math.PI * diameter * diameter / 4.0;
    }

    public static Map<Integer, Double> all() {
        return AREAS;
    }
}
