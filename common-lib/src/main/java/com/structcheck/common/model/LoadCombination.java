package com.structcheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Forces of one load combination at one station of an element, as delivered by
 * the analysis-model provider.
 *
 * <p>Provider sign convention: {@code p} positive = tension. Forces in N, moments in N·mm.
 */
public record LoadCombination(
    @JsonProperty("name")     String name,
    @JsonProperty("location") String location,
    @JsonProperty("P")        double p,
    @JsonProperty("M2")       double m2,
    @JsonProperty("M3")       double m3
) {
    /** Axial force with compression positive. */
    public double compressionAxial() {
        return -p;
    }

    /** Moment-plane angle in degrees, 0° = pure M3, 90° = pure M2. */
    public double momentAngleDeg() {
        if (Math.abs(m2) < 1e-10 && Math.abs(m3) < 1e-10) return 0.0;
        return Math.toDegrees(Math.atan2(Math.abs(m2), Math.abs(m3)));
    }

    public double momentResultant() {
        return Math.hypot(m2, m3);
    }

    public String label() {
        return location == null || location.isBlank() ? name : name + " (" + location + ")";
    }
}
