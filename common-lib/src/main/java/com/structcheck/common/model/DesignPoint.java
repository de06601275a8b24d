package com.structcheck.common.model;

/**
 * A (φMn, φPn) pair on the design capacity boundary; the plotting coordinates.
 */
public record DesignPoint(double moment, double axial) {

    public double distanceFromOrigin() {
        return Math.hypot(moment, axial);
    }
}
