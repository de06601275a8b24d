package com.structcheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Demand of one load combination on one bending axis.
 *
 * @param pu    factored axial force (N), + = compression
 * @param mu    factored moment magnitude (N·mm); stored as an absolute value
 * @param label combination label
 */
public record DemandPoint(
    @JsonProperty("Pu")    double pu,
    @JsonProperty("Mu")    double mu,
    @JsonProperty("label") String label
) {
    public DemandPoint {
        mu = Math.abs(mu);
    }

    public boolean isTension() {
        return pu < 0;
    }

    public DemandPoint withMoment(double newMu) {
        return new DemandPoint(pu, newMu, label);
    }
}
