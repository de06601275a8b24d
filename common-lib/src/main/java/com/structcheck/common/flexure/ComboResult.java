package com.structcheck.common.flexure;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-combination outcome inside a {@link FlexureCheckResult}.
 */
public record ComboResult(
    @JsonProperty("label")      String label,
    @JsonProperty("Pu")         double pu,
    @JsonProperty("Mu")         double mu,
    @JsonProperty("sf")         double safetyFactor,
    @JsonProperty("dcr")        double dcr,
    @JsonProperty("phiMnAtPu")  double phiMnAtPu,
    @JsonProperty("tension")    boolean tension,
    @JsonProperty("tier")       RayCastTier tier
) {
    public CheckStatus status() {
        return CheckStatus.of(safetyFactor);
    }
}
