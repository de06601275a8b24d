package com.structcheck.common.verification;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.structcheck.common.flexure.FlexureCheckResult;
import com.structcheck.common.slenderness.CompressionReduction;
import com.structcheck.common.slenderness.SlendernessResult;

import java.util.List;

/**
 * Flexocompression check of one member on one axis, including slenderness effects.
 *
 * @param flexure                  check of the stable demands against the (possibly reduced) curve
 * @param status                   UNSTABLE overrides the flexure outcome
 * @param slenderness              slenderness analysis, null when none was supplied
 * @param mode                     how slenderness was applied
 * @param compressionReduction     applied reduction in REDUCE_CAPACITY mode, else null
 * @param unstableCombos           labels of demands at or above 0.75·Pc
 * @param secondOrderLimitExceeded some magnified moment exceeded 1.4 × its first-order value
 */
public record VerificationResult(
    @JsonProperty("flexure")                  FlexureCheckResult flexure,
    @JsonProperty("status")                   VerificationStatus status,
    @JsonProperty("slenderness")              SlendernessResult slenderness,
    @JsonProperty("mode")                     SlendernessMode mode,
    @JsonProperty("compressionReduction")     CompressionReduction compressionReduction,
    @JsonProperty("unstableCombos")           List<String> unstableCombos,
    @JsonProperty("secondOrderLimitExceeded") boolean secondOrderLimitExceeded
) {
    public VerificationResult {
        unstableCombos = unstableCombos == null ? List.of() : List.copyOf(unstableCombos);
    }

    /** 1/SF of the governing demand; +∞ for an unstable member. */
    @JsonProperty("dcr")
    public double dcr() {
        return status == VerificationStatus.UNSTABLE ? Double.POSITIVE_INFINITY : flexure.dcr();
    }

    public double safetyFactor() {
        return status == VerificationStatus.UNSTABLE ? 0.0 : flexure.safetyFactor();
    }
}
