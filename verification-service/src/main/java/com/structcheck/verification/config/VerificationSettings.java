package com.structcheck.verification.config;

import com.structcheck.common.verification.SlendernessMode;

/**
 * Tunables of the verification service.
 *
 * @param samplePoints     neutral-axis samples per interaction curve
 * @param defaultMode      slenderness mode for members that do not set one
 * @param batchParallelism members verified concurrently in a batch
 */
public record VerificationSettings(
    int samplePoints,
    SlendernessMode defaultMode,
    int batchParallelism
) {
    public static VerificationSettings defaults() {
        return new VerificationSettings(50, SlendernessMode.MAGNIFY_DEMAND, 4);
    }
}
