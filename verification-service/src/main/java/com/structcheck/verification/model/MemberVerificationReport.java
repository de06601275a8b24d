package com.structcheck.verification.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.structcheck.common.model.InteractionCurve;
import com.structcheck.common.verification.VerificationResult;
import com.structcheck.verification.behavior.ResolvedBehavior;

/**
 * Outcome of verifying one member.
 *
 * @param behavior         null when the member failed before it was resolved
 * @param result           null unless {@code status} is VERIFIED
 * @param curveFingerprint SHA-256 of the curve key, null unless a curve was built
 * @param curve            curve the demands were checked against; not serialized
 * @param message          reason for SKIPPED or FAILED
 */
public record MemberVerificationReport(
    @JsonProperty("memberId")         String memberId,
    @JsonProperty("status")           ReportStatus status,
    @JsonProperty("behavior")         ResolvedBehavior behavior,
    @JsonProperty("result")           VerificationResult result,
    @JsonProperty("curveFingerprint") String curveFingerprint,
    @JsonIgnore                       InteractionCurve curve,
    @JsonProperty("message")          String message
) {
    public static MemberVerificationReport verified(String memberId, ResolvedBehavior behavior,
                                                    VerificationResult result, String fingerprint,
                                                    InteractionCurve curve) {
        return new MemberVerificationReport(memberId, ReportStatus.VERIFIED, behavior, result,
            fingerprint, curve, null);
    }

    public static MemberVerificationReport skipped(String memberId, ResolvedBehavior behavior) {
        return new MemberVerificationReport(memberId, ReportStatus.SKIPPED, behavior, null, null, null,
            "behavior " + behavior.behavior() + " needs no P-M check");
    }

    public static MemberVerificationReport failed(String memberId, String message) {
        return new MemberVerificationReport(memberId, ReportStatus.FAILED, null, null, null, null, message);
    }

    @JsonIgnore
    public boolean passes() {
        return status == ReportStatus.VERIFIED && result.status().passes();
    }
}
