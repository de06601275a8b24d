package com.structcheck.verification.model;

/** Whether a member report carries a verification result. */
public enum ReportStatus {
    VERIFIED,
    /** The member's behavior needs no P-M check. */
    SKIPPED,
    /** Input could not be verified; the message says why. */
    FAILED
}
