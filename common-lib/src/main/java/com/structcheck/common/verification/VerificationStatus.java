package com.structcheck.common.verification;

import com.structcheck.common.flexure.CheckStatus;

/**
 * Outcome of a member check. {@link #UNSTABLE} means at least one demand exceeded the
 * buckling load: no finite safety factor describes it.
 */
public enum VerificationStatus {
    OK,
    NOT_OK,
    UNSTABLE;

    public static VerificationStatus of(CheckStatus status) {
        return status == CheckStatus.OK ? OK : NOT_OK;
    }

    public boolean passes() {
        return this == OK;
    }
}
