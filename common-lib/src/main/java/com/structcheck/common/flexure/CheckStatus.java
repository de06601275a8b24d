package com.structcheck.common.flexure;

/** Outcome of a flexocompression check: OK iff the governing SF is at least 1.0. */
public enum CheckStatus {
    OK("OK"),
    NOT_OK("NO OK");

    private final String label;

    CheckStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static CheckStatus of(double safetyFactor) {
        return safetyFactor >= 1.0 ? OK : NOT_OK;
    }
}
