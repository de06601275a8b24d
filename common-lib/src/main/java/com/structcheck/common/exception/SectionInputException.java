package com.structcheck.common.exception;

/**
 * Base type for deterministic bad input to the section core.
 *
 * <p>Raised before any curve or slenderness result is produced. Callers map it to a
 * request-level error; retrying with the same input can never succeed.
 */
public class SectionInputException extends RuntimeException {
    private final String subject;

    public SectionInputException(String subject, String message) {
        super("[" + subject + "] " + message);
        this.subject = subject;
    }

    public SectionInputException(String subject, String message, Throwable cause) {
        super("[" + subject + "] " + message, cause);
        this.subject = subject;
    }

    /** Name of the offending input, e.g. {@code "width"} or {@code "fc"}. */
    public String getSubject() {
        return subject;
    }
}
