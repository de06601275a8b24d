package com.structcheck.common.exception;

/** Non-positive material strength. */
public class InvalidMaterialException extends SectionInputException {

    public InvalidMaterialException(String subject, String message) {
        super(subject, message);
    }

    public static InvalidMaterialException nonPositive(String subject, double value) {
        return new InvalidMaterialException(subject, "must be > 0 MPa but was " + value);
    }
}
