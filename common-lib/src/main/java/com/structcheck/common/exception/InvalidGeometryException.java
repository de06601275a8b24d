package com.structcheck.common.exception;

/** Non-positive dimension, or a steel layer that does not fit the section. */
public class InvalidGeometryException extends SectionInputException {

    public InvalidGeometryException(String subject, String message) {
        super(subject, message);
    }

    public static InvalidGeometryException nonPositive(String subject, double value) {
        return new InvalidGeometryException(subject, "must be > 0 but was " + value);
    }
}
