package com.realestate.spatial.domain.exception;

/**
 * Malformed caller input: buffer out of range, bad geometry text, conflicting
 * or missing search predicate.
 */
public class SpatialValidationException extends IllegalArgumentException {

    public SpatialValidationException(String message) {
        super(message);
    }

    public SpatialValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
