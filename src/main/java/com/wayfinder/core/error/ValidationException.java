package com.wayfinder.core.error;

/**
 * Thrown when a request has the wrong shape. Never retried.
 */
public class ValidationException extends WayfinderException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
