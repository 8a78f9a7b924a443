package com.wayfinder.core.error;

/**
 * Base for failures that carry a stable {@link ErrorCode}.
 */
public class WayfinderException extends RuntimeException {

    private final ErrorCode errorCode;

    public WayfinderException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public WayfinderException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
