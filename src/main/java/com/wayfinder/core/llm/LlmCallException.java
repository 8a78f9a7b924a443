package com.wayfinder.core.llm;

import com.wayfinder.core.error.ErrorCode;
import com.wayfinder.core.error.WayfinderException;

/**
 * Thrown when the model provider call fails.
 */
public class LlmCallException extends WayfinderException {

    private final boolean retryable;

    public LlmCallException(String message, Throwable cause, boolean retryable) {
        super(ErrorCode.SERVICE_UNAVAILABLE, message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
