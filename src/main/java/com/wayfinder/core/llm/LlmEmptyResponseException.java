package com.wayfinder.core.llm;

import com.wayfinder.core.error.ErrorCode;
import com.wayfinder.core.error.WayfinderException;

/**
 * Thrown when the LLM returns neither text nor tool calls.
 */
public class LlmEmptyResponseException extends WayfinderException {

    public LlmEmptyResponseException(String message) {
        super(ErrorCode.SERVICE_UNAVAILABLE, message);
    }
}
