package com.wayfinder.worker;

import com.wayfinder.core.error.ErrorCode;
import com.wayfinder.core.error.WayfinderException;

/**
 * A worker tool call failed, either in transport or because the worker reported an error.
 */
public class ToolExecutionException extends WayfinderException {

    private final String toolName;

    public ToolExecutionException(String toolName, String message) {
        super(ErrorCode.BROWSER_ACTION_ERROR, message);
        this.toolName = toolName;
    }

    public ToolExecutionException(String toolName, String message, Throwable cause) {
        super(ErrorCode.BROWSER_ACTION_ERROR, message, cause);
        this.toolName = toolName;
    }

    public ToolExecutionException(ErrorCode errorCode, String toolName, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
