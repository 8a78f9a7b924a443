package com.wayfinder.worker;

import com.wayfinder.core.error.ErrorCode;
import com.wayfinder.core.error.WayfinderException;

/**
 * No usable worker for a session: the launch failed, the connection is gone,
 * or the worker pool is full.
 */
public class WorkerUnavailableException extends WayfinderException {

    public WorkerUnavailableException(String message) {
        super(ErrorCode.BROWSER_CONNECTION_ERROR, message);
    }

    public WorkerUnavailableException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
