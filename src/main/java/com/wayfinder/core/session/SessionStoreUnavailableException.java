package com.wayfinder.core.session;

import com.wayfinder.core.error.ErrorCode;
import com.wayfinder.core.error.WayfinderException;

/**
 * Thrown when the session store keeps failing after one retry.
 */
public class SessionStoreUnavailableException extends WayfinderException {

    public SessionStoreUnavailableException(String message, Throwable cause) {
        super(ErrorCode.SERVICE_UNAVAILABLE, message, cause);
    }
}
