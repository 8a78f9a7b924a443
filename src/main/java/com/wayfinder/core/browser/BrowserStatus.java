package com.wayfinder.core.browser;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one session's browser worker.
 * <pre>
 * UNINITIALIZED -> INITIALIZING -> INITIALIZED <-> NAVIGATING
 * any non-closed -> ERROR, any -> CLOSING -> CLOSED
 * ERROR | CLOSED -> INITIALIZING (new worker generation)
 * </pre>
 */
public enum BrowserStatus {
    UNINITIALIZED,
    INITIALIZING,
    INITIALIZED,
    NAVIGATING,
    ERROR,
    CLOSING,
    CLOSED;

    public boolean isActive() {
        return this == INITIALIZED || this == NAVIGATING;
    }

    public boolean canTransitionTo(BrowserStatus next) {
        if (next == this || next == CLOSED) {
            return true;
        }
        return allowedTargets().contains(next);
    }

    private Set<BrowserStatus> allowedTargets() {
        return switch (this) {
            case UNINITIALIZED -> EnumSet.of(INITIALIZING, ERROR, CLOSING);
            case INITIALIZING -> EnumSet.of(INITIALIZED, ERROR, CLOSING);
            case INITIALIZED -> EnumSet.of(NAVIGATING, ERROR, CLOSING);
            case NAVIGATING -> EnumSet.of(INITIALIZED, ERROR, CLOSING);
            case ERROR -> EnumSet.of(INITIALIZING, CLOSING);
            case CLOSING -> EnumSet.of(ERROR);
            case CLOSED -> EnumSet.of(INITIALIZING);
        };
    }
}
