package com.wayfinder.core.browser;

import java.time.Instant;

/**
 * Snapshot of a session's browser worker as last recorded by {@link BrowserStateManager}.
 */
public record BrowserState(
    String sessionId,
    BrowserStatus status,
    String currentUrl,
    String pageTitle,
    String errorMessage,
    boolean hasScreenshot,
    boolean headless,
    Instant initializedAt,
    Instant lastUpdated
) {

    static BrowserState initial(String sessionId, Instant now) {
        return new BrowserState(sessionId, BrowserStatus.UNINITIALIZED, "", "", null,
                false, true, null, now);
    }
}
