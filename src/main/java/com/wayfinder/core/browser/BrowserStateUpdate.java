package com.wayfinder.core.browser;

import java.time.Instant;

/**
 * Partial update for a {@link BrowserState}. Fields left {@code null} are not touched.
 */
public final class BrowserStateUpdate {

    private BrowserStatus status;
    private String currentUrl;
    private String pageTitle;
    private String errorMessage;
    private Boolean hasScreenshot;
    private Boolean headless;

    private BrowserStateUpdate() {}

    public static BrowserStateUpdate status(BrowserStatus status) {
        var update = new BrowserStateUpdate();
        update.status = status;
        return update;
    }

    public static BrowserStateUpdate fields() {
        return new BrowserStateUpdate();
    }

    public BrowserStateUpdate currentUrl(String currentUrl) {
        this.currentUrl = currentUrl;
        return this;
    }

    public BrowserStateUpdate pageTitle(String pageTitle) {
        this.pageTitle = pageTitle;
        return this;
    }

    public BrowserStateUpdate errorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
        return this;
    }

    public BrowserStateUpdate hasScreenshot(boolean hasScreenshot) {
        this.hasScreenshot = hasScreenshot;
        return this;
    }

    public BrowserStateUpdate headless(boolean headless) {
        this.headless = headless;
        return this;
    }

    BrowserState applyTo(BrowserState current, Instant now) {
        BrowserStatus nextStatus = status != null ? status : current.status();
        var initializedAt = current.initializedAt();
        var previousError = current.errorMessage();
        if (nextStatus == BrowserStatus.INITIALIZING && current.status() != BrowserStatus.INITIALIZING) {
            // new worker generation
            initializedAt = null;
            previousError = null;
        } else if (nextStatus == BrowserStatus.INITIALIZED && initializedAt == null) {
            initializedAt = now;
        }
        return new BrowserState(
                current.sessionId(),
                nextStatus,
                currentUrl != null ? currentUrl : current.currentUrl(),
                pageTitle != null ? pageTitle : current.pageTitle(),
                errorMessage != null ? errorMessage : previousError,
                hasScreenshot != null ? hasScreenshot : current.hasScreenshot(),
                headless != null ? headless : current.headless(),
                initializedAt,
                now);
    }

    BrowserStatus getStatus() {
        return status;
    }
}
