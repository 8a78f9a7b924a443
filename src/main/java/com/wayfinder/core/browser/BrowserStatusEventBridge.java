package com.wayfinder.core.browser;

import com.wayfinder.core.events.ThoughtEventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Republishes browser status changes as {@code browser_status} thought events for the UI.
 */
@Component
public class BrowserStatusEventBridge implements BrowserStateListener {

    private final BrowserStateManager stateManager;
    private final ThoughtEventBus eventBus;
    private BrowserStateManager.Subscription subscription;

    public BrowserStatusEventBridge(BrowserStateManager stateManager, ThoughtEventBus eventBus) {
        this.stateManager = stateManager;
        this.eventBus = eventBus;
    }

    @PostConstruct
    void register() {
        subscription = stateManager.subscribe(this);
    }

    @PreDestroy
    void unregister() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
    }

    @Override
    public void onStateChange(BrowserState previous, BrowserState current) {
        if (previous.status() == current.status()) {
            return;
        }
        Map<String, Object> details = new HashMap<>();
        details.put("status", current.status().name().toLowerCase());
        details.put("previous_status", previous.status().name().toLowerCase());
        details.put("current_url", current.currentUrl() != null ? current.currentUrl() : "");
        details.put("headless", current.headless());
        if (current.errorMessage() != null) {
            details.put("error", current.errorMessage());
        }
        eventBus.emit(current.sessionId(), "browser_status", "status", "Browser",
                describe(current), details);
    }

    private static String describe(BrowserState state) {
        return switch (state.status()) {
            case INITIALIZING -> "Initializing browser...";
            case INITIALIZED -> "Browser ready" + (isBlank(state.currentUrl()) ? "" : " at " + state.currentUrl());
            case NAVIGATING -> "Browsing " + state.currentUrl();
            case ERROR -> "Browser error: " + state.errorMessage();
            case CLOSING -> "Closing browser...";
            case CLOSED -> "Browser closed";
            case UNINITIALIZED -> "Browser not started";
        };
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
