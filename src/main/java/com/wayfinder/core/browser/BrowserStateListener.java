package com.wayfinder.core.browser;

/**
 * Observer of browser state changes. Listeners must not mutate state.
 */
@FunctionalInterface
public interface BrowserStateListener {

    /**
     * @param previous state before the change ({@code UNINITIALIZED} placeholder if untracked)
     * @param current  state after the change
     */
    void onStateChange(BrowserState previous, BrowserState current);
}
