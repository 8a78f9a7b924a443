package com.wayfinder.core.session;

/**
 * A component that owns resources tagged on sessions (e.g. {@code browser:<id>})
 * and knows how to release them when the session ends.
 */
@FunctionalInterface
public interface SessionResourceManager {

    void cleanupResource(String resourceTag, String sessionId);
}
