package com.wayfinder.core.conversation;

import java.util.List;

/**
 * Append-only, per-session conversation log storage.
 */
public interface ConversationStore {

    boolean exists(String sessionId);

    /** Full log for the session, oldest first; empty if unknown. */
    List<ConversationEntry> load(String sessionId);

    void append(String sessionId, ConversationEntry entry);

    /** Creates an empty log if none exists. */
    void create(String sessionId);

    boolean delete(String sessionId);

    /**
     * Drops logs that have not been touched within the store's retention window.
     *
     * @return number of logs removed
     */
    int cleanupExpired();
}
