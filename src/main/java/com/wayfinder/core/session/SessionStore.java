package com.wayfinder.core.session;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Keyed persistence for {@link Session} records.
 * <p>
 * Implementations are TTL-aware: {@link #get} never returns an expired session and
 * evicts it lazily instead. I/O failures surface as {@link java.io.UncheckedIOException}.
 */
public interface SessionStore {

    Optional<Session> get(String sessionId);

    void save(Session session);

    boolean delete(String sessionId);

    /** Sessions that are {@link SessionState#ACTIVE} and not past their expiry. */
    List<Session> listActive();

    /**
     * Removes every expired session.
     *
     * @return the removed sessions, so their resources can still be released
     */
    List<Session> removeExpired();

    /**
     * Registers a callback for sessions evicted lazily by {@link #get}, so that
     * resources they still hold are not leaked.
     */
    void onEviction(Consumer<Session> listener);
}
