package com.wayfinder.core.session;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One {@link ReentrantLock} per session id, held only while someone uses it.
 * <p>
 * A lock is dropped from the table on the release that leaves it idle, so the table
 * only ever holds sessions with a caller inside or waiting. A caller that wins a lock
 * which has meanwhile been dropped retries with the current one, which keeps at most
 * one holder per session.
 */
public final class SessionLocks {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final boolean fair;

    public SessionLocks(boolean fair) {
        this.fair = fair;
    }

    /** Blocks until the session's lock is held; pass the result to {@link #release}. */
    public ReentrantLock acquire(String sessionId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(sessionId, id -> new ReentrantLock(fair));
            lock.lock();
            if (locks.get(sessionId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    public void release(String sessionId, ReentrantLock lock) {
        lock.unlock();
        locks.computeIfPresent(sessionId,
                (id, current) -> current == lock && !current.isLocked() && !current.hasQueuedThreads() ? null : current);
    }

    public int size() {
        return locks.size();
    }
}
