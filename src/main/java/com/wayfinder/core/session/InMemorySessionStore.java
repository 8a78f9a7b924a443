package com.wayfinder.core.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Process-lifetime session store. A single lock guards the map; callers only ever
 * receive copies, so no reference to stored state escapes the critical section.
 */
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final Map<String, Session> sessions = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private volatile Consumer<Session> evictionListener = s -> { };

    public InMemorySessionStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void onEviction(Consumer<Session> listener) {
        this.evictionListener = listener;
    }

    @Override
    public Optional<Session> get(String sessionId) {
        Session evicted;
        lock.lock();
        try {
            Session session = sessions.get(sessionId);
            if (session == null) {
                return Optional.empty();
            }
            if (!session.isExpired(clock.instant())) {
                return Optional.of(session.copy());
            }
            sessions.remove(sessionId);
            evicted = session;
        } finally {
            lock.unlock();
        }
        log.debug("Evicted expired session {} on access", sessionId);
        evictionListener.accept(evicted);
        return Optional.empty();
    }

    @Override
    public void save(Session session) {
        lock.lock();
        try {
            sessions.put(session.getId(), session.copy());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String sessionId) {
        lock.lock();
        try {
            return sessions.remove(sessionId) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Session> listActive() {
        lock.lock();
        try {
            var now = clock.instant();
            var active = new ArrayList<Session>();
            for (Session session : sessions.values()) {
                if (session.isActive(now)) {
                    active.add(session.copy());
                }
            }
            return active;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Session> removeExpired() {
        lock.lock();
        try {
            var now = clock.instant();
            var removed = new ArrayList<Session>();
            Iterator<Session> it = sessions.values().iterator();
            while (it.hasNext()) {
                Session session = it.next();
                if (session.isExpired(now)) {
                    removed.add(session);
                    it.remove();
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }
}
