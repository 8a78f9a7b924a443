package com.wayfinder.core.browser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide record of each session's browser worker lifecycle.
 * <p>
 * Updates are applied under a single lock and listeners are notified after the lock
 * is released, so a slow or failing listener never holds up other sessions.
 * Transitions that would break the lifecycle order in {@link BrowserStatus} are
 * rejected and leave the state untouched.
 */
@Service
public class BrowserStateManager {

    private static final Logger log = LoggerFactory.getLogger(BrowserStateManager.class);

    private final Map<String, BrowserState> states = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final CopyOnWriteArrayList<BrowserStateListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public BrowserStateManager(Clock clock) {
        this.clock = clock;
    }

    /**
     * Applies the supplied fields and notifies listeners.
     *
     * @return the state after the update (unchanged if the transition was rejected)
     */
    public BrowserState update(String sessionId, BrowserStateUpdate update) {
        BrowserState previous;
        BrowserState next;
        lock.lock();
        try {
            var now = clock.instant();
            previous = states.getOrDefault(sessionId, BrowserState.initial(sessionId, now));
            BrowserStatus requested = update.getStatus();
            if (requested != null && !previous.status().canTransitionTo(requested)) {
                log.warn("Rejected browser transition {} -> {} for session {}",
                        previous.status(), requested, sessionId);
                return previous;
            }
            next = update.applyTo(previous, now);
            states.put(sessionId, next);
        } finally {
            lock.unlock();
        }
        if (previous.status() != next.status()) {
            log.info("Browser for session {}: {} -> {}", sessionId, previous.status(), next.status());
        }
        notifyListeners(previous, next);
        return next;
    }

    /**
     * Marks the worker {@link BrowserStatus#CLOSED} and stops tracking it.
     */
    public void remove(String sessionId) {
        BrowserState previous;
        BrowserState closed;
        lock.lock();
        try {
            previous = states.remove(sessionId);
            if (previous == null) {
                return;
            }
            closed = BrowserStateUpdate.status(BrowserStatus.CLOSED).applyTo(previous, clock.instant());
        } finally {
            lock.unlock();
        }
        notifyListeners(previous, closed);
    }

    public Optional<BrowserState> get(String sessionId) {
        lock.lock();
        try {
            return Optional.ofNullable(states.get(sessionId));
        } finally {
            lock.unlock();
        }
    }

    public List<BrowserState> getAll() {
        lock.lock();
        try {
            return new ArrayList<>(states.values());
        } finally {
            lock.unlock();
        }
    }

    /** Sessions whose worker is currently {@code INITIALIZED} or {@code NAVIGATING}. */
    public List<String> listActive() {
        var active = new ArrayList<String>();
        for (BrowserState state : getAll()) {
            if (state.status().isActive()) {
                active.add(state.sessionId());
            }
        }
        return active;
    }

    public Subscription subscribe(BrowserStateListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Handle for cancelling a listener registration.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void notifyListeners(BrowserState previous, BrowserState current) {
        for (BrowserStateListener listener : listeners) {
            try {
                listener.onStateChange(previous, current);
            } catch (Exception e) {
                log.warn("Browser state listener failed for session {}: {}",
                        current.sessionId(), e.getMessage(), e);
            }
        }
    }
}
