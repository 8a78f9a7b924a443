package com.wayfinder.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Fan-out of {@link ThoughtEvent}s to the listeners of one session and to listeners of all sessions.
 * <p>
 * {@link #emit} only hands the event to the dispatch {@link Executor}; listeners run there, in
 * emission order when the executor is single-threaded. An event the executor refuses (queue full,
 * or shut down) is dropped and counted. A listener that throws is logged and skipped; the other
 * listeners still receive the event.
 */
public class ThoughtEventBus {

    private static final Logger log = LoggerFactory.getLogger(ThoughtEventBus.class);

    private final Executor dispatcher;
    private final Map<String, List<Consumer<ThoughtEvent>>> listenersBySession = new ConcurrentHashMap<>();
    private final List<Consumer<ThoughtEvent>> allSessionListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong dropped = new AtomicLong();

    /**
     * @param dispatcher runs listener callbacks; {@code Runnable::run} delivers on the emitting thread
     */
    public ThoughtEventBus(Executor dispatcher) {
        this.dispatcher = dispatcher;
    }

    public void emit(ThoughtEvent event) {
        if (event == null) {
            return;
        }
        List<Consumer<ThoughtEvent>> targets = targetsOf(event);
        if (targets.isEmpty()) {
            return;
        }
        try {
            dispatcher.execute(() -> targets.forEach(listener -> deliver(listener, event)));
        } catch (RejectedExecutionException e) {
            long total = dropped.incrementAndGet();
            log.warn("Dropped {} event for session {} ({} dropped so far): {}",
                    event.type(), event.sessionId(), total, e.getMessage());
        }
    }

    public void emit(String sessionId, String type, String category, String node, String content) {
        emit(ThoughtEvent.of(sessionId, type, category, node, content));
    }

    public void emit(String sessionId, String type, String category, String node, String content,
                     Map<String, Object> technicalDetails) {
        emit(ThoughtEvent.of(sessionId, type, category, node, content, technicalDetails));
    }

    /** Listens to one session's events until the returned handle is cancelled. */
    public Subscription subscribe(String sessionId, Consumer<ThoughtEvent> listener) {
        listenersBySession.compute(sessionId, (id, listeners) -> {
            List<Consumer<ThoughtEvent>> current = listeners != null ? listeners : new CopyOnWriteArrayList<>();
            current.add(listener);
            return current;
        });
        return () -> listenersBySession.computeIfPresent(sessionId, (id, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    /** Listens to every session's events. */
    public Subscription subscribeAll(Consumer<ThoughtEvent> listener) {
        allSessionListeners.add(listener);
        return () -> allSessionListeners.remove(listener);
    }

    /** Forgets the listeners of a session that has ended. */
    public void clearSession(String sessionId) {
        listenersBySession.remove(sessionId);
    }

    public long droppedCount() {
        return dropped.get();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    /** Listeners are snapshotted at emit time, so later (un)subscribes do not affect queued events. */
    private List<Consumer<ThoughtEvent>> targetsOf(ThoughtEvent event) {
        List<Consumer<ThoughtEvent>> sessionListeners = event.sessionId() != null
                ? listenersBySession.getOrDefault(event.sessionId(), List.of())
                : List.of();
        if (sessionListeners.isEmpty()) {
            return List.copyOf(allSessionListeners);
        }
        List<Consumer<ThoughtEvent>> targets = new ArrayList<>(sessionListeners);
        targets.addAll(allSessionListeners);
        return targets;
    }

    private static void deliver(Consumer<ThoughtEvent> listener, ThoughtEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} event for session {}: {}",
                    event.type(), event.sessionId(), e.getMessage(), e);
        }
    }
}
