package com.wayfinder.core.conversation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Conversation logs held in memory, dropped after {@code ttl} without access.
 */
public class InMemoryConversationStore implements ConversationStore {

    private final Map<String, Log> logs = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final Duration ttl;

    public InMemoryConversationStore(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public boolean exists(String sessionId) {
        lock.lock();
        try {
            return logs.containsKey(sessionId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ConversationEntry> load(String sessionId) {
        lock.lock();
        try {
            Log log = logs.get(sessionId);
            if (log == null) {
                return List.of();
            }
            log.lastAccess = clock.instant();
            return List.copyOf(log.entries);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void append(String sessionId, ConversationEntry entry) {
        lock.lock();
        try {
            Log log = logs.computeIfAbsent(sessionId, k -> new Log());
            log.entries.add(entry);
            log.lastAccess = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void create(String sessionId) {
        lock.lock();
        try {
            logs.computeIfAbsent(sessionId, k -> new Log()).lastAccess = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String sessionId) {
        lock.lock();
        try {
            return logs.remove(sessionId) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int cleanupExpired() {
        lock.lock();
        try {
            Instant cutoff = clock.instant().minus(ttl);
            int before = logs.size();
            logs.values().removeIf(log -> log.lastAccess.isBefore(cutoff));
            return before - logs.size();
        } finally {
            lock.unlock();
        }
    }

    private final class Log {
        final List<ConversationEntry> entries = new ArrayList<>();
        Instant lastAccess = clock.instant();
    }
}
