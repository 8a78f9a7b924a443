package com.wayfinder.core.session;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A client's logical conversation and resource scope.
 * <p>
 * Instances handed out by a {@link SessionStore} are copies; mutate and {@code save} to persist.
 */
public class Session {

    private String id;
    private Instant createdAt;
    private Instant lastAccessed;
    private Instant expiresAt;
    private SessionState state = SessionState.ACTIVE;
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private Set<String> resources = new LinkedHashSet<>();

    public Session() {}

    public static Session create(Duration ttl, Instant now) {
        var session = new Session();
        session.id = UUID.randomUUID().toString();
        session.createdAt = now;
        session.lastAccessed = now;
        session.expiresAt = now.plus(ttl);
        return session;
    }

    public boolean isExpired(Instant now) {
        return state == SessionState.EXPIRED || now.isAfter(expiresAt);
    }

    public boolean isActive(Instant now) {
        return state == SessionState.ACTIVE && !isExpired(now);
    }

    /**
     * Slides the expiry window forward. An expired session becomes active again;
     * a terminated one stays terminated.
     */
    public void refresh(Duration ttl, Instant now) {
        lastAccessed = now;
        expiresAt = now.plus(ttl);
        if (state == SessionState.EXPIRED) {
            state = SessionState.ACTIVE;
        }
    }

    public Session copy() {
        var copy = new Session();
        copy.id = id;
        copy.createdAt = createdAt;
        copy.lastAccessed = lastAccessed;
        copy.expiresAt = expiresAt;
        copy.state = state;
        copy.metadata = new LinkedHashMap<>(metadata);
        copy.resources = new LinkedHashSet<>(resources);
        return copy;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getLastAccessed() { return lastAccessed; }
    public void setLastAccessed(Instant lastAccessed) { this.lastAccessed = lastAccessed; }
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
    public SessionState getState() { return state; }
    public void setState(SessionState state) { this.state = state; }
    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }
    public Set<String> getResources() { return resources; }
    public void setResources(Set<String> resources) {
        this.resources = resources != null ? new LinkedHashSet<>(resources) : new LinkedHashSet<>();
    }

    @Override
    public String toString() {
        return "Session{id=" + id + ", state=" + state + ", expiresAt=" + expiresAt
                + ", resources=" + resources + "}";
    }
}
