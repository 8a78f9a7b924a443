package com.wayfinder.core.session;

import com.wayfinder.core.metrics.WayfinderMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Authoritative registry of session identity, TTL and the resource tags other
 * components hang off a session.
 * <p>
 * Terminating a session (explicitly, by sweep, or by lazy eviction) hands every
 * resource tag to the {@link SessionResourceManager} registered for its type
 * (the part before {@code ':'}). Those cleanups run asynchronously and their
 * failures are only logged.
 */
@Service
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final SessionStore store;
    private final SessionProperties properties;
    private final Clock clock;
    private final WayfinderMetrics metrics;

    private final Map<String, SessionResourceManager> resourceManagers = new ConcurrentHashMap<>();
    private final Set<CompletableFuture<Void>> pendingCleanups = ConcurrentHashMap.newKeySet();

    /** Serializes read-modify-write cycles against the store. */
    private final ReentrantLock mutationLock = new ReentrantLock();

    private final ScheduledExecutorService sweeper = Executors.newSingleThreadScheduledExecutor(
            daemonThreads("session-sweeper"));
    private final ExecutorService cleanupExecutor = Executors.newCachedThreadPool(
            daemonThreads("session-cleanup"));

    private volatile boolean shuttingDown;

    public SessionManager(SessionStore store, SessionProperties properties, Clock clock,
                          WayfinderMetrics metrics) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
        this.store.onEviction(this::releaseResources);
    }

    @PostConstruct
    void startSweeper() {
        long interval = properties.getCleanupInterval().toMillis();
        sweeper.scheduleAtFixedRate(this::sweepSafely, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Session sweeper started (ttl={}, interval={})", properties.getTtl(), properties.getCleanupInterval());
    }

    @PreDestroy
    void stopExecutors() {
        stopSweeper();
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public void registerResourceManager(String resourceType, SessionResourceManager manager) {
        resourceManagers.put(resourceType, manager);
        log.info("Registered resource manager for '{}' resources", resourceType);
    }

    /**
     * Returns the session if {@code sessionId} is still valid, otherwise creates a fresh one
     * with a new id.
     *
     * @throws SessionStoreUnavailableException if the new session cannot be persisted
     */
    public Session getOrCreate(String sessionId) {
        if (sessionId != null && !sessionId.isBlank()) {
            Session existing = validate(sessionId);
            if (existing != null) {
                return existing;
            }
            log.info("Session {} is unknown or no longer valid, creating a new one", sessionId);
        }
        return createSession();
    }

    public Session createSession() {
        Session session = Session.create(properties.getTtl(), clock.instant());
        withStoreRetry("create", () -> {
            store.save(session);
            return null;
        });
        log.info("Created session {}", session.getId());
        return session.copy();
    }

    /**
     * Returns the session with its TTL slid forward, or {@code null} when it is unknown,
     * expired, terminated, or the store cannot be reached.
     */
    public Session validate(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return null;
        }
        mutationLock.lock();
        try {
            Optional<Session> found = withStoreRetry("validate", () -> store.get(sessionId));
            if (found.isEmpty()) {
                return null;
            }
            Session session = found.get();
            var now = clock.instant();
            if (session.getState() != SessionState.ACTIVE || session.isExpired(now)) {
                return null;
            }
            session.refresh(properties.getTtl(), now);
            withStoreRetry("refresh", () -> {
                store.save(session);
                return null;
            });
            return session.copy();
        } catch (SessionStoreUnavailableException e) {
            log.warn("Treating session {} as not found: {}", sessionId, e.getMessage());
            return null;
        } finally {
            mutationLock.unlock();
        }
    }

    public boolean refresh(String sessionId, Duration ttl) {
        return mutate(sessionId, "refresh", session -> session.refresh(ttl, clock.instant()));
    }

    public boolean addResource(String sessionId, String resourceTag) {
        return mutate(sessionId, "addResource", session -> session.getResources().add(resourceTag));
    }

    public boolean removeResource(String sessionId, String resourceTag) {
        return mutate(sessionId, "removeResource", session -> session.getResources().remove(resourceTag));
    }

    public boolean updateMetadata(String sessionId, String key, Object value) {
        return mutate(sessionId, "updateMetadata", session -> session.getMetadata().put(key, value));
    }

    /** Read-only view of the session; does not refresh its TTL. */
    public Optional<Session> getSessionInfo(String sessionId) {
        try {
            return withStoreRetry("get", () -> store.get(sessionId));
        } catch (SessionStoreUnavailableException e) {
            log.warn("Session info unavailable for {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    public List<Session> listActiveSessions() {
        return withStoreRetry("listActive", store::listActive);
    }

    /**
     * Ends a session and releases its resources.
     *
     * @return {@code false} if the session was already gone
     */
    public boolean terminate(String sessionId) {
        Session session;
        mutationLock.lock();
        try {
            Optional<Session> found = withStoreRetry("terminate", () -> store.get(sessionId));
            if (found.isEmpty()) {
                return false;
            }
            session = found.get();
            session.setState(SessionState.TERMINATED);
            withStoreRetry("terminate", () -> store.delete(sessionId));
        } catch (SessionStoreUnavailableException e) {
            log.warn("Could not terminate session {}: {}", sessionId, e.getMessage());
            return false;
        } finally {
            mutationLock.unlock();
        }
        log.info("Terminated session {}", sessionId);
        releaseResources(session);
        return true;
    }

    /**
     * Removes every expired session and releases its resources.
     *
     * @return number of sessions removed
     */
    public int cleanupExpired() {
        List<Session> removed = withStoreRetry("cleanupExpired", store::removeExpired);
        for (Session session : removed) {
            releaseResources(session);
        }
        if (!removed.isEmpty()) {
            log.info("Cleaned up {} expired session(s)", removed.size());
            metrics.recordSessionsExpired(removed.size());
        }
        return removed.size();
    }

    /**
     * Stops the sweeper, terminates every active session and waits up to {@code timeout}
     * for their resource cleanups.
     */
    public void shutdown(Duration timeout) {
        if (shuttingDown) {
            return;
        }
        shuttingDown = true;
        stopSweeper();
        List<Session> active;
        try {
            active = listActiveSessions();
        } catch (SessionStoreUnavailableException e) {
            log.warn("Session store unavailable during shutdown: {}", e.getMessage());
            active = List.of();
        }
        for (Session session : active) {
            terminate(session.getId());
        }
        awaitPendingCleanups(timeout);
        log.info("Session manager shut down ({} session(s) terminated)", active.size());
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    int pendingCleanupCount() {
        return pendingCleanups.size();
    }

    private void releaseResources(Session session) {
        for (String tag : new ArrayList<>(session.getResources())) {
            int sep = tag.indexOf(':');
            String type = sep > 0 ? tag.substring(0, sep) : tag;
            SessionResourceManager manager = resourceManagers.get(type);
            if (manager == null) {
                log.debug("No resource manager for '{}' (session {})", tag, session.getId());
                continue;
            }
            CompletableFuture<Void> future = CompletableFuture
                    .runAsync(() -> manager.cleanupResource(tag, session.getId()), cleanupExecutor)
                    .orTimeout(properties.getResourceCleanupTimeout().toMillis(), TimeUnit.MILLISECONDS);
            pendingCleanups.add(future);
            future.whenComplete((ignored, error) -> {
                pendingCleanups.remove(future);
                if (error != null) {
                    log.warn("Cleanup of {} for session {} failed: {}", tag, session.getId(), error.toString());
                }
            });
        }
    }

    private void awaitPendingCleanups(Duration timeout) {
        var pending = pendingCleanups.toArray(new CompletableFuture[0]);
        if (pending.length == 0) {
            return;
        }
        try {
            CompletableFuture.allOf(pending).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("{} resource cleanup(s) still running after {}", pendingCleanups.size(), timeout);
        } catch (ExecutionException e) {
            log.debug("Some resource cleanups failed: {}", e.getCause() != null ? e.getCause().toString() : e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean mutate(String sessionId, String operation, Consumer<Session> change) {
        mutationLock.lock();
        try {
            Optional<Session> found = withStoreRetry(operation, () -> store.get(sessionId));
            if (found.isEmpty() || found.get().getState() == SessionState.TERMINATED) {
                return false;
            }
            Session session = found.get();
            change.accept(session);
            withStoreRetry(operation, () -> {
                store.save(session);
                return null;
            });
            return true;
        } catch (SessionStoreUnavailableException e) {
            log.warn("Session {} for {}: {}", operation, sessionId, e.getMessage());
            return false;
        } finally {
            mutationLock.unlock();
        }
    }

    private <T> T withStoreRetry(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (UncheckedIOException first) {
            log.warn("Session store {} failed, retrying once: {}", operation, first.getMessage());
            try {
                return action.get();
            } catch (UncheckedIOException second) {
                throw new SessionStoreUnavailableException("Session store unavailable during " + operation, second);
            }
        }
    }

    private void sweepSafely() {
        try {
            cleanupExpired();
        } catch (RuntimeException e) {
            log.warn("Session sweep failed: {}", e.getMessage(), e);
        }
    }

    private void stopSweeper() {
        sweeper.shutdown();
        try {
            if (!sweeper.awaitTermination(2, TimeUnit.SECONDS)) {
                sweeper.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweeper.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
