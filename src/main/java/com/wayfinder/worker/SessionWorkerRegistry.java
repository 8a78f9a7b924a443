package com.wayfinder.worker;

import com.wayfinder.core.browser.BrowserStateManager;
import com.wayfinder.core.browser.BrowserStateUpdate;
import com.wayfinder.core.browser.BrowserStatus;
import com.wayfinder.core.error.ErrorCode;
import com.wayfinder.core.error.WayfinderException;
import com.wayfinder.core.execution.CancellationToken;
import com.wayfinder.core.metrics.WayfinderMetrics;
import com.wayfinder.core.session.SessionLocks;
import com.wayfinder.core.session.SessionManager;
import com.wayfinder.core.session.SessionResourceManager;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the browser worker of every session.
 * <p>
 * At most one live worker exists per session: creation is guarded by a per-session lock,
 * and a dead worker is detected by a probe and replaced rather than reused. The number of
 * concurrent workers is capped by {@link WorkerProperties#getMaxWorkers()}. Cleanup is
 * best-effort and always bounded by a timeout.
 * <p>
 * Also holds the cooperative stop token of each session's running task.
 */
@Service
public class SessionWorkerRegistry implements SessionResourceManager {

    private static final Logger log = LoggerFactory.getLogger(SessionWorkerRegistry.class);

    public static final String RESOURCE_TYPE = "browser";
    private static final int LAUNCH_ATTEMPTS = 2;

    private final WorkerConnectionFactory factory;
    private final WorkerProperties props;
    private final BrowserStateManager browserStates;
    private final SessionManager sessions;
    private final WayfinderMetrics metrics;

    private final Map<String, LaneBoundWorkerConnection> workers = new ConcurrentHashMap<>();
    private final SessionLocks creationLocks = new SessionLocks(false);
    private final Map<String, String> rememberedUrls = new ConcurrentHashMap<>();
    private final Map<String, CancellationToken> stopTokens = new ConcurrentHashMap<>();
    private final Semaphore permits;
    private final ExecutorService cleanupExecutor;

    public SessionWorkerRegistry(WorkerConnectionFactory factory, WorkerProperties props,
                                 BrowserStateManager browserStates, SessionManager sessions,
                                 WayfinderMetrics metrics) {
        this.factory = factory;
        this.props = props;
        this.browserStates = browserStates;
        this.sessions = sessions;
        this.metrics = metrics;
        this.permits = new Semaphore(Math.max(1, props.getMaxWorkers()), true);
        AtomicInteger threadCount = new AtomicInteger();
        this.cleanupExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "worker-cleanup-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    void register() {
        sessions.registerResourceManager(RESOURCE_TYPE, this);
        log.info("Worker registry ready (max workers: {}, command: {})", props.getMaxWorkers(), props.getCommand());
    }

    @PreDestroy
    void stopExecutors() {
        cleanupExecutor.shutdownNow();
    }

    public static String resourceTag(String sessionId) {
        return RESOURCE_TYPE + ":" + sessionId;
    }

    // ── Worker lifecycle ────────────────────────────────────────────

    public WorkerConnection getOrCreateWorker(String sessionId) {
        return getOrCreateWorker(sessionId, null);
    }

    /**
     * Returns the session's live worker, launching one if there is none or the
     * existing one no longer responds.
     *
     * @param url start URL for a new worker; when {@code null} the URL remembered from the
     *            session's previous worker or the configured start URL is used
     * @throws WorkerUnavailableException when the worker cannot be launched or the pool is full
     */
    public WorkerConnection getOrCreateWorker(String sessionId, String url) {
        if (sessions.validate(sessionId) == null) {
            throw new WayfinderException(ErrorCode.SESSION_NOT_FOUND, "Invalid session: " + sessionId);
        }
        ReentrantLock lock = creationLocks.acquire(sessionId);
        try {
            LaneBoundWorkerConnection existing = workers.get(sessionId);
            if (existing != null) {
                if (isFunctional(existing)) {
                    log.debug("Reusing worker for session {}", sessionId);
                    return existing;
                }
                log.warn("Worker for session {} is not functional, creating a new one", sessionId);
                cleanup(sessionId);
            }
            return launch(sessionId, url);
        } finally {
            creationLocks.release(sessionId, lock);
        }
    }

    private LaneBoundWorkerConnection launch(String sessionId, String explicitUrl) {
        if (!permits.tryAcquire()) {
            throw new WorkerUnavailableException(ErrorCode.RESOURCE_EXHAUSTED,
                    "Worker limit of " + props.getMaxWorkers() + " reached", null);
        }
        boolean launched = false;
        try {
            String initUrl = resolveUrl(sessionId, explicitUrl);
            log.info("Creating worker for session {} at {}", sessionId, initUrl);
            browserStates.update(sessionId, BrowserStateUpdate.status(BrowserStatus.INITIALIZING)
                    .headless(props.isHeadless()));

            RuntimeException lastFailure = null;
            for (int attempt = 1; attempt <= LAUNCH_ATTEMPTS; attempt++) {
                LaneBoundWorkerConnection connection = null;
                try {
                    connection = new LaneBoundWorkerConnection(factory.create(sessionId), props);
                    Map<String, Object> response = connection.initialize(props.isHeadless(), initUrl);
                    workers.put(sessionId, connection);
                    launched = true;
                    rememberedUrls.put(sessionId, initUrl);
                    String currentUrl = WorkerResponses.string(response, "current_url");
                    browserStates.update(sessionId, BrowserStateUpdate.status(BrowserStatus.INITIALIZED)
                            .currentUrl(currentUrl.isBlank() ? initUrl : currentUrl)
                            .pageTitle(WorkerResponses.string(response, "page_title"))
                            .headless(props.isHeadless()));
                    sessions.addResource(sessionId, resourceTag(sessionId));
                    metrics.recordWorkerCreated();
                    return connection;
                } catch (RuntimeException e) {
                    if (launched) {
                        throw e;
                    }
                    lastFailure = e;
                    log.warn("Worker launch attempt {}/{} failed for session {}: {}",
                            attempt, LAUNCH_ATTEMPTS, sessionId, e.getMessage());
                    if (connection != null && !connection.close(props.getCloseTimeout())) {
                        connection.abandon();
                    }
                }
            }

            browserStates.update(sessionId, BrowserStateUpdate.status(BrowserStatus.ERROR)
                    .errorMessage(lastFailure.getMessage()));
            if (lastFailure instanceof WorkerUnavailableException wue
                    && wue.getErrorCode() == ErrorCode.BROWSER_INITIALIZATION_ERROR) {
                throw wue;
            }
            throw new WorkerUnavailableException(ErrorCode.BROWSER_INITIALIZATION_ERROR,
                    "Failed to initialize browser for session " + sessionId + ": " + lastFailure.getMessage(),
                    lastFailure);
        } finally {
            // a registered worker hands its permit back through cleanup
            if (!launched) {
                permits.release();
            }
        }
    }

    private String resolveUrl(String sessionId, String explicitUrl) {
        if (explicitUrl != null && !explicitUrl.isBlank()) {
            return explicitUrl;
        }
        return rememberedUrls.getOrDefault(sessionId, props.getStartUrl());
    }

    /** The session's live worker, without creating one. */
    public Optional<WorkerConnection> getWorkerIfExists(String sessionId) {
        LaneBoundWorkerConnection connection = workers.get(sessionId);
        return connection != null && connection.isInitialized() ? Optional.of(connection) : Optional.empty();
    }

    /**
     * Probes the worker with a screenshot call under the probe timeout. A worker that
     * fails, times out or reports no current URL counts as dead.
     */
    public boolean isFunctional(WorkerConnection connection) {
        if (connection == null || !connection.isInitialized()) {
            return false;
        }
        try {
            Map<String, Object> response = connection instanceof LaneBoundWorkerConnection lane
                    ? lane.callTool(WorkerConnection.TOOL_SCREENSHOT, screenshotArgs(), props.getProbeTimeout())
                    : connection.callTool(WorkerConnection.TOOL_SCREENSHOT, screenshotArgs());
            return !WorkerResponses.isError(response)
                    && !WorkerResponses.string(response, "current_url").isBlank();
        } catch (RuntimeException e) {
            log.debug("Worker probe failed for session {}: {}", connection.sessionId(), e.getMessage());
            return false;
        }
    }

    public Map<String, Object> screenshotArgs() {
        return Map.of("max_width", props.getScreenshotMaxWidth(), "quality", props.getScreenshotQuality());
    }

    /**
     * Restarts the session's browser. A live worker restarts in place at its current page;
     * otherwise, or if that fails, the worker is closed and relaunched at the remembered URL.
     */
    public WorkerConnection restart(String sessionId) {
        ReentrantLock lock = creationLocks.acquire(sessionId);
        try {
            LaneBoundWorkerConnection existing = workers.get(sessionId);
            if (existing != null && existing.isInitialized()) {
                try {
                    String url = captureUrl(sessionId, existing);
                    Map<String, Object> response = existing.restart(props.isHeadless(), url);
                    if (!WorkerResponses.isError(response)) {
                        browserStates.update(sessionId, BrowserStateUpdate.status(BrowserStatus.INITIALIZED)
                                .currentUrl(url)
                                .pageTitle(WorkerResponses.string(response, "page_title")));
                        return existing;
                    }
                    log.warn("In-place restart failed for session {}: {}", sessionId,
                            WorkerResponses.string(response, "message"));
                } catch (RuntimeException e) {
                    log.warn("In-place restart failed for session {}: {}", sessionId, e.getMessage());
                }
            }
            cleanup(sessionId);
            return launch(sessionId, null);
        } finally {
            creationLocks.release(sessionId, lock);
        }
    }

    public Optional<String> rememberedUrl(String sessionId) {
        return Optional.ofNullable(rememberedUrls.get(sessionId));
    }

    // ── Cleanup ─────────────────────────────────────────────────────

    /**
     * Closes the session's worker.
     *
     * @return {@code false} if the session had no worker
     */
    public boolean close(String sessionId) {
        if (!workers.containsKey(sessionId)) {
            log.debug("No worker found for session {}", sessionId);
            return false;
        }
        sessions.removeResource(sessionId, resourceTag(sessionId));
        cleanup(sessionId);
        return true;
    }

    @Override
    public void cleanupResource(String resourceTag, String sessionId) {
        if (!resourceTag.startsWith(RESOURCE_TYPE + ":")) {
            return;
        }
        ReentrantLock lock = creationLocks.acquire(sessionId);
        try {
            cleanup(sessionId);
            rememberedUrls.remove(sessionId);
            stopTokens.remove(sessionId);
        } finally {
            creationLocks.release(sessionId, lock);
        }
    }

    public void closeAll() {
        closeAll(props.getCloseAllTimeout());
    }

    /**
     * Closes every worker concurrently. Returns once all have closed or {@code timeout}
     * has elapsed; workers still closing at that point are abandoned.
     */
    public void closeAll(Duration timeout) {
        List<String> sessionIds = new ArrayList<>(workers.keySet());
        log.info("Closing {} worker(s)", sessionIds.size());
        var futures = sessionIds.stream()
                .map(id -> CompletableFuture.runAsync(() -> cleanup(id), cleanupExecutor))
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(futures).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Some workers failed to close within {}", timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing workers");
        } catch (ExecutionException e) {
            log.error("Worker cleanup failed: {}", e.getCause().getMessage());
        } finally {
            for (String sessionId : new ArrayList<>(workers.keySet())) {
                LaneBoundWorkerConnection connection = workers.get(sessionId);
                if (connection != null && workers.remove(sessionId, connection)) {
                    connection.abandon();
                    permits.release();
                    browserStates.remove(sessionId);
                    metrics.recordWorkerClosed("abandoned");
                }
            }
            rememberedUrls.clear();
        }
        log.info("All workers closed");
    }

    private void cleanup(String sessionId) {
        LaneBoundWorkerConnection connection = workers.get(sessionId);
        if (connection == null) {
            return;
        }
        String outcome = "closed";
        try {
            browserStates.update(sessionId, BrowserStateUpdate.status(BrowserStatus.CLOSING));
            captureUrl(sessionId, connection);
            if (!connection.close(props.getCloseTimeout())) {
                outcome = "timeout";
            }
        } catch (RuntimeException e) {
            outcome = "error";
            log.error("Error during worker cleanup for session {}: {}", sessionId, e.getMessage());
        } finally {
            if (workers.remove(sessionId, connection)) {
                permits.release();
                browserStates.remove(sessionId);
                metrics.recordWorkerClosed(outcome);
            }
        }
    }

    private String captureUrl(String sessionId, LaneBoundWorkerConnection connection) {
        String fallback = rememberedUrls.getOrDefault(sessionId, props.getStartUrl());
        if (!connection.isInitialized()) {
            return fallback;
        }
        try {
            Map<String, Object> response = connection.callTool(WorkerConnection.TOOL_SCREENSHOT,
                    screenshotArgs(), props.getUrlCaptureTimeout());
            String url = WorkerResponses.string(response, "current_url");
            if (!url.isBlank() && !"about:blank".equals(url)) {
                rememberedUrls.put(sessionId, url);
                return url;
            }
        } catch (RuntimeException e) {
            log.debug("Could not capture current URL for session {}: {}", sessionId, e.getMessage());
        }
        return fallback;
    }

    // ── Cooperative stop ────────────────────────────────────────────

    /** The stop token for the session's current task, created on first use. */
    public CancellationToken stopToken(String sessionId) {
        return stopTokens.computeIfAbsent(sessionId, id -> new CancellationToken());
    }

    /**
     * Asks the session's running task to stop at its next turn boundary.
     *
     * @return {@code false} if no task is running or a stop was already requested
     */
    public boolean requestStop(String sessionId) {
        CancellationToken token = stopTokens.get(sessionId);
        boolean requested = token != null && token.cancel();
        if (requested) {
            log.info("Stop requested for session {}", sessionId);
        }
        return requested;
    }

    public boolean isStopRequested(String sessionId) {
        CancellationToken token = stopTokens.get(sessionId);
        return token != null && token.isCancellationRequested();
    }

    public void clearStop(String sessionId) {
        stopTokens.remove(sessionId);
    }

    // ── Monitoring ──────────────────────────────────────────────────

    public int activeWorkerCount() {
        return workers.size();
    }

    /** Sessions the registry still holds a worker, URL, stop token or creation lock for. */
    int trackedSessionCount() {
        Set<String> ids = new HashSet<>(workers.keySet());
        ids.addAll(rememberedUrls.keySet());
        ids.addAll(stopTokens.keySet());
        return ids.size() + creationLocks.size();
    }

    public int capacity() {
        return props.getMaxWorkers();
    }

    public List<String> activeSessionIds() {
        return new ArrayList<>(workers.keySet());
    }
}
