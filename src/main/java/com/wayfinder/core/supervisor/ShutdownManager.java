package com.wayfinder.core.supervisor;

import com.wayfinder.core.session.Session;
import com.wayfinder.core.session.SessionManager;
import com.wayfinder.core.session.SessionStoreUnavailableException;
import com.wayfinder.worker.SessionWorkerRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Stops the application in a bounded time: rejects new requests, asks running tasks to stop,
 * terminates sessions, closes workers and finally kills any worker process left behind.
 * <p>
 * Every step has its own time bound. A step that overruns is logged and the sequence moves on.
 */
@Component
public class ShutdownManager {

    private static final Logger log = LoggerFactory.getLogger(ShutdownManager.class);

    private final TaskSupervisor supervisor;
    private final SessionManager sessions;
    private final SessionWorkerRegistry registry;
    private final ShutdownProperties properties;
    private final Supplier<Stream<ProcessHandle>> childProcesses;

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public ShutdownManager(TaskSupervisor supervisor, SessionManager sessions, SessionWorkerRegistry registry,
                           ShutdownProperties properties) {
        this(supervisor, sessions, registry, properties, () -> ProcessHandle.current().descendants());
    }

    ShutdownManager(TaskSupervisor supervisor, SessionManager sessions, SessionWorkerRegistry registry,
                    ShutdownProperties properties, Supplier<Stream<ProcessHandle>> childProcesses) {
        this.supervisor = supervisor;
        this.sessions = sessions;
        this.registry = registry;
        this.properties = properties;
        this.childProcesses = childProcesses;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Runs the shutdown sequence once. Later calls return immediately.
     */
    @PreDestroy
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        long start = System.currentTimeMillis();
        log.info("Shutting down");
        supervisor.stopAccepting();

        int stopped = 0;
        for (String sessionId : runningSessions()) {
            if (registry.requestStop(sessionId)) {
                stopped++;
            }
        }
        if (stopped > 0) {
            log.info("Requested stop for {} running task(s)", stopped);
        }

        try {
            sessions.shutdown(properties.getSessionTimeout());
        } catch (RuntimeException e) {
            log.warn("Session shutdown did not complete cleanly: {}", e.getMessage());
        }
        try {
            registry.closeAll(properties.getWorkerTimeout());
        } catch (RuntimeException e) {
            log.warn("Worker cleanup did not complete cleanly: {}", e.getMessage());
        }

        killLeftoverProcesses();
        log.info("Shutdown completed in {} ms", System.currentTimeMillis() - start);
    }

    private Set<String> runningSessions() {
        Set<String> ids = new LinkedHashSet<>(registry.activeSessionIds());
        try {
            for (Session session : sessions.listActiveSessions()) {
                ids.add(session.getId());
            }
        } catch (SessionStoreUnavailableException e) {
            log.warn("Could not list sessions during shutdown: {}", e.getMessage());
        }
        return ids;
    }

    /** Terminates child processes gracefully, then forcibly once the grace period has passed. */
    void killLeftoverProcesses() {
        List<ProcessHandle> alive = childProcesses.get().filter(ProcessHandle::isAlive).toList();
        if (alive.isEmpty()) {
            return;
        }
        log.info("Terminating {} leftover worker process(es)", alive.size());
        alive.forEach(ProcessHandle::destroy);

        CompletableFuture<?>[] exits = alive.stream()
                .map(ProcessHandle::onExit)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(exits).get(properties.getProcessKillGrace().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Grace period elapsed with worker processes still running");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.debug("Waiting for worker processes failed: {}", e.getMessage());
        }

        for (ProcessHandle process : alive) {
            if (process.isAlive()) {
                log.warn("Force killing worker process {}", process.pid());
                process.destroyForcibly();
            }
        }
    }
}
