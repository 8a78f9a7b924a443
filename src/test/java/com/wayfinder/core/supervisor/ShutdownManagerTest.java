package com.wayfinder.core.supervisor;

import com.wayfinder.core.session.Session;
import com.wayfinder.core.session.SessionManager;
import com.wayfinder.core.session.SessionStoreUnavailableException;
import com.wayfinder.worker.SessionWorkerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ShutdownManager}.
 */
class ShutdownManagerTest {

    private TaskSupervisor supervisor;
    private SessionManager sessions;
    private SessionWorkerRegistry registry;
    private ShutdownProperties properties;
    private ShutdownManager manager;

    @BeforeEach
    void setUp() {
        supervisor = mock(TaskSupervisor.class);
        sessions = mock(SessionManager.class);
        registry = mock(SessionWorkerRegistry.class);
        properties = new ShutdownProperties();
        manager = new ShutdownManager(supervisor, sessions, registry, properties, Stream::empty);
    }

    @Test
    @DisplayName("runs the shutdown steps in order")
    void sequence() {
        Session idle = new Session();
        idle.setId("s2");
        when(registry.activeSessionIds()).thenReturn(List.of("s1"));
        when(sessions.listActiveSessions()).thenReturn(List.of(idle));

        manager.shutdown();

        assertTrue(manager.isShuttingDown());
        InOrder order = inOrder(supervisor, registry, sessions);
        order.verify(supervisor).stopAccepting();
        order.verify(registry).requestStop("s1");
        order.verify(registry).requestStop("s2");
        order.verify(sessions).shutdown(properties.getSessionTimeout());
        order.verify(registry).closeAll(properties.getWorkerTimeout());
    }

    @Test
    @DisplayName("a second call does nothing")
    void idempotent() {
        manager.shutdown();
        manager.shutdown();

        verify(supervisor, times(1)).stopAccepting();
        verify(sessions, times(1)).shutdown(any(Duration.class));
        verify(registry, times(1)).closeAll(any(Duration.class));
    }

    @Test
    @DisplayName("a failing step does not stop the later ones")
    void continuesAfterFailure() {
        when(sessions.listActiveSessions()).thenThrow(new SessionStoreUnavailableException("store down", null));
        doThrow(new IllegalStateException("stuck")).when(sessions).shutdown(any(Duration.class));

        assertDoesNotThrow(manager::shutdown);

        verify(registry).closeAll(properties.getWorkerTimeout());
    }

    @Test
    @DisplayName("does nothing when no worker process is left")
    void noLeftoverProcesses() {
        assertDoesNotThrow(manager::killLeftoverProcesses);
    }
}
