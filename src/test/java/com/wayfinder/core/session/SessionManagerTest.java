package com.wayfinder.core.session;

import com.wayfinder.MutableClock;
import com.wayfinder.core.metrics.WayfinderMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SessionManager}.
 */
class SessionManagerTest {

    private MutableClock clock;
    private SessionProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private SessionManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        properties = new SessionProperties();
        properties.setTtl(Duration.ofMinutes(10));
        properties.setResourceCleanupTimeout(Duration.ofSeconds(2));
        meterRegistry = new SimpleMeterRegistry();
        manager = new SessionManager(new InMemorySessionStore(clock), properties, clock,
                new WayfinderMetrics(meterRegistry));
    }

    @AfterEach
    void tearDown() {
        manager.stopExecutors();
    }

    @Nested
    @DisplayName("validation and TTL")
    class ValidationTests {

        @Test
        @DisplayName("getOrCreate without an id creates an active session")
        void createsSession() {
            Session session = manager.getOrCreate(null);

            assertNotNull(session.getId());
            assertEquals(SessionState.ACTIVE, session.getState());
            assertNotNull(manager.validate(session.getId()));
        }

        @Test
        @DisplayName("validate slides the expiry window forward")
        void validateRefreshes() {
            Session session = manager.getOrCreate(null);
            clock.advance(Duration.ofMinutes(8));

            Session validated = manager.validate(session.getId());

            assertEquals(clock.instant().plus(Duration.ofMinutes(10)), validated.getExpiresAt());
            clock.advance(Duration.ofMinutes(8));
            assertNotNull(manager.validate(session.getId()), "refreshed session should still be valid");
        }

        @Test
        @DisplayName("a session past its TTL is never returned and is replaced by a new id")
        void expiredSessionReplaced() {
            Session session = manager.getOrCreate(null);
            clock.advance(Duration.ofMinutes(11));

            assertNull(manager.validate(session.getId()));
            Session replacement = manager.getOrCreate(session.getId());
            assertNotEquals(session.getId(), replacement.getId());
        }

        @Test
        @DisplayName("blank and unknown ids do not validate")
        void unknownIds() {
            assertNull(manager.validate(null));
            assertNull(manager.validate(" "));
            assertNull(manager.validate("missing"));
        }
    }

    @Nested
    @DisplayName("termination")
    class TerminationTests {

        @Test
        @DisplayName("terminate hands each resource tag to its registered manager")
        void terminateCascades() {
            SessionResourceManager browsers = mock(SessionResourceManager.class);
            manager.registerResourceManager("browser", browsers);
            Session session = manager.getOrCreate(null);
            manager.addResource(session.getId(), "browser:" + session.getId());

            assertTrue(manager.terminate(session.getId()));

            verify(browsers, timeout(2000)).cleanupResource("browser:" + session.getId(), session.getId());
            assertNull(manager.validate(session.getId()));
        }

        @Test
        @DisplayName("terminate is idempotent")
        void terminateTwice() {
            Session session = manager.getOrCreate(null);

            assertTrue(manager.terminate(session.getId()));
            assertFalse(manager.terminate(session.getId()));
        }

        @Test
        @DisplayName("a failing resource cleanup does not block termination")
        void failingCleanupIsLogged() {
            SessionResourceManager broken = mock(SessionResourceManager.class);
            doThrow(new IllegalStateException("stuck")).when(broken).cleanupResource(anyString(), anyString());
            manager.registerResourceManager("browser", broken);
            Session session = manager.getOrCreate(null);
            manager.addResource(session.getId(), "browser:" + session.getId());

            assertTrue(manager.terminate(session.getId()));
            verify(broken, timeout(2000)).cleanupResource(anyString(), anyString());
        }

        @Test
        @DisplayName("cleanupExpired removes expired sessions and records the count")
        void cleanupExpired() {
            manager.getOrCreate(null);
            manager.getOrCreate(null);
            clock.advance(Duration.ofMinutes(11));

            assertEquals(2, manager.cleanupExpired());
            assertEquals(2.0, meterRegistry.find("wayfinder.sessions.expired").counter().count());
            assertTrue(manager.listActiveSessions().isEmpty());
        }

        @Test
        @DisplayName("shutdown terminates every active session")
        void shutdownTerminatesAll() {
            Session a = manager.getOrCreate(null);
            Session b = manager.getOrCreate(null);

            manager.shutdown(Duration.ofSeconds(1));

            assertTrue(manager.isShuttingDown());
            assertNull(manager.validate(a.getId()));
            assertNull(manager.validate(b.getId()));
        }
    }

    @Nested
    @DisplayName("metadata and resources")
    class MetadataTests {

        @Test
        @DisplayName("updateMetadata and addResource persist on the session")
        void persistsChanges() {
            Session session = manager.getOrCreate(null);

            assertTrue(manager.updateMetadata(session.getId(), "client", "cli"));
            assertTrue(manager.addResource(session.getId(), "browser:" + session.getId()));

            Session info = manager.getSessionInfo(session.getId()).orElseThrow();
            assertEquals("cli", info.getMetadata().get("client"));
            assertTrue(info.getResources().contains("browser:" + session.getId()));

            assertTrue(manager.removeResource(session.getId(), "browser:" + session.getId()));
            assertFalse(manager.getSessionInfo(session.getId()).orElseThrow().getResources()
                    .contains("browser:" + session.getId()));
        }

        @Test
        @DisplayName("mutations of unknown sessions report false")
        void unknownSession() {
            assertFalse(manager.addResource("missing", "browser:missing"));
        }
    }

    @Nested
    @DisplayName("store failures")
    class StoreFailureTests {

        private SessionStore store;
        private SessionManager flaky;

        @BeforeEach
        void setUp() {
            store = mock(SessionStore.class);
            flaky = new SessionManager(store, properties, clock, new WayfinderMetrics(new SimpleMeterRegistry()));
        }

        @AfterEach
        void tearDown() {
            flaky.stopExecutors();
        }

        @Test
        @DisplayName("a single I/O failure is retried")
        void retriesOnce() {
            Session session = Session.create(Duration.ofMinutes(10), clock.instant());
            when(store.get(session.getId()))
                    .thenThrow(new UncheckedIOException(new IOException("disk hiccup")))
                    .thenReturn(Optional.of(session));

            assertNotNull(flaky.validate(session.getId()));
            verify(store, times(2)).get(session.getId());
        }

        @Test
        @DisplayName("repeated failures make validation report the session as not found")
        void unavailableTreatedAsNotFound() {
            when(store.get(anyString())).thenThrow(new UncheckedIOException(new IOException("disk gone")));

            assertNull(flaky.validate("s-1"));
            verify(store, times(2)).get("s-1");
        }

        @Test
        @DisplayName("session creation surfaces SessionStoreUnavailableException after one retry")
        void createFails() {
            doThrow(new UncheckedIOException(new IOException("read-only"))).when(store).save(any());

            assertThrows(SessionStoreUnavailableException.class, () -> flaky.createSession());
            verify(store, times(2)).save(any());
        }
    }
}
