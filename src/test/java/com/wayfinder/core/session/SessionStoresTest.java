package com.wayfinder.core.session;

import com.wayfinder.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link InMemorySessionStore} and {@link FileSessionStore}.
 */
class SessionStoresTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    }

    @Nested
    @DisplayName("InMemorySessionStore")
    class InMemoryTests {

        @Test
        @DisplayName("returns copies so callers cannot mutate stored state")
        void returnsCopies() {
            var store = new InMemorySessionStore(clock);
            Session session = Session.create(TTL, clock.instant());
            store.save(session);

            Session loaded = store.get(session.getId()).orElseThrow();
            loaded.getResources().add("browser:x");

            assertTrue(store.get(session.getId()).orElseThrow().getResources().isEmpty());
        }

        @Test
        @DisplayName("evicts expired sessions lazily and notifies the eviction listener")
        void lazyEviction() {
            var store = new InMemorySessionStore(clock);
            List<Session> evicted = new ArrayList<>();
            store.onEviction(evicted::add);
            Session session = Session.create(TTL, clock.instant());
            store.save(session);

            clock.advance(TTL.plusSeconds(1));

            assertTrue(store.get(session.getId()).isEmpty());
            assertEquals(1, evicted.size());
            assertEquals(session.getId(), evicted.get(0).getId());
        }

        @Test
        @DisplayName("removeExpired returns only expired sessions")
        void removeExpired() {
            var store = new InMemorySessionStore(clock);
            Session old = Session.create(TTL, clock.instant());
            store.save(old);
            clock.advance(Duration.ofMinutes(4));
            Session fresh = Session.create(TTL, clock.instant());
            store.save(fresh);
            clock.advance(Duration.ofMinutes(2));

            List<Session> removed = store.removeExpired();

            assertEquals(List.of(old.getId()), removed.stream().map(Session::getId).toList());
            assertEquals(List.of(fresh.getId()), store.listActive().stream().map(Session::getId).toList());
        }
    }

    @Nested
    @DisplayName("FileSessionStore")
    class FileTests {

        @TempDir
        Path dir;

        @Test
        @DisplayName("persists sessions as JSON across store instances")
        void persistsAcrossInstances() {
            Session session = Session.create(TTL, clock.instant());
            session.getMetadata().put("client", "cli");
            session.getResources().add("browser:" + session.getId());
            new FileSessionStore(dir, clock).save(session);

            Session loaded = new FileSessionStore(dir, clock).get(session.getId()).orElseThrow();

            assertEquals(session.getExpiresAt(), loaded.getExpiresAt());
            assertEquals("cli", loaded.getMetadata().get("client"));
            assertTrue(loaded.getResources().contains("browser:" + session.getId()));
        }

        @Test
        @DisplayName("treats corrupted files as absent and removes them")
        void corruptedFile() throws IOException {
            Files.writeString(dir.resolve("broken.json"), "{not json");
            var store = new FileSessionStore(dir, clock);

            assertTrue(store.get("broken").isEmpty());
            assertFalse(Files.exists(dir.resolve("broken.json")));
        }

        @Test
        @DisplayName("rejects ids that would escape the directory")
        void unsafeIds() {
            var store = new FileSessionStore(dir, clock);

            assertTrue(store.get("../etc/passwd").isEmpty());
            assertFalse(store.delete("../etc/passwd"));
        }

        @Test
        @DisplayName("expired sessions are evicted on access")
        void evictsExpired() {
            var store = new FileSessionStore(dir, clock);
            List<Session> evicted = new ArrayList<>();
            store.onEviction(evicted::add);
            Session session = Session.create(TTL, clock.instant());
            store.save(session);

            clock.advance(TTL.plusSeconds(1));

            assertTrue(store.get(session.getId()).isEmpty());
            assertEquals(1, evicted.size());
            assertFalse(Files.exists(dir.resolve(session.getId() + ".json")));
        }
    }
}
