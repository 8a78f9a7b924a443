package com.wayfinder.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ThoughtEventBus}.
 */
class ThoughtEventBusTest {

    private ThoughtEventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new ThoughtEventBus(Runnable::run);
    }

    @Nested
    @DisplayName("subscribe and emit")
    class SubscribeAndEmitTests {

        @Test
        @DisplayName("delivers events to subscribers of the same session only")
        void deliversToSessionSubscribers() {
            List<ThoughtEvent> s1 = new ArrayList<>();
            List<ThoughtEvent> s2 = new ArrayList<>();
            eventBus.subscribe("s-1", s1::add);
            eventBus.subscribe("s-2", s2::add);

            eventBus.emit("s-1", "processing", "status", "Supervisor", "Processing user request...");

            assertEquals(1, s1.size());
            assertEquals("processing", s1.get(0).type());
            assertEquals("Supervisor", s1.get(0).node());
            assertTrue(s2.isEmpty());
        }

        @Test
        @DisplayName("global subscribers receive events from every session")
        void globalSubscribersReceiveAll() {
            List<ThoughtEvent> all = new ArrayList<>();
            eventBus.subscribeAll(all::add);

            eventBus.emit("s-1", "answer", "result", "Answer", "one");
            eventBus.emit("s-2", "answer", "result", "Answer", "two");

            assertEquals(List.of("one", "two"), all.stream().map(ThoughtEvent::content).toList());
        }

        @Test
        @DisplayName("carries technical details and defaults them to an empty map")
        void carriesDetails() {
            List<ThoughtEvent> received = new ArrayList<>();
            eventBus.subscribe("s-1", received::add);

            eventBus.emit("s-1", "task_status", "status", "System", "started", Map.of("status", "start"));
            eventBus.emit("s-1", "reasoning", "analysis", "Supervisor", "thinking");

            assertEquals("start", received.get(0).technicalDetails().get("status"));
            assertTrue(received.get(1).technicalDetails().isEmpty());
            assertNotNull(received.get(1).timestamp());
        }
    }

    @Nested
    @DisplayName("failure isolation")
    class FailureIsolationTests {

        @Test
        @DisplayName("a failing subscriber does not stop delivery to the others")
        void failingSubscriberIsIsolated() {
            List<ThoughtEvent> received = new ArrayList<>();
            eventBus.subscribe("s-1", e -> { throw new IllegalStateException("boom"); });
            eventBus.subscribe("s-1", received::add);

            assertDoesNotThrow(() -> eventBus.emit("s-1", "warning", "limit", "Supervisor", "hi"));
            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("emitting a null event is ignored")
        void nullEventIgnored() {
            assertDoesNotThrow(() -> eventBus.emit(null));
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribed consumers stop receiving events")
        void unsubscribeStopsDelivery() {
            List<ThoughtEvent> received = new ArrayList<>();
            ThoughtEventBus.Subscription sub = eventBus.subscribe("s-1", received::add);

            sub.unsubscribe();
            eventBus.emit("s-1", "answer", "result", "Answer", "ignored");

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("clearSession drops all subscribers of the session")
        void clearSessionDropsSubscribers() {
            List<ThoughtEvent> received = new ArrayList<>();
            eventBus.subscribe("s-1", received::add);

            eventBus.clearSession("s-1");
            eventBus.emit("s-1", "answer", "result", "Answer", "ignored");

            assertTrue(received.isEmpty());
        }
    }

    @Nested
    @DisplayName("dispatch off the emitting thread")
    class DispatchTests {

        @Test
        @DisplayName("a slow listener does not hold up the emitter and events arrive in order")
        void slowListenerDoesNotBlock() throws Exception {
            ExecutorService dispatcher = new EventsConfig().thoughtEventDispatcher();
            try {
                ThoughtEventBus bus = new ThoughtEventBus(dispatcher);
                CountDownLatch release = new CountDownLatch(1);
                CountDownLatch delivered = new CountDownLatch(3);
                List<String> received = new CopyOnWriteArrayList<>();
                bus.subscribe("s-1", e -> {
                    await(release);
                    received.add(e.content());
                    delivered.countDown();
                });

                long start = System.nanoTime();
                bus.emit("s-1", "reasoning", "analysis", "Supervisor", "one");
                bus.emit("s-1", "reasoning", "analysis", "Supervisor", "two");
                bus.emit("s-1", "answer", "result", "Answer", "three");
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

                assertTrue(elapsedMs < 1_000, "emit took " + elapsedMs + "ms");
                assertTrue(received.isEmpty());

                release.countDown();
                assertTrue(delivered.await(5, TimeUnit.SECONDS));
                assertEquals(List.of("one", "two", "three"), received);
            } finally {
                dispatcher.shutdownNow();
            }
        }

        @Test
        @DisplayName("events beyond the dispatch queue are dropped and counted")
        void fullQueueDropsEvents() {
            CountDownLatch release = new CountDownLatch(1);
            ThreadPoolExecutor dispatcher = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(1));
            try {
                ThoughtEventBus bus = new ThoughtEventBus(dispatcher);
                bus.subscribeAll(e -> await(release));

                for (int i = 0; i < 5; i++) {
                    int n = i;
                    assertDoesNotThrow(() -> bus.emit("s-1", "reasoning", "analysis", "Supervisor", "event " + n));
                }

                // one running, one queued
                assertEquals(3, bus.droppedCount());
            } finally {
                release.countDown();
                dispatcher.shutdownNow();
            }
        }

        @Test
        @DisplayName("events emitted after the dispatcher shut down are dropped")
        void shutDownDispatcher() {
            ExecutorService dispatcher = new EventsConfig().thoughtEventDispatcher();
            dispatcher.shutdown();
            ThoughtEventBus bus = new ThoughtEventBus(dispatcher);
            bus.subscribeAll(e -> fail("no delivery expected"));

            assertDoesNotThrow(() -> bus.emit("s-1", "answer", "result", "Answer", "late"));
            assertEquals(1, bus.droppedCount());
        }

        @Test
        @DisplayName("events without listeners are not dispatched")
        void noListeners() {
            ThoughtEventBus bus = new ThoughtEventBus(task -> fail("nothing to dispatch"));

            assertDoesNotThrow(() -> bus.emit("s-1", "answer", "result", "Answer", "unheard"));
            assertEquals(0, bus.droppedCount());
        }

        private void await(CountDownLatch latch) {
            try {
                latch.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
