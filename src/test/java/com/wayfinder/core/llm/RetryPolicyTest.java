package com.wayfinder.core.llm;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link RetryPolicy}.
 */
class RetryPolicyTest {

    private final List<Duration> sleeps = new ArrayList<>();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private RetryPolicy policy(int attempts, double randomValue) {
        return new RetryPolicy(attempts, Duration.ofSeconds(1), Duration.ofSeconds(20), 0.2,
                RetryPolicy::isTransient, sleeps::add, () -> randomValue);
    }

    @Nested
    @DisplayName("backoff")
    class BackoffTests {

        @Test
        @DisplayName("doubles the delay per attempt up to the cap")
        void exponentialWithCap() {
            RetryPolicy policy = policy(10, 0.5);

            assertEquals(Duration.ofSeconds(1), policy.delayFor(1));
            assertEquals(Duration.ofSeconds(2), policy.delayFor(2));
            assertEquals(Duration.ofSeconds(16), policy.delayFor(5));
            assertEquals(Duration.ofSeconds(20), policy.delayFor(6));
        }

        @Test
        @DisplayName("jitter scales the delay within +/- the configured fraction")
        void jitterBounds() {
            assertEquals(Duration.ofMillis(800), policy(3, 0.0).delayFor(1));
            assertEquals(Duration.ofMillis(1200), policy(3, 1.0).delayFor(1));
        }
    }

    @Nested
    @DisplayName("execute")
    class ExecuteTests {

        @Test
        @DisplayName("retries transient failures and reports each retry")
        void retriesTransient() {
            AtomicInteger calls = new AtomicInteger();
            List<Integer> retries = new ArrayList<>();

            String result = policy(3, 0.5).execute(() -> {
                if (calls.incrementAndGet() < 3) {
                    throw new LlmCallException("throttled", null, true);
                }
                return "ok";
            }, retries::add);

            assertEquals("ok", result);
            assertEquals(List.of(2, 3), retries);
            assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
        }

        @Test
        @DisplayName("does not retry non-retryable failures")
        void noRetryForPermanent() {
            AtomicInteger calls = new AtomicInteger();

            assertThrows(LlmCallException.class, () -> policy(3, 0.5).execute(() -> {
                calls.incrementAndGet();
                throw new LlmCallException("bad request", null, false);
            }, attempt -> { }));
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("gives up after maxAttempts and rethrows the last failure")
        void exhaustsAttempts() {
            AtomicInteger calls = new AtomicInteger();

            LlmCallException e = assertThrows(LlmCallException.class, () -> policy(2, 0.5).execute(() -> {
                throw new LlmCallException("timeout " + calls.incrementAndGet(), null, true);
            }, attempt -> { }));
            assertEquals("timeout 2", e.getMessage());
        }

        @Test
        @DisplayName("interruption while waiting aborts the retry loop")
        void interruptionAborts() {
            RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(20), 0.0,
                    RetryPolicy::isTransient, d -> { throw new InterruptedException(); }, () -> 0.5);

            LlmCallException e = assertThrows(LlmCallException.class, () -> policy.execute(() -> {
                throw new LlmCallException("rate limit", null, true);
            }, attempt -> { }));
            assertFalse(e.isRetryable());
            assertTrue(Thread.currentThread().isInterrupted());
        }

        @Test
        @DisplayName("rejects fewer than one attempt")
        void rejectsZeroAttempts() {
            assertThrows(IllegalArgumentException.class,
                    () -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 0, e -> true));
        }
    }

    @Test
    @DisplayName("isTransient recognizes I/O causes and throttling messages")
    void transientPredicate() {
        assertTrue(RetryPolicy.isTransient(new RuntimeException(new IOException("reset"))));
        assertTrue(RetryPolicy.isTransient(new UncheckedIOException(new IOException("reset"))));
        assertTrue(RetryPolicy.isTransient(new RuntimeException("ThrottlingException: slow down")));
        assertTrue(RetryPolicy.isTransient(new RuntimeException("Service temporarily unavailable")));
        assertFalse(RetryPolicy.isTransient(new RuntimeException("invalid api key")));
        assertFalse(RetryPolicy.isTransient(new LlmCallException("rejected", null, false)));
    }
}
