package com.wayfinder.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.function.DoubleSupplier;
import java.util.function.IntConsumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retries a call with exponential backoff and jitter while the failure matches
 * the retryable predicate.
 * <p>
 * Delay before attempt {@code n+1} is {@code min(maxDelay, baseDelay * 2^(n-1))},
 * scaled by a random factor in {@code [1 - jitter, 1 + jitter]}.
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitter;
    private final Predicate<Throwable> retryable;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitter,
                       Predicate<Throwable> retryable) {
        this(maxAttempts, baseDelay, maxDelay, jitter, retryable,
                d -> Thread.sleep(d.toMillis()), () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitter,
                Predicate<Throwable> retryable, Sleeper sleeper, DoubleSupplier random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = Math.max(0.0, Math.min(1.0, jitter));
        this.retryable = retryable;
        this.sleeper = sleeper;
        this.random = random;
    }

    public static RetryPolicy from(LlmProperties.Retry config) {
        return new RetryPolicy(config.getMaxAttempts(), config.getBaseDelay(), config.getMaxDelay(),
                config.getJitter(), RetryPolicy::isTransient);
    }

    /**
     * Runs {@code call}, retrying retryable failures.
     *
     * @param onRetry invoked with the attempt number about to be made (2, 3, ...)
     */
    public <T> T execute(Supplier<T> call, IntConsumer onRetry) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                last = e;
                if (attempt == maxAttempts || !retryable.test(e)) {
                    throw e;
                }
                Duration delay = delayFor(attempt);
                log.warn("Transient failure on attempt {}/{} ({}), retrying in {} ms",
                        attempt, maxAttempts, e.getMessage(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new LlmCallException("Interrupted while waiting to retry", ie, false);
                }
                onRetry.accept(attempt + 1);
            }
        }
        throw last;
    }

    Duration delayFor(int failedAttempt) {
        long base = baseDelay.toMillis() * (1L << Math.min(failedAttempt - 1, 20));
        long capped = Math.min(base, maxDelay.toMillis());
        double factor = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
        return Duration.ofMillis(Math.max(0L, Math.round(capped * factor)));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default predicate: explicit retryable {@link LlmCallException}s, I/O and timeout causes,
     * and provider messages that signal throttling or temporary unavailability.
     */
    public static boolean isTransient(Throwable error) {
        if (error instanceof LlmCallException lce) {
            return lce.isRetryable();
        }
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof IOException || t instanceof TimeoutException) {
                return true;
            }
            String message = t.getMessage() != null ? t.getMessage().toLowerCase() : "";
            if (message.contains("throttl") || message.contains("rate limit") || message.contains("too many requests")
                    || message.contains("timeout") || message.contains("temporarily")) {
                return true;
            }
        }
        return false;
    }
}
