package com.wayfinder.core.execution;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for one session's running task. Loops poll
 * {@link #isCancellationRequested()} between turns; nothing is interrupted.
 */
public final class CancellationToken {

    private final AtomicBoolean requested = new AtomicBoolean();

    /** Returns {@code true} if this call flipped the token. */
    public boolean cancel() {
        return requested.compareAndSet(false, true);
    }

    public boolean isCancellationRequested() {
        return requested.get();
    }
}
