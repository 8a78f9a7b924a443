package com.wayfinder.worker;

import com.wayfinder.core.browser.BrowserState;
import com.wayfinder.core.browser.BrowserStateManager;
import com.wayfinder.core.browser.BrowserStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Actuator health indicator for the browser worker pool.
 * Reports pool usage and the last known status of each session's browser.
 */
@Component
public class WorkerHealthIndicator implements HealthIndicator {

    private final SessionWorkerRegistry registry;
    private final BrowserStateManager browserStates;

    public WorkerHealthIndicator(SessionWorkerRegistry registry, BrowserStateManager browserStates) {
        this.registry = registry;
        this.browserStates = browserStates;
    }

    @Override
    public Health health() {
        int active = registry.activeWorkerCount();
        int capacity = registry.capacity();

        Map<String, String> statuses = new LinkedHashMap<>();
        boolean anyError = false;
        for (BrowserState state : browserStates.getAll()) {
            statuses.put(state.sessionId(), state.status().name().toLowerCase());
            anyError |= state.status() == BrowserStatus.ERROR;
        }

        var builder = active >= capacity ? Health.status("SATURATED") : Health.up();
        if (anyError && active < capacity) {
            builder = Health.status("DEGRADED");
        }
        return builder
                .withDetail("activeWorkers", active)
                .withDetail("capacity", capacity)
                .withDetail("browsers", statuses)
                .build();
    }
}
