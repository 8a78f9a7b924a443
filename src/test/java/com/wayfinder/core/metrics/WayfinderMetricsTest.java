package com.wayfinder.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WayfinderMetricsTest {

    private SimpleMeterRegistry registry;
    private WayfinderMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new WayfinderMetrics(registry);
    }

    @Test
    @DisplayName("recordRequest counts requests per task type")
    void recordRequest() {
        metrics.recordRequest("agent");
        metrics.recordRequest("agent");
        metrics.recordRequest("navigate");

        assertEquals(2.0, registry.find("wayfinder.requests.total").tag("type", "agent").counter().count());
        assertEquals(1.0, registry.find("wayfinder.requests.total").tag("type", "navigate").counter().count());
    }

    @Test
    @DisplayName("recordTaskDuration creates a timer per type")
    void recordTaskDuration() {
        metrics.recordTaskDuration("act", 250);
        var timer = registry.find("wayfinder.task.duration").tag("type", "act").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("worker lifecycle counters track creation and close outcome")
    void workerLifecycle() {
        metrics.recordWorkerCreated();
        metrics.recordWorkerClosed("closed");
        metrics.recordWorkerClosed("timeout");
        metrics.recordWorkerClosed("timeout");

        assertEquals(1.0, registry.find("wayfinder.workers.created").counter().count());
        assertEquals(1.0, registry.find("wayfinder.workers.closed").tag("outcome", "closed").counter().count());
        assertEquals(2.0, registry.find("wayfinder.workers.closed").tag("outcome", "timeout").counter().count());
    }

    @Test
    @DisplayName("recordAgentTurns feeds a distribution per level")
    void recordAgentTurns() {
        metrics.recordAgentTurns("supervisor", 3);
        metrics.recordAgentTurns("supervisor", 1);

        var summary = registry.find("wayfinder.agent.turns").tag("level", "supervisor").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(4.0, summary.totalAmount());
    }

    @Test
    @DisplayName("retry and expiry counters increment by the given amount")
    void retriesAndExpiry() {
        metrics.recordLlmRetry();
        metrics.recordSessionsExpired(3);

        assertEquals(1.0, registry.find("wayfinder.llm.retries").counter().count());
        assertEquals(3.0, registry.find("wayfinder.sessions.expired").counter().count());
    }
}
