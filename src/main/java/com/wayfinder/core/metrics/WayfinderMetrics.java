package com.wayfinder.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for request handling and worker lifecycle.
 */
@Service
public class WayfinderMetrics {

    private final MeterRegistry registry;

    public WayfinderMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRequest(String taskType) {
        Counter.builder("wayfinder.requests.total")
                .tag("type", taskType)
                .register(registry)
                .increment();
    }

    public void recordTaskDuration(String taskType, long ms) {
        Timer.builder("wayfinder.task.duration")
                .tag("type", taskType)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordWorkerCreated() {
        Counter.builder("wayfinder.workers.created")
                .description("Worker processes launched and initialized")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "closed", "timeout", "error" or "abandoned"
     */
    public void recordWorkerClosed(String outcome) {
        Counter.builder("wayfinder.workers.closed")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * @param level "supervisor" or "agent"
     */
    public void recordAgentTurns(String level, int turns) {
        DistributionSummary.builder("wayfinder.agent.turns")
                .tag("level", level)
                .register(registry)
                .record(turns);
    }

    public void recordLlmRetry() {
        Counter.builder("wayfinder.llm.retries")
                .description("LLM calls retried after a transient failure")
                .register(registry)
                .increment();
    }

    public void recordSessionsExpired(int count) {
        Counter.builder("wayfinder.sessions.expired")
                .register(registry)
                .increment(count);
    }
}
