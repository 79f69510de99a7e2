package com.locus.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for worker runs.
 */
public class WorkerMetrics {

    private final MeterRegistry registry;

    public WorkerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome one of "in_review", "blocked", "failed"
     */
    public void recordTaskOutcome(String outcome) {
        Counter.builder("locus.tasks.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordTaskExecution(String provider, long ms) {
        Timer.builder("locus.task.duration")
                .tag("provider", provider)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void incrementDispatchRetries() {
        Counter.builder("locus.dispatch.retries")
                .description("Dispatch attempts that failed with a transient error")
                .register(registry)
                .increment();
    }

    public void incrementHeartbeatFailures() {
        Counter.builder("locus.heartbeat.failures")
                .register(registry)
                .increment();
    }

    public void recordSandboxCreated(String mode) {
        Counter.builder("locus.sandbox.created")
                .tag("mode", mode)
                .register(registry)
                .increment();
    }

    public void recordPushResult(boolean pushed) {
        Counter.builder("locus.git.push")
                .tag("result", pushed ? "pushed" : "failed")
                .register(registry)
                .increment();
    }
}
