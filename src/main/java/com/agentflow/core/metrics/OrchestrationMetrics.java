package com.agentflow.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the orchestrator.
 */
@Service
public class OrchestrationMetrics {

    private final MeterRegistry registry;

    @Autowired
    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /** Metrics that are recorded but never exported. */
    public static OrchestrationMetrics noop() {
        return new OrchestrationMetrics(new SimpleMeterRegistry());
    }

    public void recordSweep(String sweep, Duration duration) {
        Timer.builder("agentflow.sweep.duration")
                .tag("sweep", sweep)
                .register(registry)
                .record(duration);
    }

    public void recordSweepFailure(String sweep) {
        Counter.builder("agentflow.sweep.failures")
                .tag("sweep", sweep)
                .register(registry)
                .increment();
    }

    public void recordAssignment(String role) {
        Counter.builder("agentflow.tasks.assigned")
                .tag("role", role)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome the advance kind, e.g. {@code handed_off} or {@code handoff_deferred}
     */
    public void recordAdvance(String outcome) {
        Counter.builder("agentflow.tasks.advanced")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordGovernorDecision(String action) {
        Counter.builder("agentflow.governor.decisions")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordNegotiationResolved(String status) {
        Counter.builder("agentflow.negotiations.resolved")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordVersionConflict(String operation) {
        Counter.builder("agentflow.version.conflicts")
                .description("Task updates rejected because another writer changed the task first")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
