package com.agentflow.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OrchestrationMetricsTest {

    private SimpleMeterRegistry registry;
    private OrchestrationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OrchestrationMetrics(registry);
    }

    @Test
    @DisplayName("recordSweep creates a timer per sweep")
    void recordSweep() {
        metrics.recordSweep("process", Duration.ofMillis(12));
        metrics.recordSweep("process", Duration.ofMillis(8));
        metrics.recordSweep("health", Duration.ofMillis(3));

        var process = registry.find("agentflow.sweep.duration").tag("sweep", "process").timer();
        assertNotNull(process);
        assertEquals(2, process.count());
        assertNotNull(registry.find("agentflow.sweep.duration").tag("sweep", "health").timer());
    }

    @Test
    @DisplayName("recordSweepFailure counts by sweep")
    void recordSweepFailure() {
        metrics.recordSweepFailure("governor");

        var counter = registry.find("agentflow.sweep.failures").tag("sweep", "governor").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordAssignment counts by role")
    void recordAssignment() {
        metrics.recordAssignment("product_manager");
        metrics.recordAssignment("product_manager");
        metrics.recordAssignment("developer");

        assertEquals(2.0, registry.find("agentflow.tasks.assigned").tag("role", "product_manager").counter().count());
        assertEquals(1.0, registry.find("agentflow.tasks.assigned").tag("role", "developer").counter().count());
    }

    @Test
    @DisplayName("recordAdvance counts by outcome")
    void recordAdvance() {
        metrics.recordAdvance("handed_off");
        metrics.recordAdvance("completed");

        assertEquals(1.0, registry.find("agentflow.tasks.advanced").tag("outcome", "handed_off").counter().count());
        assertEquals(1.0, registry.find("agentflow.tasks.advanced").tag("outcome", "completed").counter().count());
    }

    @Test
    @DisplayName("governor, negotiation and conflict counters are tagged")
    void otherCounters() {
        metrics.recordGovernorDecision("send_ping");
        metrics.recordNegotiationResolved("agreed");
        metrics.recordVersionConflict("advance");

        assertEquals(1.0, registry.find("agentflow.governor.decisions").tag("action", "send_ping").counter().count());
        assertEquals(1.0, registry.find("agentflow.negotiations.resolved").tag("status", "agreed").counter().count());
        assertEquals(1.0, registry.find("agentflow.version.conflicts").tag("operation", "advance").counter().count());
    }
}
