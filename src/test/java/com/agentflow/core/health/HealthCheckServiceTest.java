package com.agentflow.core.health;

import com.agentflow.core.model.Agent;
import com.agentflow.core.model.AgentRole;
import com.agentflow.core.model.AgentStatus;
import com.agentflow.core.scheduler.OrchestrationScheduler;
import com.agentflow.core.store.InMemoryOrchestrationStore;
import com.agentflow.core.store.OrchestrationStore;
import com.agentflow.core.store.StoreProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private InMemoryOrchestrationStore store;
    private OrchestrationScheduler scheduler;
    private HealthCheckService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryOrchestrationStore();
        scheduler = mock(OrchestrationScheduler.class);
        service = new HealthCheckService(store, scheduler, new StoreProperties());
    }

    private Agent agent(AgentRole role, AgentStatus status) {
        Agent created = store.createAgent(Agent.create(role, role.tag(), 5, Set.of(), Instant.EPOCH));
        return store.updateAgent(created.withStatus(status));
    }

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component().key())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("checkAll returns store, scheduler and roster components")
    void checkAllReturnsAllComponents() {
        var components = service.checkAll().stream().map(s -> s.component().key()).toList();
        assertEquals(List.of("store", "scheduler", "roster"), components);
    }

    @Test
    @DisplayName("Empty roster -> roster DOWN, overall unhealthy")
    void emptyRosterDown() {
        List<HealthStatus> results = service.checkAll();

        assertEquals(HealthStatus.Status.UP, component(results, "store").status());
        assertEquals("memory", component(results, "store").metadata().get("type"));
        assertEquals(HealthStatus.Status.DOWN, component(results, "roster").status());
        assertFalse(HealthCheckService.isHealthy(results));
    }

    @Test
    @DisplayName("Running scheduler and working agents -> all UP")
    void allUp() {
        when(scheduler.isRunning()).thenReturn(true);
        agent(AgentRole.PRODUCT_MANAGER, AgentStatus.ACTIVE);
        agent(AgentRole.DEVELOPER, AgentStatus.BUSY);

        List<HealthStatus> results = service.checkAll();

        assertTrue(results.stream().allMatch(s -> s.status() == HealthStatus.Status.UP));
        assertEquals(2L, component(results, "roster").metadata().get("working"));
        assertEquals(2, component(results, "store").metadata().get("agents"));
        assertEquals(0, component(results, "store").metadata().get("tasks"));
        assertTrue(HealthCheckService.isHealthy(results));
    }

    @Test
    @DisplayName("Stopped scheduler -> DEGRADED but still healthy")
    void stoppedSchedulerDegraded() {
        agent(AgentRole.PRODUCT_MANAGER, AgentStatus.ACTIVE);

        List<HealthStatus> results = service.checkAll();

        assertEquals(HealthStatus.Status.DEGRADED, component(results, "scheduler").status());
        assertTrue(HealthCheckService.isHealthy(results));
    }

    @Test
    @DisplayName("Unhealthy agent -> roster DEGRADED")
    void unhealthyAgentDegraded() {
        agent(AgentRole.PRODUCT_MANAGER, AgentStatus.ACTIVE);
        agent(AgentRole.DEVELOPER, AgentStatus.UNHEALTHY);

        assertEquals(HealthStatus.Status.DEGRADED, component(service.checkAll(), "roster").status());
    }

    @Test
    @DisplayName("Nobody able to work -> roster DOWN")
    void nobodyWorkingDown() {
        agent(AgentRole.PRODUCT_MANAGER, AgentStatus.PAUSED);
        agent(AgentRole.DEVELOPER, AgentStatus.INACTIVE);

        assertEquals(HealthStatus.Status.DOWN, component(service.checkAll(), "roster").status());
    }

    @Test
    @DisplayName("Failing store -> store DOWN")
    void failingStoreDown() {
        OrchestrationStore broken = mock(OrchestrationStore.class);
        when(broken.findAgents()).thenThrow(new IllegalStateException("connection refused"));
        var failing = new HealthCheckService(broken, scheduler, new StoreProperties());

        List<HealthStatus> results = failing.checkAll();

        assertEquals(HealthStatus.Status.DOWN, component(results, "store").status());
        assertEquals("Store error: connection refused", component(results, "store").detail());
        assertEquals(HealthStatus.Status.DOWN, component(results, "roster").status());
    }
}
