package com.agentflow.core.roster;

import com.agentflow.core.config.RosterProperties;
import com.agentflow.core.model.Agent;
import com.agentflow.core.model.AgentRole;
import com.agentflow.core.model.AgentStatus;
import com.agentflow.core.model.HealthEvent;
import com.agentflow.core.model.HealthSeverity;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskPriority;
import com.agentflow.core.model.TaskStatus;
import com.agentflow.core.support.OrchestrationFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RosterServiceTest {

    private OrchestrationFixture fx;
    private RosterProperties properties;
    private RosterService roster;

    @BeforeEach
    void setUp() {
        fx = new OrchestrationFixture();
        properties = new RosterProperties();
        roster = new RosterService(fx.store, properties, fx.healthEventRecorder, fx.clock);
    }

    private static RosterProperties.AgentDefinition definition(String role, String name, int maxLoad,
                                                               String... skills) {
        var definition = new RosterProperties.AgentDefinition();
        definition.setRole(role);
        definition.setName(name);
        definition.setMaxLoad(maxLoad);
        definition.setSkills(List.of(skills));
        return definition;
    }

    @Nested
    @DisplayName("seedIfEmpty")
    class Seed {

        @Test
        @DisplayName("creates the configured agents, active and idle")
        void seedsEmptyStore() {
            properties.setAgents(List.of(
                    definition("product_manager", "Priya", 5, "planning"),
                    definition("QA_Engineer", "Quinn", 3)));

            assertEquals(2, roster.seedIfEmpty());

            List<Agent> agents = roster.listAgents();
            assertEquals(List.of("Priya", "Quinn"), agents.stream().map(Agent::name).toList());
            assertEquals(AgentRole.QA_ENGINEER, agents.get(1).role());
            assertEquals(Set.of("planning"), agents.get(0).capabilities());
            assertTrue(agents.stream().allMatch(a -> a.status() == AgentStatus.ACTIVE
                    && a.currentLoad() == 0 && a.healthScore() == 100));
        }

        @Test
        @DisplayName("leaves an existing roster alone")
        void skipsWhenAgentsExist() {
            fx.agent(AgentRole.DEVELOPER, "Dana", 5);
            properties.setAgents(List.of(definition("product_manager", "Priya", 5)));

            assertEquals(0, roster.seedIfEmpty());
            assertEquals(1, roster.listAgents().size());
        }

        @Test
        @DisplayName("rejects an unknown role")
        void unknownRole() {
            properties.setAgents(List.of(definition("astronaut", "Neil", 5)));

            var e = assertThrows(IllegalArgumentException.class, () -> roster.seedIfEmpty());
            assertTrue(e.getMessage().contains("astronaut"));
        }
    }

    @Nested
    @DisplayName("pause and resume")
    class PauseResume {

        @Test
        @DisplayName("pausing and resuming an idle agent")
        void pauseThenResume() {
            Agent dev = fx.agent(AgentRole.DEVELOPER, "Dana", 5);

            assertEquals(AgentStatus.PAUSED, roster.pauseAgent(dev.id()).orElseThrow().status());
            assertEquals(AgentStatus.ACTIVE, roster.resumeAgent(dev.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("an agent at capacity resumes as busy")
        void resumesBusyAtCapacity() {
            Agent dev = fx.agent(AgentRole.DEVELOPER, "Dana", 1);
            fx.store.createTask(Task.newTask("Fix build", "", TaskPriority.HIGH, null, fx.clock.instant())
                    .assignedTo(dev.id()).withStatus(TaskStatus.ACTIVE));
            roster.pauseAgent(dev.id());

            assertEquals(AgentStatus.BUSY, roster.resumeAgent(dev.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("resuming an unhealthy agent restores health and resolves its events")
        void resumesUnhealthy() {
            Agent dev = fx.agent(AgentRole.DEVELOPER, "Dana", 5);
            fx.healthEventRecorder.record(dev, HealthEvent.TASK_FAILURE, HealthSeverity.HIGH, "failed", Map.of());
            fx.healthEventRecorder.record(dev, HealthEvent.REPEATED_FAILURES, HealthSeverity.CRITICAL, "failed",
                    Map.of());
            fx.store.updateAgent(fx.reload(dev).withStatus(AgentStatus.UNHEALTHY).withHealthScore(25));

            Agent resumed = roster.resumeAgent(dev.id()).orElseThrow();

            assertEquals(AgentStatus.ACTIVE, resumed.status());
            assertEquals(RosterService.FULL_HEALTH, resumed.healthScore());
            assertFalse(fx.healthEventRecorder.hasUnresolved(dev.id(), HealthEvent.TASK_FAILURE));
            assertFalse(fx.healthEventRecorder.hasUnresolved(dev.id(), HealthEvent.REPEATED_FAILURES));
        }

        @Test
        @DisplayName("unknown agents yield empty")
        void unknownAgent() {
            assertTrue(roster.pauseAgent(99).isEmpty());
            assertTrue(roster.resumeAgent(99).isEmpty());
        }
    }
}
