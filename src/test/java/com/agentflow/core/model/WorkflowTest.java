package com.agentflow.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    private static WorkflowHistoryEntry entry(WorkflowStage stage) {
        return new WorkflowHistoryEntry(1L, "Ada", stage, NOW);
    }

    @Nested
    @DisplayName("stages")
    class Stages {

        @Test
        @DisplayName("pipeline order runs intake to acceptance")
        void order() {
            assertEquals(Optional.of(WorkflowStage.ELABORATION), WorkflowStage.INTAKE.next());
            assertEquals(Optional.of(WorkflowStage.ACCEPTANCE), WorkflowStage.VERIFICATION.next());
            assertTrue(WorkflowStage.ACCEPTANCE.next().isEmpty());
            assertTrue(WorkflowStage.ESCALATED.next().isEmpty());
        }

        @Test
        @DisplayName("each pipeline stage has one owning role")
        void owners() {
            assertEquals(Optional.of(WorkflowStage.IMPLEMENTATION), WorkflowStage.ownedBy(AgentRole.DEVELOPER));
            assertTrue(WorkflowStage.ownedBy(AgentRole.ENGINEERING_LEAD).isEmpty());
            assertFalse(WorkflowStage.COMPLETED.isPipeline());
        }

        @Test
        @DisplayName("role tags resolve case-insensitively")
        void roleTags() {
            assertEquals(Optional.of(AgentRole.QA_ENGINEER), AgentRole.fromTag(" QA_Engineer "));
            assertTrue(AgentRole.fromTag("janitor").isEmpty());
            assertThrows(IllegalArgumentException.class, () -> AgentRole.of("janitor"));
        }
    }

    @Nested
    @DisplayName("history")
    class History {

        @Test
        @DisplayName("entering a stage appends and clears a pending hand-off")
        void enterAppends() {
            Workflow waiting = Workflow.initial().awaitingHandoff(AgentRole.BUSINESS_ANALYST);
            assertTrue(waiting.handoffPending());
            assertEquals(WorkflowStage.INTAKE, waiting.stage());

            Workflow entered = waiting.enter(WorkflowStage.ELABORATION, AgentRole.BUSINESS_ANALYST,
                    entry(WorkflowStage.ELABORATION));

            assertFalse(entered.handoffPending());
            assertEquals(List.of(entry(WorkflowStage.ELABORATION)), entered.history());
            assertEquals(Optional.of(AgentRole.BUSINESS_ANALYST), entered.requiredRole());
        }

        @Test
        @DisplayName("completion leaves no required role")
        void completedHasNoRole() {
            Workflow done = Workflow.initial().enter(WorkflowStage.COMPLETED, null, entry(WorkflowStage.COMPLETED));
            assertNull(done.nextRoleTag());
            assertTrue(done.requiredRole().isEmpty());
        }

        @Test
        @DisplayName("only extensions count as prefixes")
        void prefix() {
            Workflow one = Workflow.initial().enter(WorkflowStage.ELABORATION, AgentRole.BUSINESS_ANALYST,
                    entry(WorkflowStage.ELABORATION));
            Workflow two = one.enter(WorkflowStage.IMPLEMENTATION, AgentRole.DEVELOPER,
                    entry(WorkflowStage.IMPLEMENTATION));
            Workflow forked = Workflow.initial().enter(WorkflowStage.ESCALATED, AgentRole.ENGINEERING_LEAD,
                    entry(WorkflowStage.ESCALATED));

            assertTrue(one.isPrefixOf(two));
            assertTrue(one.isPrefixOf(one));
            assertFalse(two.isPrefixOf(one));
            assertFalse(one.isPrefixOf(forked));
        }
    }

    @Nested
    @DisplayName("agent load")
    class Load {

        @Test
        @DisplayName("load is floored at zero and toggles busy at capacity")
        void withLoad() {
            Agent agent = Agent.create(AgentRole.DEVELOPER, "Dex", 2, Set.of(), NOW);

            assertEquals(AgentStatus.BUSY, agent.withLoad(2).status());
            assertEquals(AgentStatus.ACTIVE, agent.withLoad(2).withLoad(1).status());
            assertEquals(0, agent.withLoad(-3).currentLoad());
            assertEquals(AgentStatus.UNHEALTHY,
                    agent.withStatus(AgentStatus.UNHEALTHY).withLoad(5).status());
        }

        @Test
        @DisplayName("health is clamped to 0-100")
        void healthClamped() {
            Agent agent = Agent.create(AgentRole.DEVELOPER, "Dex", 2, Set.of(), NOW);
            assertEquals(100, agent.withHealthScore(140).healthScore());
            assertEquals(0, agent.withHealthScore(-5).healthScore());
        }
    }
}
