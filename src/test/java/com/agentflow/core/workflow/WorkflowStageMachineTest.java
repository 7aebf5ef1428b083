package com.agentflow.core.workflow;

import com.agentflow.core.events.OrchestrationEvent;
import com.agentflow.core.model.Agent;
import com.agentflow.core.model.AgentRole;
import com.agentflow.core.model.AgentStatus;
import com.agentflow.core.model.CommunicationType;
import com.agentflow.core.model.HealthEvent;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskPriority;
import com.agentflow.core.model.TaskStatus;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowHistoryEntry;
import com.agentflow.core.model.WorkflowStage;
import com.agentflow.core.reasoner.FollowUpTask;
import com.agentflow.core.reasoner.ReasonerResult;
import com.agentflow.core.support.OrchestrationFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowStageMachineTest {

    private OrchestrationFixture fx;
    private Agent pm;

    @BeforeEach
    void setUp() {
        fx = new OrchestrationFixture();
        pm = fx.agent(AgentRole.PRODUCT_MANAGER, "Priya", 5);
    }

    private Task assignedTask(Agent agent, TaskPriority priority) {
        Task task = fx.taskService.submit("Checkout flow", "Build checkout", priority);
        return fx.store.assignTask(task, agent.id(), TaskStatus.ACTIVE, fx.clock.instant());
    }

    /** Puts a task straight into a later pipeline stage, held by {@code agent}. */
    private Task taskAtStage(Agent agent, WorkflowStage stage) {
        Task task = fx.taskService.submit("Checkout flow", "", TaskPriority.MEDIUM);
        return fx.store.updateTask(task
                .assignedTo(agent.id())
                .withStatus(TaskStatus.IN_PROGRESS)
                .withWorkflow(task.workflow().enter(stage, stage.owner().orElseThrow(),
                        WorkflowHistoryEntry.of(agent, stage, fx.clock.instant()))));
    }

    @Nested
    @DisplayName("hand-off")
    class HandOff {

        @Test
        @DisplayName("moves the task to the best agent of the next role")
        void handsOffToNextRole() {
            Agent analyst = fx.agent(AgentRole.BUSINESS_ANALYST, "Ben", 5);
            Task task = assignedTask(pm, TaskPriority.HIGH);
            fx.clock.advance(Duration.ofSeconds(40));

            AdvanceResult result = fx.stageMachine.advance(task, pm,
                    StageOutcome.of(task, ReasonerResult.handOff("Requirements drafted", "business_analyst")));

            assertEquals(AdvanceResult.Kind.HANDED_OFF, result.kind());
            Task stored = fx.store.findTask(task.id()).orElseThrow();
            assertEquals(WorkflowStage.ELABORATION, stored.workflow().stage());
            assertEquals("business_analyst", stored.workflow().nextRoleTag());
            assertEquals(TaskStatus.IN_PROGRESS, stored.status());
            assertEquals(analyst.id(), stored.assignedAgentId());
            assertEquals(fx.clock.instant(), stored.updatedAt());
            assertEquals(1, stored.workflow().history().size());
            assertEquals(analyst.id(), stored.workflow().history().get(0).agentId());

            assertEquals(0, fx.reload(pm).currentLoad());
            assertEquals(1, fx.reload(analyst).currentLoad());

            var handoffs = fx.communications(task.id(), CommunicationType.HANDOFF);
            assertEquals(1, handoffs.size());
            assertEquals(pm.id(), handoffs.get(0).fromAgentId());
            assertEquals(analyst.id(), handoffs.get(0).toAgentId());
            assertEquals("elaboration", handoffs.get(0).metadata().get("toStage"));
            assertEquals(1, fx.communications(task.id(), CommunicationType.TASK_RESPONSE).size());
            assertEquals(1, fx.events(OrchestrationEvent.STAGE_ADVANCED).size());
        }

        @Test
        @DisplayName("a duplicate outcome for the same stage is a no-op")
        void duplicateAdvanceIsNoop() {
            fx.agent(AgentRole.BUSINESS_ANALYST, "Ben", 5);
            Task task = assignedTask(pm, TaskPriority.MEDIUM);
            StageOutcome outcome = StageOutcome.of(task, ReasonerResult.handOff("done", "business_analyst"));

            AdvanceResult first = fx.stageMachine.advance(task, pm, outcome);
            AdvanceResult second = fx.stageMachine.advance(task, pm, outcome);

            assertEquals(AdvanceResult.Kind.HANDED_OFF, first.kind());
            assertEquals(AdvanceResult.Kind.NOOP, second.kind());
            assertFalse(second.changedTask());
            Task stored = fx.store.findTask(task.id()).orElseThrow();
            assertEquals(1, stored.workflow().history().size());
            assertEquals(1, fx.communications(task.id(), CommunicationType.HANDOFF).size());
            assertEquals(1, fx.communications(task.id(), CommunicationType.TASK_RESPONSE).size());
        }

        @Test
        @DisplayName("an outcome computed against an older version is dropped")
        void staleVersionIsNoop() {
            fx.agent(AgentRole.BUSINESS_ANALYST, "Ben", 5);
            Task task = assignedTask(pm, TaskPriority.MEDIUM);
            StageOutcome outcome = StageOutcome.of(task, ReasonerResult.handOff("done", "business_analyst"));
            fx.store.updateTask(task.withMetadata("note", "edited").touchedAt(fx.clock.instant()));

            AdvanceResult result = fx.stageMachine.advance(task, pm, outcome);

            assertEquals(AdvanceResult.Kind.NOOP, result.kind());
            assertEquals(WorkflowStage.INTAKE, fx.store.findTask(task.id()).orElseThrow().workflow().stage());
        }

        @Test
        @DisplayName("an outcome from an agent that no longer holds the task is dropped")
        void wrongAgentIsNoop() {
            Agent other = fx.agent(AgentRole.PRODUCT_MANAGER, "Omar", 5);
            Task task = assignedTask(pm, TaskPriority.MEDIUM);

            AdvanceResult result = fx.stageMachine.advance(task, other,
                    StageOutcome.of(task, ReasonerResult.completed("done")));

            assertEquals(AdvanceResult.Kind.NOOP, result.kind());
            assertEquals(TaskStatus.ACTIVE, fx.store.findTask(task.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("defers when no agent of the next role is active, then retries")
        void deferredHandoffIsRetried() {
            Task task = assignedTask(pm, TaskPriority.MEDIUM);

            AdvanceResult deferred = fx.stageMachine.advance(task, pm,
                    StageOutcome.of(task, ReasonerResult.handOff("done", "business_analyst")));

            assertEquals(AdvanceResult.Kind.HANDOFF_DEFERRED, deferred.kind());
            Task waiting = fx.store.findTask(task.id()).orElseThrow();
            assertTrue(waiting.workflow().handoffPending());
            assertEquals(WorkflowStage.INTAKE, waiting.workflow().stage());
            assertEquals(pm.id(), waiting.assignedAgentId());

            assertEquals(AdvanceResult.Kind.NOOP, fx.stageMachine.retryHandoff(waiting).kind());

            Agent analyst = fx.agent(AgentRole.BUSINESS_ANALYST, "Ben", 5);
            AdvanceResult retried = fx.stageMachine.retryHandoff(waiting);

            assertEquals(AdvanceResult.Kind.HANDED_OFF, retried.kind());
            Task moved = fx.store.findTask(task.id()).orElseThrow();
            assertFalse(moved.workflow().handoffPending());
            assertEquals(WorkflowStage.ELABORATION, moved.workflow().stage());
            assertEquals(analyst.id(), moved.assignedAgentId());
            assertEquals(0, fx.reload(pm).currentLoad());
        }

        @Test
        @DisplayName("a busy agent of the next role is not chosen")
        void busyAgentNotChosen() {
            Agent analyst = fx.agent(AgentRole.BUSINESS_ANALYST, "Ben", 5);
            fx.store.updateAgent(analyst.withStatus(AgentStatus.BUSY));
            Task task = assignedTask(pm, TaskPriority.MEDIUM);

            AdvanceResult result = fx.stageMachine.advance(task, pm,
                    StageOutcome.of(task, ReasonerResult.handOff("done", "business_analyst")));

            assertEquals(AdvanceResult.Kind.HANDOFF_DEFERRED, result.kind());
        }
    }

    @Nested
    @DisplayName("terminal and recovery outcomes")
    class Outcomes {

        @Test
        @DisplayName("an outcome naming no next role completes the task")
        void completesAtAcceptance() {
            Agent owner = fx.agent(AgentRole.PRODUCT_OWNER, "Olga", 5);
            Task task = taskAtStage(owner, WorkflowStage.ACCEPTANCE);
            assertEquals(1, fx.reload(owner).currentLoad());

            AdvanceResult result = fx.stageMachine.advance(task, owner,
                    StageOutcome.of(task, ReasonerResult.completed("Accepted")));

            assertEquals(AdvanceResult.Kind.COMPLETED, result.kind());
            Task stored = fx.store.findTask(task.id()).orElseThrow();
            assertEquals(TaskStatus.COMPLETED, stored.status());
            assertEquals(WorkflowStage.COMPLETED, stored.workflow().stage());
            assertNull(stored.workflow().nextRoleTag());
            assertEquals(fx.clock.instant(), stored.completedAt());
            assertEquals(0, fx.reload(owner).currentLoad());
            assertEquals(1, fx.communications(task.id(), CommunicationType.WORKFLOW_COMPLETION).size());
            assertEquals(1, fx.events(OrchestrationEvent.TASK_COMPLETED).size());
        }

        @Test
        @DisplayName("escalation routes the task to the recovery role")
        void escalatesToEngineeringLead() {
            Agent dev = fx.agent(AgentRole.DEVELOPER, "Dana", 5);
            Agent lead = fx.agent(AgentRole.ENGINEERING_LEAD, "Lee", 5);
            Task task = taskAtStage(dev, WorkflowStage.IMPLEMENTATION);

            AdvanceResult result = fx.stageMachine.advance(task, dev,
                    StageOutcome.of(task, ReasonerResult.escalate("Blocked", "Needs architecture review")));

            assertEquals(AdvanceResult.Kind.ESCALATED, result.kind());
            Task stored = fx.store.findTask(task.id()).orElseThrow();
            assertEquals(TaskStatus.ESCALATED, stored.status());
            assertEquals(WorkflowStage.ESCALATED, stored.workflow().stage());
            assertEquals("engineering_lead", stored.workflow().nextRoleTag());
            assertEquals(lead.id(), stored.assignedAgentId());

            var escalations = fx.communications(task.id(), CommunicationType.ESCALATION);
            assertEquals(1, escalations.size());
            assertEquals("Needs architecture review", escalations.get(0).metadata().get("escalationReason"));
            assertEquals(lead.id(), escalations.get(0).toAgentId());
        }

        @Test
        @DisplayName("an unknown next role escalates instead of handing off")
        void unknownRoleEscalates() {
            fx.agent(AgentRole.ENGINEERING_LEAD, "Lee", 5);
            Task task = assignedTask(pm, TaskPriority.MEDIUM);

            AdvanceResult result = fx.stageMachine.advance(task, pm,
                    StageOutcome.of(task, ReasonerResult.handOff("done", "astronaut")));

            assertEquals(AdvanceResult.Kind.ESCALATED, result.kind());
            assertEquals("Unknown next role: astronaut", fx.communications(task.id(), CommunicationType.ESCALATION)
                    .get(0).metadata().get("escalationReason"));
        }

        @Test
        @DisplayName("failure is terminal and raises a health event and alert")
        void failureRecordsHealthEvent() {
            Task task = assignedTask(pm, TaskPriority.MEDIUM);

            AdvanceResult result = fx.stageMachine.advance(task, pm,
                    StageOutcome.of(task, ReasonerResult.failure("model timeout")));

            assertEquals(AdvanceResult.Kind.FAILED, result.kind());
            Task stored = fx.store.findTask(task.id()).orElseThrow();
            assertEquals(TaskStatus.FAILED, stored.status());
            assertEquals("model timeout", stored.metadata().get("error"));
            assertEquals(0, fx.reload(pm).currentLoad());

            List<HealthEvent> healthEvents = fx.store.findHealthEvents(pm.id());
            assertEquals(1, healthEvents.size());
            assertEquals(HealthEvent.TASK_FAILURE, healthEvents.get(0).type());
            assertEquals(1, fx.delivered.size());
            assertEquals("agent_health", fx.delivered.get(0).type());
            assertTrue(fx.store.findNotifications().get(0).sent());
        }

        @Test
        @DisplayName("help skills put the task into collaboration")
        void collaborates() {
            Agent dev = fx.agent(AgentRole.DEVELOPER, "Dana", 5);
            Agent ops = fx.agent(AgentRole.DEVOPS_ENGINEER, "Otto", 5, "kubernetes");
            Task task = taskAtStage(dev, WorkflowStage.IMPLEMENTATION);

            AdvanceResult result = fx.stageMachine.advance(task, dev, StageOutcome.of(task,
                    ReasonerResult.handOff("stuck on deploy", "qa_engineer").withHelpSkills(List.of("kubernetes"))));

            assertEquals(AdvanceResult.Kind.COLLABORATIVE, result.kind());
            Task stored = fx.store.findTask(task.id()).orElseThrow();
            assertEquals(TaskStatus.COLLABORATIVE, stored.status());
            assertEquals(List.of(ops.id()), stored.metadata().get("helpRequestedFrom"));
            assertEquals(WorkflowStage.IMPLEMENTATION, stored.workflow().stage());
        }

        @Test
        @DisplayName("follow-ups become pending child tasks inheriting priority")
        void followUpsInheritPriority() {
            fx.agent(AgentRole.BUSINESS_ANALYST, "Ben", 5);
            Task task = assignedTask(pm, TaskPriority.HIGH);
            ReasonerResult outcome = ReasonerResult.handOff("done", "business_analyst")
                    .withFollowUps(List.of(
                            FollowUpTask.of("Write API docs", "for checkout"),
                            new FollowUpTask("Load test", "", TaskPriority.LOW)));

            AdvanceResult result = fx.stageMachine.advance(task, pm, StageOutcome.of(task, outcome));

            assertEquals(2, result.followUps().size());
            Task docs = result.followUps().get(0);
            assertEquals(TaskStatus.PENDING, docs.status());
            assertNull(docs.assignedAgentId());
            assertEquals(task.id(), docs.parentTaskId());
            assertEquals(TaskPriority.HIGH, docs.priority());
            assertEquals(Boolean.TRUE, docs.metadata().get("autoGenerated"));
            assertEquals(WorkflowStage.INTAKE, docs.workflow().stage());
            assertEquals(TaskPriority.LOW, result.followUps().get(1).priority());
        }

        @Test
        @DisplayName("artifacts are appended to task metadata")
        void artifactsAccumulate() {
            fx.agent(AgentRole.BUSINESS_ANALYST, "Ben", 5);
            Task task = assignedTask(pm, TaskPriority.MEDIUM);

            fx.stageMachine.advance(task, pm, StageOutcome.of(task,
                    ReasonerResult.handOff("done", "business_analyst").withArtifacts(List.of("prd.md"))));

            assertEquals(List.of("prd.md"), fx.store.findTask(task.id()).orElseThrow().metadata().get("artifacts"));
        }
    }

    @Test
    @DisplayName("workflow history is never rewritten")
    void historyOnlyGrows() {
        Task task = fx.taskService.submit("Checkout flow", "", TaskPriority.MEDIUM);
        Task entered = fx.store.updateTask(task.withWorkflow(task.workflow().enter(WorkflowStage.ELABORATION,
                AgentRole.BUSINESS_ANALYST, WorkflowHistoryEntry.of(null, WorkflowStage.ELABORATION,
                        fx.clock.instant()))));

        assertThrows(IllegalStateException.class,
                () -> fx.store.updateTask(entered.withWorkflow(Workflow.initial())));
    }
}
