package com.agentflow.core.scheduler;

import com.agentflow.core.events.OrchestrationEvent;
import com.agentflow.core.model.Agent;
import com.agentflow.core.model.AgentRole;
import com.agentflow.core.model.AgentStatus;
import com.agentflow.core.model.Communication;
import com.agentflow.core.model.CommunicationType;
import com.agentflow.core.model.HealthEvent;
import com.agentflow.core.model.HealthSeverity;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskPriority;
import com.agentflow.core.model.TaskStatus;
import com.agentflow.core.model.WorkflowStage;
import com.agentflow.core.reasoner.Reasoner;
import com.agentflow.core.reasoner.ReasonerResult;
import com.agentflow.core.reasoner.StagePipelineReasoner;
import com.agentflow.core.support.OrchestrationFixture;
import com.agentflow.core.workflow.WorkflowStageMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class OrchestrationSchedulerTest {

    private OrchestrationFixture fx;

    @BeforeEach
    void setUp() {
        fx = new OrchestrationFixture();
    }

    private void seedPipeline() {
        fx.agent(AgentRole.PRODUCT_MANAGER, "Priya", 5);
        fx.agent(AgentRole.BUSINESS_ANALYST, "Ben", 5);
        fx.agent(AgentRole.DEVELOPER, "Dana", 5);
        fx.agent(AgentRole.QA_ENGINEER, "Quinn", 5);
        fx.agent(AgentRole.PRODUCT_OWNER, "Olga", 5);
        fx.agent(AgentRole.ENGINEERING_LEAD, "Lee", 5);
    }

    private Task assigned(Agent agent, String title, TaskStatus status) {
        return fx.store.createTask(Task.newTask(title, "", TaskPriority.MEDIUM, null, fx.clock.instant())
                .assignedTo(agent.id())
                .withStatus(status));
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("start and stop are idempotent")
        void startStopIdempotent() {
            OrchestrationScheduler scheduler = fx.scheduler(new StagePipelineReasoner());

            assertTrue(scheduler.start());
            assertFalse(scheduler.start());
            assertTrue(scheduler.isRunning());
            assertTrue(scheduler.stop());
            assertFalse(scheduler.stop());
            assertFalse(scheduler.isRunning());
        }

        @Test
        @DisplayName("nothing runs before start or after stop")
        void noSweepsWhileStopped() {
            OrchestrationScheduler scheduler = fx.scheduler(new StagePipelineReasoner());
            fx.clock.advance(Duration.ofMinutes(20));
            assertEquals(0, scheduler.runDueSweeps());

            scheduler.start();
            fx.clock.advance(Duration.ofSeconds(2));
            assertEquals(1, scheduler.runDueSweeps());

            scheduler.stop();
            fx.clock.advance(Duration.ofMinutes(20));
            assertEquals(0, scheduler.runDueSweeps());
        }

        @Test
        @DisplayName("status reports sweeps and counts")
        void status() {
            seedPipeline();
            OrchestrationScheduler scheduler = fx.scheduler(new StagePipelineReasoner());
            fx.taskService.submit("One", "", TaskPriority.LOW);
            fx.taskService.submit("Two", "", TaskPriority.LOW);
            scheduler.start();

            OrchestratorStatus status = scheduler.getStatus();

            assertTrue(status.running());
            assertTrue(status.inFlightTaskIds().isEmpty());
            assertEquals(Map.of("pending", 2L), status.taskCountsByStatus());
            assertEquals(Map.of("active", 6L), status.agentCountsByStatus());
            assertEquals(List.of("process", "auto-assignment", "health", "governor"),
                    status.sweeps().stream().map(JobState::name).toList());
            assertEquals(fx.clock.instant().plusSeconds(2), status.sweeps().get(0).nextRunAt());
        }
    }

    @Nested
    @DisplayName("process and assignment")
    class Processing {

        @Test
        @DisplayName("a submitted task is auto-assigned but not processed before it is stale")
        void assignsThenWaits() {
            seedPipeline();
            Agent other = fx.agent(AgentRole.PRODUCT_MANAGER, "Omar", 5);
            fx.store.updateAgent(fx.reload(other).withHealthScore(40));
            AtomicInteger reasonerCalls = new AtomicInteger();
            OrchestrationScheduler scheduler = fx.scheduler((agent, task) -> {
                reasonerCalls.incrementAndGet();
                return ReasonerResult.completed("done");
            });
            scheduler.start();
            Task task = fx.taskService.submit("Checkout flow", "", TaskPriority.HIGH);

            fx.clock.advance(Duration.ofSeconds(10));
            scheduler.runDueSweeps();

            Task stored = fx.store.findTask(task.id()).orElseThrow();
            assertEquals(TaskStatus.ACTIVE, stored.status());
            assertEquals("Priya", fx.store.findAgent(stored.assignedAgentId()).orElseThrow().name());
            var assignments = fx.communications(task.id(), CommunicationType.TASK_ASSIGNMENT);
            assertEquals(1, assignments.size());
            assertNull(assignments.get(0).fromAgentId());
            assertEquals("Task \"Checkout flow\" has been automatically assigned to you.",
                    assignments.get(0).message());
            assertEquals(1, fx.events(OrchestrationEvent.TASK_ASSIGNED).size());
            assertEquals(0, reasonerCalls.get());
        }

        @Test
        @DisplayName("the stage pipeline carries a task from intake to completion")
        void fullPipeline() {
            seedPipeline();
            OrchestrationScheduler scheduler = fx.scheduler(new StagePipelineReasoner());
            scheduler.start();
            Task task = fx.taskService.submit("Checkout flow", "Build checkout", TaskPriority.HIGH);

            for (int i = 0; i < 200 && !fx.store.findTask(task.id()).orElseThrow().status().isTerminal(); i++) {
                fx.clock.advance(Duration.ofSeconds(2));
                scheduler.runDueSweeps();
            }

            Task done = fx.store.findTask(task.id()).orElseThrow();
            assertEquals(TaskStatus.COMPLETED, done.status());
            assertEquals(List.of(WorkflowStage.ELABORATION, WorkflowStage.IMPLEMENTATION,
                            WorkflowStage.VERIFICATION, WorkflowStage.ACCEPTANCE, WorkflowStage.COMPLETED),
                    done.workflow().history().stream().map(h -> h.stage()).toList());
            assertEquals(4, fx.communications(task.id(), CommunicationType.HANDOFF).size());
            assertEquals(1, fx.communications(task.id(), CommunicationType.WORKFLOW_COMPLETION).size());
            assertEquals(5, ((List<?>) done.metadata().get("artifacts")).size());
            assertTrue(fx.store.findAgents().stream().allMatch(a -> a.currentLoad() == 0));
        }

        @Test
        @DisplayName("a reasoner that throws fails the task")
        void reasonerExceptionFailsTask() {
            Agent pm = fx.agent(AgentRole.PRODUCT_MANAGER, "Priya", 5);
            Task task = assigned(pm, "Checkout flow", TaskStatus.ACTIVE);
            OrchestrationScheduler scheduler = fx.scheduler((agent, t) -> {
                throw new IllegalStateException("model unavailable");
            });
            fx.clock.advance(Duration.ofSeconds(31));

            scheduler.processSweep();

            Task failed = fx.store.findTask(task.id()).orElseThrow();
            assertEquals(TaskStatus.FAILED, failed.status());
            assertEquals("model unavailable", failed.metadata().get("error"));
            assertEquals(1, fx.store.findHealthEvents(pm.id()).size());
            assertTrue(scheduler.getStatus().inFlightTaskIds().isEmpty());
        }

        @Test
        @DisplayName("one task blowing up does not stop the rest of the sweep")
        void failingTaskDoesNotAbortSweep() {
            Agent pm = fx.agent(AgentRole.PRODUCT_MANAGER, "Priya", 5);
            Task broken = assigned(pm, "Checkout flow", TaskStatus.ACTIVE);
            Task healthy = assigned(pm, "Wish list", TaskStatus.ACTIVE);
            WorkflowStageMachine machine = spy(fx.stageMachine);
            doThrow(new IllegalStateException("store unavailable"))
                    .when(machine).advance(argThat(t -> t != null && t.id() == broken.id()), any(), any());
            OrchestrationScheduler scheduler = fx.scheduler((agent, t) -> ReasonerResult.completed("done"), machine);
            fx.clock.advance(Duration.ofSeconds(31));

            scheduler.processSweep();

            assertEquals(TaskStatus.ACTIVE, fx.store.findTask(broken.id()).orElseThrow().status());
            assertEquals(TaskStatus.COMPLETED, fx.store.findTask(healthy.id()).orElseThrow().status());
            verify(machine, times(2)).advance(any(), any(), any());
            assertTrue(scheduler.getStatus().inFlightTaskIds().isEmpty());
            assertFalse(fx.inFlight.contains(broken.id()));
        }

        @Test
        @DisplayName("a task already being processed is not picked up again")
        void inFlightTaskSkipped() {
            Agent pm = fx.agent(AgentRole.PRODUCT_MANAGER, "Priya", 5);
            Task task = assigned(pm, "Checkout flow", TaskStatus.ACTIVE);
            AtomicInteger calls = new AtomicInteger();
            List<List<Long>> inFlightSeen = new ArrayList<>();
            OrchestrationScheduler[] holder = new OrchestrationScheduler[1];
            Reasoner reentrant = (agent, t) -> {
                calls.incrementAndGet();
                inFlightSeen.add(holder[0].getStatus().inFlightTaskIds());
                holder[0].processSweep();
                return ReasonerResult.completed("done");
            };
            holder[0] = fx.scheduler(reentrant);
            fx.clock.advance(Duration.ofSeconds(31));

            holder[0].processSweep();

            assertEquals(1, calls.get());
            assertEquals(List.of(List.of(task.id())), inFlightSeen);
            assertEquals(TaskStatus.COMPLETED, fx.store.findTask(task.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("a fresh communication makes a task due before it is stale")
        void newCommunicationMakesTaskDue() {
            Agent pm = fx.agent(AgentRole.PRODUCT_MANAGER, "Priya", 5);
            Task task = assigned(pm, "Checkout flow", TaskStatus.ACTIVE);
            AtomicInteger calls = new AtomicInteger();
            OrchestrationScheduler scheduler = fx.scheduler((agent, t) -> {
                calls.incrementAndGet();
                return ReasonerResult.completed("done");
            });
            fx.clock.advance(Duration.ofSeconds(5));
            scheduler.processSweep();
            assertEquals(0, calls.get());

            fx.store.createCommunication(Communication.create(null, pm.id(), task.id(),
                    "Customer asked for Apple Pay", CommunicationType.INFORMATION, Map.of(), fx.clock.instant()));
            scheduler.processSweep();

            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("tasks of a paused agent are left alone")
        void pausedAgentSkipped() {
            Agent pm = fx.agent(AgentRole.PRODUCT_MANAGER, "Priya", 5);
            Task task = assigned(pm, "Checkout flow", TaskStatus.ACTIVE);
            fx.store.updateAgent(fx.reload(pm).withStatus(AgentStatus.PAUSED));
            AtomicInteger calls = new AtomicInteger();
            OrchestrationScheduler scheduler = fx.scheduler((agent, t) -> {
                calls.incrementAndGet();
                return ReasonerResult.completed("done");
            });
            fx.clock.advance(Duration.ofSeconds(31));

            scheduler.processSweep();

            assertEquals(0, calls.get());
            assertEquals(TaskStatus.ACTIVE, fx.store.findTask(task.id()).orElseThrow().status());
        }
    }

    @Nested
    @DisplayName("health sweep")
    class Health {

        @Test
        @DisplayName("relieves an overloaded agent by moving its oldest active task")
        void relievesOverload() {
            Agent busy = fx.agent(AgentRole.PRODUCT_MANAGER, "Priya", 5);
            Agent spare = fx.agent(AgentRole.PRODUCT_MANAGER, "Omar", 5);
            Task oldest = assigned(busy, "First", TaskStatus.ACTIVE);
            for (int i = 2; i <= 5; i++) {
                fx.clock.advance(Duration.ofSeconds(1));
                assigned(busy, "Task " + i, TaskStatus.ACTIVE);
            }
            OrchestrationScheduler scheduler = fx.scheduler(new StagePipelineReasoner());

            scheduler.healthSweep();

            assertEquals(spare.id(), fx.store.findTask(oldest.id()).orElseThrow().assignedAgentId());
            assertEquals(4, fx.reload(busy).currentLoad());
            assertEquals(AgentStatus.ACTIVE, fx.reload(busy).status());
            assertTrue(fx.healthEventRecorder.hasUnresolved(busy.id(), HealthEvent.OVERLOAD));
            assertEquals("Agent overloaded", fx.communications(oldest.id(), CommunicationType.TASK_REASSIGNMENT)
                    .get(0).metadata().get("reason"));
        }

        @Test
        @DisplayName("low health is recorded once while unresolved")
        void lowHealthDeduplicated() {
            Agent dev = fx.agent(AgentRole.DEVELOPER, "Dana", 5);
            fx.store.updateAgent(dev.withHealthScore(60));
            OrchestrationScheduler scheduler = fx.scheduler(new StagePipelineReasoner());

            scheduler.healthSweep();
            scheduler.healthSweep();

            assertEquals(1, fx.healthEventRecorder.countUnresolved(dev.id(), HealthEvent.LOW_HEALTH));
            assertTrue(fx.delivered.isEmpty());
        }

        @Test
        @DisplayName("repeated failures mark an agent unhealthy")
        void repeatedFailuresMarkUnhealthy() {
            Agent dev = fx.agent(AgentRole.DEVELOPER, "Dana", 5);
            for (int i = 0; i < 4; i++) {
                fx.healthEventRecorder.record(dev, HealthEvent.TASK_FAILURE, HealthSeverity.HIGH, "failed", Map.of());
            }
            OrchestrationScheduler scheduler = fx.scheduler(new StagePipelineReasoner());

            scheduler.healthSweep();

            Agent after = fx.reload(dev);
            assertEquals(AgentStatus.UNHEALTHY, after.status());
            assertEquals(OrchestrationScheduler.UNHEALTHY_SCORE, after.healthScore());
            assertEquals(1, fx.healthEventRecorder.countUnresolved(dev.id(), HealthEvent.REPEATED_FAILURES));
        }

        @Test
        @DisplayName("three failures stay under the threshold")
        void threeFailuresTolerated() {
            Agent dev = fx.agent(AgentRole.DEVELOPER, "Dana", 5);
            for (int i = 0; i < 3; i++) {
                fx.healthEventRecorder.record(dev, HealthEvent.TASK_FAILURE, HealthSeverity.HIGH, "failed", Map.of());
            }

            fx.scheduler(new StagePipelineReasoner()).healthSweep();

            assertEquals(AgentStatus.ACTIVE, fx.reload(dev).status());
        }
    }
}
