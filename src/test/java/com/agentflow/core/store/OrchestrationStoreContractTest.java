package com.agentflow.core.store;

import com.agentflow.core.model.Agent;
import com.agentflow.core.model.AgentRole;
import com.agentflow.core.model.AgentStatus;
import com.agentflow.core.model.Communication;
import com.agentflow.core.model.CommunicationType;
import com.agentflow.core.model.HealthEvent;
import com.agentflow.core.model.HealthSeverity;
import com.agentflow.core.model.Notification;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskPriority;
import com.agentflow.core.model.TaskStatus;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowHistoryEntry;
import com.agentflow.core.model.WorkflowStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link OrchestrationStore} implementation must share.
 */
abstract class OrchestrationStoreContractTest {

    protected static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    protected OrchestrationStore store;

    protected abstract OrchestrationStore createStore() throws Exception;

    @BeforeEach
    void setUpStore() throws Exception {
        store = createStore();
    }

    private Agent agent(AgentRole role, String name, int maxLoad) {
        return store.createAgent(Agent.create(role, name, maxLoad, Set.of("java"), T0));
    }

    private Task task(String title, Instant createdAt) {
        return store.createTask(Task.newTask(title, "desc", TaskPriority.HIGH, null, createdAt));
    }

    // -- agents ---------------------------------------------------------------

    @Nested
    @DisplayName("agents")
    class Agents {

        @Test
        @DisplayName("created agents get ids and round-trip")
        void createAndFind() {
            Agent created = agent(AgentRole.DEVELOPER, "Dana", 5);

            assertTrue(created.id() > 0);
            Agent found = store.findAgent(created.id()).orElseThrow();
            assertEquals(created, found);
            assertEquals(Set.of("java"), found.capabilities());
        }

        @Test
        @DisplayName("lists by role in id order")
        void findByRole() {
            Agent first = agent(AgentRole.DEVELOPER, "Dana", 5);
            agent(AgentRole.QA_ENGINEER, "Quinn", 5);
            Agent second = agent(AgentRole.DEVELOPER, "Dev", 5);

            assertEquals(List.of(first.id(), second.id()),
                    store.findAgentsByRole(AgentRole.DEVELOPER).stream().map(Agent::id).toList());
            assertEquals(3, store.findAgents().size());
        }

        @Test
        @DisplayName("updating a missing agent fails")
        void updateMissing() {
            Agent ghost = Agent.create(AgentRole.DEVELOPER, "Ghost", 5, Set.of(), T0).withId(999);
            assertThrows(RecordNotFoundException.class, () -> store.updateAgent(ghost));
        }

        @Test
        @DisplayName("updates persist status and health")
        void updatePersists() {
            Agent dev = agent(AgentRole.DEVELOPER, "Dana", 5);
            store.updateAgent(dev.withStatus(AgentStatus.UNHEALTHY).withHealthScore(25));

            Agent found = store.findAgent(dev.id()).orElseThrow();
            assertEquals(AgentStatus.UNHEALTHY, found.status());
            assertEquals(25, found.healthScore());
        }
    }

    // -- tasks ----------------------------------------------------------------

    @Nested
    @DisplayName("tasks")
    class Tasks {

        @Test
        @DisplayName("a created task starts at version 0 and round-trips its workflow")
        void createAndFind() {
            Task created = task("Checkout", T0);

            Task found = store.findTask(created.id()).orElseThrow();
            assertEquals(0, found.version());
            assertEquals(TaskStatus.PENDING, found.status());
            assertEquals(TaskPriority.HIGH, found.priority());
            assertEquals(WorkflowStage.INTAKE, found.workflow().stage());
            assertEquals("product_manager", found.workflow().nextRoleTag());
            assertEquals(T0, found.createdAt());
            assertNull(found.completedAt());
        }

        @Test
        @DisplayName("listings are newest first")
        void newestFirst() {
            Task older = task("Older", T0);
            Task newer = task("Newer", T0.plusSeconds(60));

            assertEquals(List.of(newer.id(), older.id()), store.findTasks().stream().map(Task::id).toList());
            assertEquals(List.of(newer.id(), older.id()),
                    store.findTasksByStatus(EnumSet.of(TaskStatus.PENDING)).stream().map(Task::id).toList());
            assertTrue(store.findTasksByStatus(List.of(TaskStatus.FAILED)).isEmpty());
            assertTrue(store.findTasksByStatus(List.of()).isEmpty());
        }

        @Test
        @DisplayName("each update bumps the version; a stale one is rejected")
        void optimisticVersion() {
            Task created = task("Checkout", T0);
            Task updated = store.updateTask(created.withMetadata("note", "first").touchedAt(T0.plusSeconds(1)));

            assertEquals(1, updated.version());
            assertEquals("first", store.findTask(created.id()).orElseThrow().metadata().get("note"));

            var conflict = assertThrows(TaskVersionConflictException.class,
                    () -> store.updateTask(created.withMetadata("note", "stale")));
            assertEquals(created.id(), conflict.getTaskId());
            assertEquals("first", store.findTask(created.id()).orElseThrow().metadata().get("note"));
        }

        @Test
        @DisplayName("history may only be appended to")
        void historyAppendOnly() {
            Task created = task("Checkout", T0);
            Task entered = store.updateTask(created.withWorkflow(created.workflow().enter(
                    WorkflowStage.ELABORATION, AgentRole.BUSINESS_ANALYST,
                    new WorkflowHistoryEntry(7L, "Ben", WorkflowStage.ELABORATION, T0.plusSeconds(5)))));

            assertThrows(IllegalStateException.class,
                    () -> store.updateTask(entered.withWorkflow(Workflow.initial())));

            Task found = store.findTask(created.id()).orElseThrow();
            assertEquals(1, found.workflow().history().size());
            assertEquals(new WorkflowHistoryEntry(7L, "Ben", WorkflowStage.ELABORATION, T0.plusSeconds(5)),
                    found.workflow().history().get(0));
        }

        @Test
        @DisplayName("updating a missing task fails")
        void updateMissing() {
            Task ghost = Task.newTask("Ghost", "", TaskPriority.LOW, null, T0).withId(404);
            assertThrows(RecordNotFoundException.class, () -> store.updateTask(ghost));
        }
    }

    // -- load accounting ------------------------------------------------------

    @Nested
    @DisplayName("agent load")
    class Load {

        @Test
        @DisplayName("assignment, reassignment and completion move load")
        void loadFollowsAssignment() {
            Agent a = agent(AgentRole.DEVELOPER, "Dana", 2);
            Agent b = agent(AgentRole.DEVELOPER, "Dev", 2);
            Task task = task("Checkout", T0);

            Task assigned = store.assignTask(task, a.id(), TaskStatus.ACTIVE, T0.plusSeconds(1));
            assertEquals(1, store.findAgent(a.id()).orElseThrow().currentLoad());

            Task moved = store.updateTask(assigned.assignedTo(b.id()));
            assertEquals(0, store.findAgent(a.id()).orElseThrow().currentLoad());
            assertEquals(1, store.findAgent(b.id()).orElseThrow().currentLoad());

            store.updateTask(moved.withStatus(TaskStatus.COMPLETED).completedAt(T0.plusSeconds(2)));
            assertEquals(0, store.findAgent(b.id()).orElseThrow().currentLoad());
        }

        @Test
        @DisplayName("reaching capacity makes an active agent busy and back")
        void busyToggle() {
            Agent a = agent(AgentRole.DEVELOPER, "Dana", 1);
            Task assigned = store.assignTask(task("Checkout", T0), a.id(), TaskStatus.ACTIVE, T0);

            assertEquals(AgentStatus.BUSY, store.findAgent(a.id()).orElseThrow().status());

            store.updateTask(assigned.withStatus(TaskStatus.FAILED));
            assertEquals(AgentStatus.ACTIVE, store.findAgent(a.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("a paused agent keeps its status as load changes")
        void pausedKeepsStatus() {
            Agent a = agent(AgentRole.DEVELOPER, "Dana", 1);
            store.updateAgent(a.withStatus(AgentStatus.PAUSED));

            store.assignTask(task("Checkout", T0), a.id(), TaskStatus.ACTIVE, T0);

            Agent found = store.findAgent(a.id()).orElseThrow();
            assertEquals(AgentStatus.PAUSED, found.status());
            assertEquals(1, found.currentLoad());
        }

        @Test
        @DisplayName("assigning to a missing agent fails and leaves the task alone")
        void missingAgent() {
            Task task = task("Checkout", T0);

            assertThrows(RecordNotFoundException.class,
                    () -> store.assignTask(task, 999, TaskStatus.ACTIVE, T0));
            assertEquals(0, store.findTask(task.id()).orElseThrow().version());
        }
    }

    // -- communications, health events, notifications ------------------------

    @Nested
    @DisplayName("records")
    class Records {

        @Test
        @DisplayName("communications are listed per task oldest first and recent newest first")
        void communications() {
            Task task = task("Checkout", T0);
            store.createCommunication(Communication.create(null, 1L, task.id(), "assigned",
                    CommunicationType.TASK_ASSIGNMENT, Map.of("autoAssigned", true), T0));
            store.createCommunication(Communication.create(1L, null, null, "hello",
                    CommunicationType.INFORMATION, Map.of(), T0.plusSeconds(1)));
            store.createCommunication(Communication.create(1L, 2L, task.id(), "over to you",
                    CommunicationType.HANDOFF, Map.of(), T0.plusSeconds(2)));

            List<Communication> forTask = store.findCommunicationsByTask(task.id());
            assertEquals(List.of("assigned", "over to you"), forTask.stream().map(Communication::message).toList());
            assertNull(forTask.get(0).fromAgentId());
            assertEquals(Boolean.TRUE, forTask.get(0).metadata().get("autoAssigned"));

            assertEquals(List.of("over to you", "hello"),
                    store.findRecentCommunications(2).stream().map(Communication::message).toList());
        }

        @Test
        @DisplayName("health events can be resolved")
        void healthEvents() {
            HealthEvent first = store.createHealthEvent(HealthEvent.create(3L, HealthEvent.OVERLOAD,
                    HealthSeverity.MEDIUM, "at 5/5", Map.of("maxLoad", 5), T0));
            store.createHealthEvent(HealthEvent.create(3L, HealthEvent.TASK_FAILURE,
                    HealthSeverity.HIGH, "failed", Map.of(), T0));
            store.createHealthEvent(HealthEvent.create(4L, HealthEvent.LOW_HEALTH,
                    HealthSeverity.MEDIUM, "low", Map.of(), T0));

            assertTrue(store.resolveHealthEvent(first.id()).resolved());

            assertEquals(2, store.findHealthEvents(3L).size());
            assertEquals(2, store.findUnresolvedHealthEvents().size());
            assertThrows(RecordNotFoundException.class, () -> store.resolveHealthEvent(999));
        }

        @Test
        @DisplayName("notifications can be marked sent")
        void notifications() {
            Notification created = store.createNotification(Notification.create("escalation", "Task Escalation",
                    "needs attention", null, Map.of("reason", "stuck"), T0));

            assertFalse(created.sent());
            assertTrue(store.markNotificationSent(created.id()).sent());
            assertEquals(1, store.findNotifications().size());
            assertTrue(store.findNotifications().get(0).sent());
            assertThrows(RecordNotFoundException.class, () -> store.markNotificationSent(999));
        }
    }
}
