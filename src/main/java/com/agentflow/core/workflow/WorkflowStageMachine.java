package com.agentflow.core.workflow;

import com.agentflow.core.config.OrchestratorProperties;
import com.agentflow.core.events.EventBus;
import com.agentflow.core.events.OrchestrationEvent;
import com.agentflow.core.health.HealthEventRecorder;
import com.agentflow.core.logging.MdcContext;
import com.agentflow.core.metrics.OrchestrationMetrics;
import com.agentflow.core.model.Agent;
import com.agentflow.core.model.AgentRole;
import com.agentflow.core.model.Communication;
import com.agentflow.core.model.CommunicationType;
import com.agentflow.core.model.HealthEvent;
import com.agentflow.core.model.HealthSeverity;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskStatus;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowHistoryEntry;
import com.agentflow.core.model.WorkflowStage;
import com.agentflow.core.negotiation.NegotiationCoordinator;
import com.agentflow.core.reasoner.FollowUpTask;
import com.agentflow.core.reasoner.ReasonerResult;
import com.agentflow.core.scoring.ScoredAgent;
import com.agentflow.core.scoring.TaskAssignmentScorer;
import com.agentflow.core.store.OrchestrationStore;
import com.agentflow.core.store.TaskVersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Moves one task through the pipeline given a reasoner outcome.
 * <p>
 * Pipeline: intake, elaboration, implementation, verification, acceptance.
 * A successful outcome naming the next role hands the task to the best
 * available agent of that role; one naming no role completes it. Escalation
 * routes it to the recovery role, and failure is terminal.
 * <p>
 * {@link #advance} is guarded so duplicate triggers are harmless: the
 * outcome is dropped unless the producing agent still holds the task, the
 * task is still in the stage and at the version the outcome was computed
 * for, and the task is in a processable status.
 */
@Service
public class WorkflowStageMachine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowStageMachine.class);

    private final OrchestrationStore store;
    private final TaskAssignmentScorer scorer;
    private final NegotiationCoordinator negotiationCoordinator;
    private final HealthEventRecorder healthEventRecorder;
    private final EventBus eventBus;
    private final OrchestrationMetrics metrics;
    private final OrchestratorProperties properties;
    private final Clock clock;

    public WorkflowStageMachine(OrchestrationStore store, TaskAssignmentScorer scorer,
                                NegotiationCoordinator negotiationCoordinator,
                                HealthEventRecorder healthEventRecorder, EventBus eventBus,
                                OrchestrationMetrics metrics, OrchestratorProperties properties, Clock clock) {
        this.store = store;
        this.scorer = scorer;
        this.negotiationCoordinator = negotiationCoordinator;
        this.healthEventRecorder = healthEventRecorder;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Applies {@code outcome}, produced by {@code producingAgent}, to {@code task}.
     */
    public AdvanceResult advance(Task task, Agent producingAgent, StageOutcome outcome) {
        Optional<Task> found = store.findTask(task.id());
        if (found.isEmpty()) {
            log.warn("Task {} vanished before its outcome could be applied", task.id());
            return AdvanceResult.noop(task);
        }
        Task current = found.get();
        if (!current.isAssignedTo(producingAgent.id())
                || current.workflow().stage() != outcome.stage()
                || current.version() != outcome.taskVersion()
                || !TaskStatus.PROCESSABLE.contains(current.status())
                || current.workflow().handoffPending()) {
            log.debug("Outcome for task {} from agent {} no longer applies (stage {}, status {})",
                    current.id(), producingAgent.id(), current.workflow().stage().value(), current.status().value());
            return AdvanceResult.noop(current);
        }

        MdcContext.setTask(current.id(), producingAgent);
        try {
            ReasonerResult result = outcome.result();
            Instant now = clock.instant();
            Task prepared = withArtifacts(current, result);

            AdvanceResult advanced;
            if (!result.success()) {
                advanced = fail(prepared, producingAgent, result, now);
            } else if (result.shouldEscalate()) {
                advanced = escalate(prepared, producingAgent, result.escalationReason(), now);
            } else if (!result.helpSkills().isEmpty()) {
                advanced = collaborate(prepared, producingAgent, result);
            } else if (result.nextRoleTag() != null && !result.nextRoleTag().isBlank()) {
                Optional<AgentRole> nextRole = AgentRole.fromTag(result.nextRoleTag());
                advanced = nextRole.isPresent()
                        ? handOff(prepared, producingAgent, nextRole.get(), now)
                        : escalate(prepared, producingAgent, "Unknown next role: " + result.nextRoleTag(), now);
            } else {
                advanced = complete(prepared, producingAgent, now);
            }

            if (!result.response().isBlank()) {
                store.createCommunication(Communication.create(producingAgent.id(), null, current.id(),
                        result.response(), CommunicationType.TASK_RESPONSE,
                        Map.of("stage", outcome.stage().value(), "success", result.success()), now));
            }
            List<Task> followUps = createFollowUps(current, result.followUpTasks(), now);
            metrics.recordAdvance(advanced.kind().name().toLowerCase(Locale.ROOT));
            return new AdvanceResult(advanced.kind(), advanced.task(), followUps);
        } catch (TaskVersionConflictException e) {
            log.info("Task {} changed while its outcome was applied; dropping outcome", current.id());
            metrics.recordVersionConflict("advance");
            return new AdvanceResult(AdvanceResult.Kind.CONFLICT, current, List.of());
        } finally {
            MdcContext.clearTask();
        }
    }

    /**
     * Retries a hand-off that previously found no agent of the next role.
     * Leaves the task untouched while there is still nobody available.
     */
    public AdvanceResult retryHandoff(Task task) {
        Task current = store.findTask(task.id()).orElse(null);
        if (current == null || !current.workflow().handoffPending()
                || !TaskStatus.PROCESSABLE.contains(current.status())) {
            return AdvanceResult.noop(current == null ? task : current);
        }
        Optional<AgentRole> role = current.requiredRole();
        if (role.isEmpty()) {
            log.warn("Task {} awaits a hand-off to unknown role '{}'", current.id(), current.workflow().nextRoleTag());
            return AdvanceResult.noop(current);
        }
        Agent previous = current.assignedAgentId() == null ? null
                : store.findAgent(current.assignedAgentId()).orElse(null);
        Optional<ScoredAgent> best = scorer.selectBest(current, store.findAgentsByRole(role.get()));
        if (best.isEmpty()) {
            log.debug("Still no {} available for task {}", role.get().tag(), current.id());
            return AdvanceResult.noop(current);
        }
        try {
            Task updated = transfer(current, previous, best.get(), role.get(), clock.instant());
            metrics.recordAdvance("handed_off");
            return new AdvanceResult(AdvanceResult.Kind.HANDED_OFF, updated, List.of());
        } catch (TaskVersionConflictException e) {
            metrics.recordVersionConflict("handoff-retry");
            return new AdvanceResult(AdvanceResult.Kind.CONFLICT, current, List.of());
        }
    }

    private AdvanceResult handOff(Task task, Agent from, AgentRole nextRole, Instant now) {
        Optional<ScoredAgent> best = scorer.selectBest(task, store.findAgentsByRole(nextRole));
        if (best.isEmpty()) {
            Task deferred = store.updateTask(
                    task.withWorkflow(task.workflow().awaitingHandoff(nextRole)).touchedAt(now));
            log.info("No {} available for task {}; hand-off deferred", nextRole.tag(), task.id());
            return new AdvanceResult(AdvanceResult.Kind.HANDOFF_DEFERRED, deferred, List.of());
        }
        Task updated = transfer(task, from, best.get(), nextRole, now);
        return new AdvanceResult(AdvanceResult.Kind.HANDED_OFF, updated, List.of());
    }

    private Task transfer(Task task, Agent from, ScoredAgent to, AgentRole nextRole, Instant now) {
        WorkflowStage fromStage = task.workflow().stage();
        WorkflowStage toStage = WorkflowStage.ownedBy(nextRole).orElse(fromStage);
        Agent target = to.agent();

        Task updated = store.updateTask(task
                .assignedTo(target.id())
                .withStatus(TaskStatus.IN_PROGRESS)
                .withWorkflow(task.workflow().enter(toStage, nextRole,
                        WorkflowHistoryEntry.of(target, toStage, now)))
                .touchedAt(now));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("fromStage", fromStage.value());
        metadata.put("toStage", toStage.value());
        metadata.put("score", to.score());
        if (from != null) {
            metadata.put("previousAgent", from.id());
        }
        String fromName = from == null ? "the orchestrator" : from.name();
        store.createCommunication(Communication.create(from == null ? null : from.id(), target.id(), task.id(),
                "Task '" + task.title() + "' handed off from " + fromName + " to " + target.name()
                        + " for " + toStage.value(),
                CommunicationType.HANDOFF, metadata, now));

        log.info("Task {} advanced {} -> {} ({} -> {})", task.id(), fromStage.value(), toStage.value(),
                fromName, target.name());
        eventBus.publish(OrchestrationEvent.STAGE_ADVANCED, task.id(), Map.of(
                "fromStage", fromStage.value(),
                "toStage", toStage.value(),
                "agentId", target.id(),
                "agentName", target.name()));
        return updated;
    }

    private AdvanceResult complete(Task task, Agent agent, Instant now) {
        Task updated = store.updateTask(task
                .withStatus(TaskStatus.COMPLETED)
                .withWorkflow(task.workflow().enter(WorkflowStage.COMPLETED, null,
                        WorkflowHistoryEntry.of(agent, WorkflowStage.COMPLETED, now)))
                .completedAt(now)
                .touchedAt(now));

        store.createCommunication(Communication.create(agent.id(), null, task.id(),
                "Task '" + task.title() + "' completed its workflow", CommunicationType.WORKFLOW_COMPLETION,
                Map.of("completedBy", agent.id()), now));

        log.info("Task {} completed by {}", task.id(), agent.name());
        eventBus.publish(OrchestrationEvent.TASK_COMPLETED, task.id(), Map.of("agentId", agent.id()));
        return new AdvanceResult(AdvanceResult.Kind.COMPLETED, updated, List.of());
    }

    private AdvanceResult escalate(Task task, Agent agent, String reason, Instant now) {
        String escalationReason = reason == null || reason.isBlank() ? "Escalation requested" : reason;
        AgentRole recoveryRole = properties.resolveRecoveryRole();
        Optional<ScoredAgent> recovery = scorer.selectBest(task, store.findAgentsByRole(recoveryRole));
        Agent lead = recovery.map(ScoredAgent::agent).orElse(null);

        Task escalated = task
                .withStatus(TaskStatus.ESCALATED)
                .withWorkflow(task.workflow().enter(WorkflowStage.ESCALATED, recoveryRole,
                        WorkflowHistoryEntry.of(lead, WorkflowStage.ESCALATED, now)))
                .touchedAt(now);
        if (lead != null) {
            escalated = escalated.assignedTo(lead.id());
        } else {
            log.warn("No {} available; task {} escalated without a new assignee", recoveryRole.tag(), task.id());
        }
        Task updated = store.updateTask(escalated);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("escalationReason", escalationReason);
        metadata.put("previousAgent", agent.id());
        store.createCommunication(Communication.create(agent.id(), lead == null ? null : lead.id(), task.id(),
                "Task '" + task.title() + "' escalated: " + escalationReason, CommunicationType.ESCALATION,
                metadata, now));

        log.info("Task {} escalated by {}: {}", task.id(), agent.name(), escalationReason);
        Map<String, Object> payload = new LinkedHashMap<>(metadata);
        payload.put("recoveryAgentId", lead == null ? null : lead.id());
        eventBus.publish(OrchestrationEvent.TASK_ESCALATED, task.id(), payload);
        return new AdvanceResult(AdvanceResult.Kind.ESCALATED, updated, List.of());
    }

    private AdvanceResult fail(Task task, Agent agent, ReasonerResult result, Instant now) {
        String error = result.error() == null ? "Unknown failure" : result.error();
        Task updated = store.updateTask(task
                .withStatus(TaskStatus.FAILED)
                .withMetadata("error", error)
                .withMetadata("failureTime", now.toString())
                .touchedAt(now));

        healthEventRecorder.record(agent, HealthEvent.TASK_FAILURE, HealthSeverity.HIGH,
                "Task '" + task.title() + "' failed: " + error,
                Map.of("taskId", task.id(), "error", error));

        log.warn("Task {} failed at {} under {}: {}", task.id(), task.workflow().stage().value(),
                agent.name(), error);
        eventBus.publish(OrchestrationEvent.TASK_FAILED, task.id(),
                Map.of("agentId", agent.id(), "error", error));
        return new AdvanceResult(AdvanceResult.Kind.FAILED, updated, List.of());
    }

    private AdvanceResult collaborate(Task task, Agent agent, ReasonerResult result) {
        List<Agent> helpers = negotiationCoordinator.requestHelp(agent.id(), task.id(), result.helpSkills(),
                task.title());
        Task updated = store.updateTask(task
                .withStatus(TaskStatus.COLLABORATIVE)
                .withMetadata("helpRequestedFrom", helpers.stream().map(Agent::id).toList())
                .touchedAt(clock.instant()));
        log.info("Task {} waiting on help from {} agent(s) with {}", task.id(), helpers.size(), result.helpSkills());
        return new AdvanceResult(AdvanceResult.Kind.COLLABORATIVE, updated, List.of());
    }

    private List<Task> createFollowUps(Task parent, List<FollowUpTask> items, Instant now) {
        List<Task> created = new ArrayList<>(items.size());
        for (FollowUpTask item : items) {
            Task child = Task.newTask(item.title(), item.description(),
                            item.priority() != null ? item.priority() : parent.priority(), parent.id(), now)
                    .withMetadata("autoGenerated", true)
                    .withMetadata("parentTaskId", parent.id());
            Task stored = store.createTask(child);
            created.add(stored);
            eventBus.publish(OrchestrationEvent.TASK_CREATED, stored.id(),
                    Map.of("parentTaskId", parent.id(), "title", stored.title()));
        }
        if (!created.isEmpty()) {
            log.info("Task {} spawned {} follow-up task(s)", parent.id(), created.size());
        }
        return created;
    }

    private static Task withArtifacts(Task task, ReasonerResult result) {
        if (result.artifacts().isEmpty()) {
            return task;
        }
        List<Object> artifacts = new ArrayList<>();
        if (task.metadata().get("artifacts") instanceof List<?> existing) {
            artifacts.addAll(existing);
        }
        artifacts.addAll(result.artifacts());
        return task.withMetadata("artifacts", artifacts);
    }
}
