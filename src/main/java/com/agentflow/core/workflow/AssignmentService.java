package com.agentflow.core.workflow;

import com.agentflow.core.config.OrchestratorProperties;
import com.agentflow.core.events.EventBus;
import com.agentflow.core.events.OrchestrationEvent;
import com.agentflow.core.metrics.OrchestrationMetrics;
import com.agentflow.core.model.Agent;
import com.agentflow.core.model.AgentRole;
import com.agentflow.core.model.Communication;
import com.agentflow.core.model.CommunicationType;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskStatus;
import com.agentflow.core.scoring.ScoredAgent;
import com.agentflow.core.scoring.TaskAssignmentScorer;
import com.agentflow.core.store.OrchestrationStore;
import com.agentflow.core.store.TaskVersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Puts tasks in front of agents: first assignment of unassigned work and
 * moving work between agents of the same role.
 * <p>
 * Candidates are always re-read from the store right before scoring.
 */
@Service
public class AssignmentService {

    private static final Logger log = LoggerFactory.getLogger(AssignmentService.class);

    private final OrchestrationStore store;
    private final TaskAssignmentScorer scorer;
    private final EventBus eventBus;
    private final OrchestrationMetrics metrics;
    private final OrchestratorProperties properties;
    private final Clock clock;

    public AssignmentService(OrchestrationStore store, TaskAssignmentScorer scorer, EventBus eventBus,
                             OrchestrationMetrics metrics, OrchestratorProperties properties, Clock clock) {
        this.store = store;
        this.scorer = scorer;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Assigns a pending, unassigned task to the best active agent of the role
     * the task currently needs, and marks it active.
     *
     * @return the assigned task, or empty when the task is not eligible, no
     *         agent is available, or another writer got there first
     */
    public Optional<Task> autoAssign(Task task) {
        if (task.status() != TaskStatus.PENDING || task.isAssigned()) {
            return Optional.empty();
        }
        AgentRole role = task.requiredRole().orElse(AgentRole.PRODUCT_MANAGER);
        Optional<ScoredAgent> best = scorer.selectBest(task, store.findAgentsByRole(role));
        if (best.isEmpty()) {
            log.debug("No active {} for task {}", role.tag(), task.id());
            return Optional.empty();
        }
        Agent agent = best.get().agent();
        Instant now = clock.instant();
        Task assigned;
        try {
            assigned = store.assignTask(task, agent.id(), TaskStatus.ACTIVE, now);
        } catch (TaskVersionConflictException e) {
            log.info("Task {} changed before it could be assigned; skipping", task.id());
            metrics.recordVersionConflict("auto-assign");
            return Optional.empty();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("autoAssigned", true);
        metadata.put("score", best.get().score());
        metadata.put("role", role.tag());
        store.createCommunication(Communication.create(null, agent.id(), task.id(),
                "Task \"" + task.title() + "\" has been automatically assigned to you.",
                CommunicationType.TASK_ASSIGNMENT, metadata, now));

        log.info("Task {} assigned to {} ({}, score {})", task.id(), agent.name(), role.tag(),
                String.format("%.1f", best.get().score()));
        metrics.recordAssignment(role.tag());
        eventBus.publish(OrchestrationEvent.TASK_ASSIGNED, task.id(), Map.of(
                "agentId", agent.id(),
                "agentName", agent.name(),
                "score", best.get().score()));
        return Optional.of(assigned);
    }

    /**
     * Best other active agent of {@code from}'s role; optionally falls back to
     * the recovery role when that role has nobody else.
     */
    public Optional<ScoredAgent> findReassignmentTarget(Task task, Agent from, boolean fallbackToRecovery) {
        Optional<ScoredAgent> sameRole = scorer.selectBest(task, others(store.findAgentsByRole(from.role()), from));
        if (sameRole.isPresent() || !fallbackToRecovery) {
            return sameRole;
        }
        AgentRole recovery = properties.resolveRecoveryRole();
        if (recovery == from.role()) {
            return Optional.empty();
        }
        return scorer.selectBest(task, others(store.findAgentsByRole(recovery), from));
    }

    /**
     * Moves a task from one agent to another, keeping its status and stage.
     *
     * @return the updated task, or empty if the task no longer belongs to
     *         {@code from} or changed concurrently
     */
    public Optional<Task> reassign(Task task, Agent from, Agent to, String reason) {
        if (!task.isAssignedTo(from.id()) || task.status().isTerminal()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Task updated;
        try {
            updated = store.updateTask(task.assignedTo(to.id()).touchedAt(now));
        } catch (TaskVersionConflictException e) {
            log.info("Task {} changed before it could be reassigned; skipping", task.id());
            metrics.recordVersionConflict("reassign");
            return Optional.empty();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reason", reason);
        metadata.put("previousAgent", from.id());
        store.createCommunication(Communication.create(from.id(), to.id(), task.id(),
                "Task '" + task.title() + "' reassigned from " + from.name() + " to " + to.name() + ": " + reason,
                CommunicationType.TASK_REASSIGNMENT, metadata, now));

        log.info("Task {} reassigned {} -> {}: {}", task.id(), from.name(), to.name(), reason);
        eventBus.publish(OrchestrationEvent.TASK_REASSIGNED, task.id(), Map.of(
                "fromAgentId", from.id(),
                "toAgentId", to.id(),
                "reason", reason));
        return Optional.of(updated);
    }

    private static List<Agent> others(List<Agent> agents, Agent excluded) {
        return agents.stream().filter(a -> a.id() != excluded.id()).toList();
    }
}
