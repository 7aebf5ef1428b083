package com.agentflow.core.governor;

import com.agentflow.core.config.GovernorProperties;
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
import com.agentflow.core.notification.NotificationService;
import com.agentflow.core.scheduler.InFlightRegistry;
import com.agentflow.core.scoring.ScoredAgent;
import com.agentflow.core.store.OrchestrationStore;
import com.agentflow.core.workflow.AssignmentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Roster-wide audit that turns overload, stuck work and poor success rates
 * into corrective decisions, and executes them.
 * <p>
 * Each agent is judged on its own and may yield several decisions in one
 * pass. Decisions run one after another; a decision that fails is logged and
 * the rest of the batch still runs. A reassignment takes the task's slot in
 * the shared {@link InFlightRegistry} and is skipped while another sweep holds it.
 */
@Service
public class GovernorService {

    private static final Logger log = LoggerFactory.getLogger(GovernorService.class);

    private static final Set<TaskStatus> OPEN = EnumSet.of(TaskStatus.PENDING, TaskStatus.ACTIVE, TaskStatus.IN_PROGRESS);
    private static final Set<TaskStatus> NOT_STARTED = EnumSet.of(TaskStatus.PENDING, TaskStatus.ACTIVE);

    private final OrchestrationStore store;
    private final AssignmentService assignmentService;
    private final NotificationService notificationService;
    private final InFlightRegistry inFlight;
    private final EventBus eventBus;
    private final OrchestrationMetrics metrics;
    private final GovernorProperties properties;
    private final OrchestratorProperties orchestratorProperties;
    private final Clock clock;

    public GovernorService(OrchestrationStore store, AssignmentService assignmentService,
                           NotificationService notificationService, InFlightRegistry inFlight, EventBus eventBus,
                           OrchestrationMetrics metrics, GovernorProperties properties,
                           OrchestratorProperties orchestratorProperties, Clock clock) {
        this.store = store;
        this.assignmentService = assignmentService;
        this.notificationService = notificationService;
        this.inFlight = inFlight;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.orchestratorProperties = orchestratorProperties;
        this.clock = clock;
    }

    /** Audits the roster and executes what it finds. */
    public List<GovernorDecision> runAudit() {
        List<GovernorDecision> decisions = audit();
        int executed = execute(decisions);
        log.info("Governor audit: {} decision(s), {} executed", decisions.size(), executed);
        return decisions;
    }

    /**
     * Evaluates every agent without changing anything.
     */
    public List<GovernorDecision> audit() {
        Instant now = clock.instant();
        List<GovernorDecision> decisions = new ArrayList<>();
        for (Agent agent : store.findAgents()) {
            List<Task> tasks = store.findTasksByAgent(agent.id());
            checkLoad(agent, tasks).ifPresent(decisions::add);
            decisions.addAll(checkStuckTasks(agent, tasks, now));
            checkSuccessRate(agent, tasks).ifPresent(decisions::add);
        }
        return decisions;
    }

    /**
     * Executes decisions in order.
     *
     * @return number of decisions that took effect
     */
    public int execute(List<GovernorDecision> decisions) {
        int executed = 0;
        for (GovernorDecision decision : decisions) {
            try {
                boolean applied = switch (decision.action()) {
                    case REASSIGN_TASK -> reassign(decision);
                    case ESCALATE_TO_USER -> escalateToUser(decision);
                    case SEND_PING -> ping(decision);
                };
                if (applied) {
                    executed++;
                    metrics.recordGovernorDecision(decision.action().value());
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("action", decision.action().value());
                    payload.put("fromAgentId", decision.fromAgentId());
                    payload.put("toAgentId", decision.toAgentId());
                    payload.put("reason", decision.reason());
                    eventBus.publish(OrchestrationEvent.GOVERNOR_DECISION, decision.taskId(), payload);
                }
            } catch (RuntimeException e) {
                log.warn("Governor decision {} for task {} failed: {}", decision.action().value(),
                        decision.taskId(), e.getMessage(), e);
            }
        }
        return executed;
    }

    private Optional<GovernorDecision> checkLoad(Agent agent, List<Task> tasks) {
        if (agent.maxLoad() <= 0) {
            return Optional.empty();
        }
        long open = tasks.stream().filter(t -> OPEN.contains(t.status())).count();
        double taskLoad = (double) Math.max(agent.currentLoad(), open) / agent.maxLoad();
        if (taskLoad <= properties.getLoadThreshold()) {
            return Optional.empty();
        }
        Optional<Task> oldestPending = tasks.stream()
                .filter(t -> NOT_STARTED.contains(t.status()))
                .min(Comparator.comparing(Task::createdAt).thenComparingLong(Task::id));
        if (oldestPending.isEmpty()) {
            return Optional.empty();
        }
        Task task = oldestPending.get();
        Optional<ScoredAgent> target = assignmentService.findReassignmentTarget(task, agent, true);
        if (target.isEmpty()) {
            log.debug("Agent {} is overloaded but nobody can take task {}", agent.name(), task.id());
            return Optional.empty();
        }
        return Optional.of(new GovernorDecision(GovernorAction.REASSIGN_TASK, agent.id(), target.get().agent().id(),
                task.id(), String.format("Agent load at %.0f%%", taskLoad * 100)));
    }

    private List<GovernorDecision> checkStuckTasks(Agent agent, List<Task> tasks, Instant now) {
        Instant cutoff = now.minus(properties.getStuckAfter());
        List<GovernorDecision> decisions = new ArrayList<>();
        for (Task task : tasks) {
            if (task.status() == TaskStatus.IN_PROGRESS && task.updatedAt().isBefore(cutoff)
                    && !alreadyEscalated(task)) {
                decisions.add(new GovernorDecision(GovernorAction.ESCALATE_TO_USER, agent.id(), null, task.id(),
                        "No progress since " + task.updatedAt()));
            }
        }
        return decisions;
    }

    private Optional<GovernorDecision> checkSuccessRate(Agent agent, List<Task> tasks) {
        long completed = tasks.stream().filter(t -> t.status() == TaskStatus.COMPLETED).count();
        long failed = tasks.stream().filter(t -> t.status() == TaskStatus.FAILED).count();
        long observed = completed + failed;
        if (observed < properties.getMinObservedTasks()) {
            return Optional.empty();
        }
        double successRate = (double) completed / observed;
        if (successRate >= properties.getSuccessRateThreshold()) {
            return Optional.empty();
        }
        Optional<Agent> recovery = recoveryAgent(agent);
        if (recovery.isEmpty()) {
            log.warn("Agent {} has a {}% success rate but no recovery agent is available", agent.name(),
                    Math.round(successRate * 100));
            return Optional.empty();
        }
        return Optional.of(new GovernorDecision(GovernorAction.SEND_PING, agent.id(), recovery.get().id(), null,
                String.format("Success rate %.0f%% over %d tasks", successRate * 100, observed)));
    }

    private boolean reassign(GovernorDecision decision) {
        if (!inFlight.tryAcquire(decision.taskId())) {
            log.info("Reassignment of task {} skipped: task is being processed", decision.taskId());
            return false;
        }
        try {
            Task task = store.findTask(decision.taskId()).orElse(null);
            Agent from = store.findAgent(decision.fromAgentId()).orElse(null);
            Agent to = store.findAgent(decision.toAgentId()).orElse(null);
            if (task == null || from == null || to == null) {
                log.warn("Reassignment of task {} skipped: task or agent no longer exists", decision.taskId());
                return false;
            }
            return assignmentService.reassign(task, from, to, decision.reason()).isPresent();
        } finally {
            inFlight.release(decision.taskId());
        }
    }

    private boolean escalateToUser(GovernorDecision decision) {
        Task task = store.findTask(decision.taskId()).orElse(null);
        if (task == null) {
            return false;
        }
        String message = "Task '" + task.title() + "' needs attention: " + decision.reason();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("taskId", task.id());
        metadata.put("agentId", decision.fromAgentId());
        metadata.put("reason", decision.reason());
        notificationService.notify("escalation", "Task Escalation", message, null, metadata);

        store.createCommunication(Communication.create(decision.fromAgentId(), null, task.id(), message,
                CommunicationType.ESCALATION, Map.of("escalationReason", decision.reason(), "source", "governor"),
                clock.instant()));
        log.info("Task {} escalated to a human: {}", task.id(), decision.reason());
        return true;
    }

    private boolean ping(GovernorDecision decision) {
        Agent subject = store.findAgent(decision.fromAgentId()).orElse(null);
        String name = subject == null ? "agent " + decision.fromAgentId() : subject.name();
        store.createCommunication(Communication.create(null, decision.toAgentId(), null,
                "Performance alert for " + name + ": " + decision.reason(), CommunicationType.SYSTEM_ALERT,
                Map.of("subjectAgentId", decision.fromAgentId(), "source", "governor"), clock.instant()));
        log.info("Pinged agent {} about {}: {}", decision.toAgentId(), name, decision.reason());
        return true;
    }

    private boolean alreadyEscalated(Task task) {
        return store.findCommunicationsByTask(task.id()).stream()
                .anyMatch(c -> c.type() == CommunicationType.ESCALATION);
    }

    private Optional<Agent> recoveryAgent(Agent subject) {
        AgentRole role = orchestratorProperties.resolveRecoveryRole();
        return store.findAgentsByRole(role).stream()
                .filter(Agent::isActive)
                .filter(a -> a.id() != subject.id())
                .min(Comparator.comparingLong(Agent::id));
    }
}
