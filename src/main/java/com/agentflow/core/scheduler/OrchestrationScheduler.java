package com.agentflow.core.scheduler;

import com.agentflow.core.config.OrchestratorProperties;
import com.agentflow.core.governor.GovernorService;
import com.agentflow.core.health.HealthEventRecorder;
import com.agentflow.core.logging.MdcContext;
import com.agentflow.core.metrics.OrchestrationMetrics;
import com.agentflow.core.model.Agent;
import com.agentflow.core.model.AgentStatus;
import com.agentflow.core.model.HealthEvent;
import com.agentflow.core.model.HealthSeverity;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskStatus;
import com.agentflow.core.reasoner.Reasoner;
import com.agentflow.core.reasoner.ReasonerResult;
import com.agentflow.core.scoring.ScoredAgent;
import com.agentflow.core.store.OrchestrationStore;
import com.agentflow.core.workflow.AdvanceResult;
import com.agentflow.core.workflow.AssignmentService;
import com.agentflow.core.workflow.StageOutcome;
import com.agentflow.core.workflow.WorkflowStageMachine;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Drives the orchestration through four independently timed sweeps:
 * <ul>
 *   <li><b>process</b>: hands due tasks to the {@link Reasoner} and applies
 *       the outcome through the {@link WorkflowStageMachine}</li>
 *   <li><b>auto-assignment</b>: assigns unassigned pending tasks</li>
 *   <li><b>health</b>: relieves overloaded agents and records health events</li>
 *   <li><b>governor</b>: runs the roster audit</li>
 * </ul>
 * Every task-level pass goes through the shared {@link InFlightRegistry}, so
 * a task is never processed twice at the same time, whichever sweep touches
 * it. One task's failure is logged and the sweep carries on with the rest.
 */
@Service
public class OrchestrationScheduler {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationScheduler.class);

    public static final String PROCESS = "process";
    public static final String AUTO_ASSIGNMENT = "auto-assignment";
    public static final String HEALTH = "health";
    public static final String GOVERNOR = "governor";

    static final int UNHEALTHY_SCORE = 25;

    private final OrchestrationStore store;
    private final Reasoner reasoner;
    private final WorkflowStageMachine stageMachine;
    private final AssignmentService assignmentService;
    private final HealthEventRecorder healthEventRecorder;
    private final GovernorService governorService;
    private final OrchestratorProperties properties;
    private final Clock clock;
    private final Executor taskExecutor;
    private final SweepDriver driver;

    private final InFlightRegistry inFlight;
    private final SweepJobTable jobs;
    private volatile boolean running;

    public OrchestrationScheduler(OrchestrationStore store, Reasoner reasoner, WorkflowStageMachine stageMachine,
                                  AssignmentService assignmentService, HealthEventRecorder healthEventRecorder,
                                  GovernorService governorService, InFlightRegistry inFlight,
                                  OrchestratorProperties properties,
                                  OrchestrationMetrics metrics, Clock clock,
                                  @Qualifier("sweepExecutor") Executor sweepExecutor,
                                  @Qualifier("taskExecutor") Executor taskExecutor,
                                  SweepDriver driver) {
        this.store = store;
        this.reasoner = reasoner;
        this.stageMachine = stageMachine;
        this.assignmentService = assignmentService;
        this.healthEventRecorder = healthEventRecorder;
        this.governorService = governorService;
        this.inFlight = inFlight;
        this.properties = properties;
        this.clock = clock;
        this.taskExecutor = taskExecutor;
        this.driver = driver;

        this.jobs = new SweepJobTable(clock, sweepExecutor, metrics);
        jobs.register(PROCESS, properties.getProcessInterval(), properties.getErrorBackoff(), this::processSweep);
        jobs.register(AUTO_ASSIGNMENT, properties.getAssignmentInterval(), properties.getErrorBackoff(),
                this::assignmentSweep);
        jobs.register(HEALTH, properties.getHealthInterval(), properties.getErrorBackoff(), this::healthSweep);
        jobs.register(GOVERNOR, properties.getGovernorInterval(), properties.getErrorBackoff(),
                governorService::runAudit);
    }

    /**
     * Starts every sweep.
     *
     * @return false if already running
     */
    public synchronized boolean start() {
        if (running) {
            return false;
        }
        jobs.startAll();
        driver.start(jobs::runDue, properties.getTickInterval());
        running = true;
        log.info("Orchestrator started (process={}, assignment={}, health={}, governor={})",
                properties.getProcessInterval(), properties.getAssignmentInterval(),
                properties.getHealthInterval(), properties.getGovernorInterval());
        return true;
    }

    /**
     * Stops scheduling further sweeps. Work already in flight finishes.
     *
     * @return false if not running
     */
    public synchronized boolean stop() {
        if (!running) {
            return false;
        }
        jobs.stopAll();
        driver.stop();
        running = false;
        log.info("Orchestrator stopped; {} task(s) still in flight", inFlight.snapshot().size());
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Runs whichever sweeps are due on the injected clock. The driver calls
     * this on every tick; tests call it after advancing the clock.
     *
     * @return number of sweeps dispatched
     */
    public int runDueSweeps() {
        return jobs.runDue();
    }

    public OrchestratorStatus getStatus() {
        Map<String, Long> taskCounts = store.findTasks().stream()
                .collect(Collectors.groupingBy(t -> t.status().value(), TreeMap::new, Collectors.counting()));
        Map<String, Long> agentCounts = store.findAgents().stream()
                .collect(Collectors.groupingBy(a -> a.status().value(), TreeMap::new, Collectors.counting()));
        return new OrchestratorStatus(running, inFlight.snapshot(), taskCounts, agentCounts, jobs.states());
    }

    @PreDestroy
    void shutdown() {
        stop();
    }

    // --- process sweep ---

    void processSweep() {
        Instant now = clock.instant();
        Instant staleBefore = now.minus(properties.getStaleAfter());
        List<Task> candidates = store.findTasksByStatus(TaskStatus.PROCESSABLE);
        int dispatched = 0;
        for (Task task : candidates) {
            try {
                if (!isDue(task, staleBefore) || !inFlight.tryAcquire(task.id())) {
                    continue;
                }
            } catch (RuntimeException e) {
                log.warn("Could not check task {}: {}", task.id(), e.getMessage(), e);
                continue;
            }
            if (dispatch(task)) {
                dispatched++;
            }
        }
        log.debug("Process sweep: {} candidate(s), {} dispatched", candidates.size(), dispatched);
    }

    private boolean isDue(Task task, Instant staleBefore) {
        if (task.updatedAt().isBefore(staleBefore)) {
            return true;
        }
        return store.findCommunicationsByTask(task.id()).stream()
                .anyMatch(c -> c.createdAt().isAfter(task.updatedAt()));
    }

    private boolean dispatch(Task task) {
        try {
            taskExecutor.execute(() -> {
                try {
                    processTask(task);
                } catch (RuntimeException e) {
                    log.error("Processing of task {} failed", task.id(), e);
                } finally {
                    inFlight.release(task.id());
                    MdcContext.clearTask();
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.release(task.id());
            log.warn("Task {} could not be dispatched: {}", task.id(), e.getMessage());
            return false;
        }
    }

    void processTask(Task task) {
        MdcContext.setTask(task.id());
        if (task.workflow().handoffPending()) {
            stageMachine.retryHandoff(task);
            return;
        }
        if (!task.isAssigned()) {
            assignmentService.autoAssign(task);
            return;
        }
        Optional<Agent> assignee = store.findAgent(task.assignedAgentId());
        if (assignee.isEmpty()) {
            log.warn("Task {} is assigned to missing agent {}", task.id(), task.assignedAgentId());
            return;
        }
        Agent agent = assignee.get();
        if (!agent.status().canProcess()) {
            log.debug("Skipping task {}: agent {} is {}", task.id(), agent.name(), agent.status().value());
            return;
        }
        MdcContext.setTask(task.id(), agent);

        ReasonerResult result = reason(agent, task);
        AdvanceResult advanced = stageMachine.advance(task, agent, StageOutcome.of(task, result));
        log.debug("Task {} processed by {}: {}", task.id(), agent.name(), advanced.kind());
    }

    private ReasonerResult reason(Agent agent, Task task) {
        try {
            ReasonerResult result = reasoner.processTask(agent, task);
            return result != null ? result : ReasonerResult.failure("Reasoner returned no result");
        } catch (RuntimeException e) {
            log.warn("Reasoner failed on task {} for {}: {}", task.id(), agent.name(), e.getMessage());
            return ReasonerResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    // --- auto-assignment sweep ---

    void assignmentSweep() {
        List<Task> unassigned = store.findTasksByStatus(List.of(TaskStatus.PENDING)).stream()
                .filter(t -> !t.isAssigned())
                .toList();
        int assigned = 0;
        for (Task task : unassigned) {
            if (!inFlight.tryAcquire(task.id())) {
                continue;
            }
            try {
                MdcContext.setTask(task.id());
                if (assignmentService.autoAssign(task).isPresent()) {
                    assigned++;
                }
            } catch (RuntimeException e) {
                log.warn("Auto-assignment of task {} failed: {}", task.id(), e.getMessage(), e);
            } finally {
                inFlight.release(task.id());
                MdcContext.clearTask();
            }
        }
        log.debug("Auto-assignment sweep: {} of {} task(s) assigned", assigned, unassigned.size());
    }

    // --- health sweep ---

    void healthSweep() {
        for (Agent agent : store.findAgents()) {
            try {
                checkHealth(agent);
            } catch (RuntimeException e) {
                log.warn("Health check of agent {} failed: {}", agent.name(), e.getMessage(), e);
            }
        }
    }

    private void checkHealth(Agent agent) {
        if (agent.maxLoad() > 0 && agent.currentLoad() > properties.getOverloadRatio() * agent.maxLoad()) {
            relieveOverload(agent);
        }
        if (agent.healthScore() < properties.getLowHealthThreshold()
                && !healthEventRecorder.hasUnresolved(agent.id(), HealthEvent.LOW_HEALTH)) {
            healthEventRecorder.record(agent, HealthEvent.LOW_HEALTH, HealthSeverity.MEDIUM,
                    agent.name() + " health score is " + agent.healthScore(),
                    Map.of("healthScore", agent.healthScore(), "threshold", properties.getLowHealthThreshold()));
        }
        if (agent.status() == AgentStatus.ACTIVE || agent.status() == AgentStatus.BUSY) {
            long failures = healthEventRecorder.countUnresolved(agent.id(), HealthEvent.TASK_FAILURE);
            if (failures > properties.getFailureThreshold()) {
                markUnhealthy(agent, failures);
            }
        }
    }

    private void relieveOverload(Agent agent) {
        if (!healthEventRecorder.hasUnresolved(agent.id(), HealthEvent.OVERLOAD)) {
            healthEventRecorder.record(agent, HealthEvent.OVERLOAD, HealthSeverity.MEDIUM,
                    agent.name() + " is at " + agent.currentLoad() + "/" + agent.maxLoad(),
                    Map.of("currentLoad", agent.currentLoad(), "maxLoad", agent.maxLoad()));
        }
        Optional<Task> oldest = store.findTasksByAgent(agent.id()).stream()
                .filter(t -> t.status() == TaskStatus.ACTIVE)
                .min(Comparator.comparing(Task::createdAt).thenComparingLong(Task::id));
        if (oldest.isEmpty()) {
            return;
        }
        Task task = oldest.get();
        if (!inFlight.tryAcquire(task.id())) {
            return;
        }
        try {
            MdcContext.setTask(task.id(), agent);
            Optional<ScoredAgent> target = assignmentService.findReassignmentTarget(task, agent, false);
            if (target.isEmpty()) {
                log.info("Agent {} is overloaded but no other {} is available", agent.name(), agent.role().tag());
                return;
            }
            assignmentService.reassign(task, agent, target.get().agent(), "Agent overloaded");
        } finally {
            inFlight.release(task.id());
            MdcContext.clearTask();
        }
    }

    private void markUnhealthy(Agent agent, long failures) {
        Agent current = store.findAgent(agent.id()).orElse(agent);
        store.updateAgent(current.withStatus(AgentStatus.UNHEALTHY).withHealthScore(UNHEALTHY_SCORE));
        healthEventRecorder.record(current, HealthEvent.REPEATED_FAILURES, HealthSeverity.CRITICAL,
                current.name() + " failed " + failures + " tasks and was marked unhealthy",
                Map.of("failures", failures, "threshold", properties.getFailureThreshold()));
        log.warn("Agent {} marked unhealthy after {} failures", current.name(), failures);
    }
}
