package com.agentflow.core.workflow;

import com.agentflow.core.events.EventBus;
import com.agentflow.core.events.OrchestrationEvent;
import com.agentflow.core.model.AgentRole;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskPriority;
import com.agentflow.core.model.TaskStatus;
import com.agentflow.core.model.WorkflowHistoryEntry;
import com.agentflow.core.model.WorkflowStage;
import com.agentflow.core.store.OrchestrationStore;
import com.agentflow.core.store.TaskVersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Task intake and the operator controls on individual tasks.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private static final int MAX_ATTEMPTS = 3;

    /** Task metadata key holding the status a paused task had before the pause. */
    static final String STATUS_BEFORE_PAUSE = "statusBeforePause";

    private final OrchestrationStore store;
    private final EventBus eventBus;
    private final Clock clock;

    public TaskService(OrchestrationStore store, EventBus eventBus, Clock clock) {
        this.store = store;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Creates a pending, unassigned task at intake. Auto-assignment picks it up.
     */
    public Task submit(String title, String description, TaskPriority priority) {
        Task task = store.createTask(Task.newTask(title, description, priority, null, clock.instant()));
        log.info("Task {} '{}' submitted ({})", task.id(), task.title(), task.priority().value());
        eventBus.publish(OrchestrationEvent.TASK_CREATED, task.id(),
                Map.of("title", task.title(), "priority", task.priority().value()));
        return task;
    }

    /**
     * Pauses a task that is not finished or escalated.
     *
     * @return the paused task, or empty if it does not exist or cannot be paused
     */
    public Optional<Task> pauseTask(long taskId) {
        Optional<Task> paused = updateWithRetry(taskId, current -> {
            if (current.status().isTerminal() || current.status() == TaskStatus.ESCALATED
                    || current.status() == TaskStatus.PAUSED) {
                return null;
            }
            return current.withMetadata(STATUS_BEFORE_PAUSE, current.status().value())
                    .withStatus(TaskStatus.PAUSED)
                    .touchedAt(clock.instant());
        });
        paused.ifPresent(t -> {
            log.info("Task {} paused", t.id());
            eventBus.publish(OrchestrationEvent.TASK_PAUSED, t.id(), Map.of());
        });
        return paused;
    }

    /**
     * Resumes a paused task, or restarts an escalated one.
     * <p>
     * A paused task goes back to the status it had when paused; an unassigned
     * one goes back to pending. An escalated
     * task takes the recovery path: it is released by its assignee, passes
     * through the reassigned stage back to intake and waits for auto-assignment.
     *
     * @return the resumed task, or empty if it does not exist or is neither paused nor escalated
     */
    public Optional<Task> resumeTask(long taskId) {
        Optional<Task> resumed = updateWithRetry(taskId, current -> {
            Instant now = clock.instant();
            if (current.status() == TaskStatus.PAUSED) {
                Map<String, Object> metadata = new LinkedHashMap<>(current.metadata());
                Object before = metadata.remove(STATUS_BEFORE_PAUSE);
                return current.withMetadata(metadata)
                        .withStatus(statusAfterPause(current, before))
                        .touchedAt(now);
            }
            if (current.status() == TaskStatus.ESCALATED) {
                return current
                        .withWorkflow(current.workflow()
                                .enter(WorkflowStage.REASSIGNED, null,
                                        new WorkflowHistoryEntry(null, null, WorkflowStage.REASSIGNED, now))
                                .enter(WorkflowStage.INTAKE, AgentRole.PRODUCT_MANAGER,
                                        new WorkflowHistoryEntry(null, null, WorkflowStage.INTAKE, now)))
                        .assignedTo(null)
                        .withStatus(TaskStatus.PENDING)
                        .touchedAt(now);
            }
            return null;
        });
        resumed.ifPresent(t -> {
            log.info("Task {} resumed as {}", t.id(), t.status().value());
            eventBus.publish(OrchestrationEvent.TASK_RESUMED, t.id(),
                    Map.of("status", t.status().value(), "stage", t.workflow().stage().value()));
        });
        return resumed;
    }

    private static TaskStatus statusAfterPause(Task task, Object before) {
        if (!task.isAssigned()) {
            return TaskStatus.PENDING;
        }
        if (before instanceof String value) {
            try {
                TaskStatus status = TaskStatus.of(value);
                if (TaskStatus.PROCESSABLE.contains(status)) {
                    return status;
                }
            } catch (IllegalArgumentException e) {
                log.warn("Task {} has an unknown pre-pause status '{}'", task.id(), value);
            }
        }
        return TaskStatus.ACTIVE;
    }

    /**
     * Re-reads and rewrites the task until the update wins or the change no
     * longer applies ({@code change} returns null).
     */
    private Optional<Task> updateWithRetry(long taskId, Function<Task, Task> change) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Optional<Task> current = store.findTask(taskId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            Task changed = change.apply(current.get());
            if (changed == null) {
                log.debug("Task {} in status {} does not accept this change", taskId, current.get().status().value());
                return Optional.empty();
            }
            try {
                return Optional.of(store.updateTask(changed));
            } catch (TaskVersionConflictException e) {
                log.debug("Task {} changed concurrently (attempt {}/{})", taskId, attempt, MAX_ATTEMPTS);
            }
        }
        log.warn("Gave up updating task {} after {} concurrent changes", taskId, MAX_ATTEMPTS);
        return Optional.empty();
    }
}
