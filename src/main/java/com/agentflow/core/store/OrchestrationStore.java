package com.agentflow.core.store;

import com.agentflow.core.model.Agent;
import com.agentflow.core.model.AgentRole;
import com.agentflow.core.model.Communication;
import com.agentflow.core.model.HealthEvent;
import com.agentflow.core.model.Notification;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of agents, tasks, communications, health events and
 * notifications: the narrow operation set the orchestrator consumes.
 * <p>
 * Implementations guarantee for {@link #updateTask(Task)}:
 * <ul>
 *   <li>the task's {@code version} must equal the stored version, otherwise
 *       {@link TaskVersionConflictException}; the stored copy gets {@code version + 1}</li>
 *   <li>the workflow history only ever grows by appending</li>
 *   <li>agent loads follow the assignment: the previous holder is decremented
 *       (floored at zero) and the new holder incremented; entering
 *       completed or failed releases the holder</li>
 * </ul>
 * Task listings are ordered newest-created first.
 */
public interface OrchestrationStore {

    List<Agent> findAgents();

    List<Agent> findAgentsByRole(AgentRole role);

    Optional<Agent> findAgent(long id);

    Agent createAgent(Agent agent);

    /**
     * @throws RecordNotFoundException if no agent has this id
     */
    Agent updateAgent(Agent agent);

    List<Task> findTasks();

    List<Task> findTasksByStatus(Collection<TaskStatus> statuses);

    List<Task> findTasksByAgent(long agentId);

    Optional<Task> findTask(long id);

    Task createTask(Task task);

    /**
     * Optimistically updates a task.
     *
     * @return the stored task with its new version
     * @throws TaskVersionConflictException if the task changed since it was read
     * @throws RecordNotFoundException      if no task has this id
     */
    Task updateTask(Task task);

    /**
     * Assigns a task to an agent and moves it to {@code status} in one
     * versioned update.
     */
    default Task assignTask(Task task, long agentId, TaskStatus status, Instant now) {
        return updateTask(task.assignedTo(agentId).withStatus(status).touchedAt(now));
    }

    Communication createCommunication(Communication communication);

    /** Communications about one task, oldest first. */
    List<Communication> findCommunicationsByTask(long taskId);

    /** The most recent communications, newest first. */
    List<Communication> findRecentCommunications(int limit);

    HealthEvent createHealthEvent(HealthEvent event);

    List<HealthEvent> findHealthEvents(long agentId);

    List<HealthEvent> findUnresolvedHealthEvents();

    /**
     * @throws RecordNotFoundException if no health event has this id
     */
    HealthEvent resolveHealthEvent(long id);

    Notification createNotification(Notification notification);

    /**
     * @throws RecordNotFoundException if no notification has this id
     */
    Notification markNotificationSent(long id);

    List<Notification> findNotifications();
}
