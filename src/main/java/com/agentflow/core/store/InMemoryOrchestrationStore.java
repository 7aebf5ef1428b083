package com.agentflow.core.store;

import com.agentflow.core.model.Agent;
import com.agentflow.core.model.AgentRole;
import com.agentflow.core.model.Communication;
import com.agentflow.core.model.HealthEvent;
import com.agentflow.core.model.Notification;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link OrchestrationStore}. Used when no database is
 * configured; everything is lost on restart.
 * <p>
 * Reads are lock-free snapshots. Writes that touch more than one record
 * (task plus agent loads) are serialized on the store instance.
 */
public class InMemoryOrchestrationStore implements OrchestrationStore {

    private static final Comparator<Task> NEWEST_FIRST =
            Comparator.comparing(Task::createdAt).thenComparingLong(Task::id).reversed();

    private final Map<Long, Agent> agents = new ConcurrentHashMap<>();
    private final Map<Long, Task> tasks = new ConcurrentHashMap<>();
    private final List<Communication> communications = new CopyOnWriteArrayList<>();
    private final Map<Long, HealthEvent> healthEvents = new ConcurrentHashMap<>();
    private final Map<Long, Notification> notifications = new ConcurrentHashMap<>();

    private final AtomicLong agentIds = new AtomicLong();
    private final AtomicLong taskIds = new AtomicLong();
    private final AtomicLong communicationIds = new AtomicLong();
    private final AtomicLong healthEventIds = new AtomicLong();
    private final AtomicLong notificationIds = new AtomicLong();

    @Override
    public List<Agent> findAgents() {
        return agents.values().stream()
                .sorted(Comparator.comparingLong(Agent::id))
                .toList();
    }

    @Override
    public List<Agent> findAgentsByRole(AgentRole role) {
        return findAgents().stream()
                .filter(agent -> agent.role() == role)
                .toList();
    }

    @Override
    public Optional<Agent> findAgent(long id) {
        return Optional.ofNullable(agents.get(id));
    }

    @Override
    public Agent createAgent(Agent agent) {
        Agent stored = agent.withId(agentIds.incrementAndGet());
        agents.put(stored.id(), stored);
        return stored;
    }

    @Override
    public synchronized Agent updateAgent(Agent agent) {
        if (!agents.containsKey(agent.id())) {
            throw new RecordNotFoundException("agent", agent.id());
        }
        agents.put(agent.id(), agent);
        return agent;
    }

    @Override
    public List<Task> findTasks() {
        return tasks.values().stream().sorted(NEWEST_FIRST).toList();
    }

    @Override
    public List<Task> findTasksByStatus(Collection<TaskStatus> statuses) {
        var wanted = statuses.isEmpty() ? EnumSet.noneOf(TaskStatus.class) : EnumSet.copyOf(statuses);
        return tasks.values().stream()
                .filter(task -> wanted.contains(task.status()))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public List<Task> findTasksByAgent(long agentId) {
        return tasks.values().stream()
                .filter(task -> task.isAssignedTo(agentId))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public Optional<Task> findTask(long id) {
        return Optional.ofNullable(tasks.get(id));
    }

    @Override
    public synchronized Task createTask(Task task) {
        if (task.isAssigned() && !agents.containsKey(task.assignedAgentId())) {
            throw new RecordNotFoundException("agent", task.assignedAgentId());
        }
        Task stored = task.withId(taskIds.incrementAndGet()).withVersion(0);
        tasks.put(stored.id(), stored);
        applyLoad(TaskUpdateRules.loadDeltas(null, stored));
        return stored;
    }

    @Override
    public synchronized Task updateTask(Task task) {
        Task current = tasks.get(task.id());
        if (current == null) {
            throw new RecordNotFoundException("task", task.id());
        }
        TaskUpdateRules.checkUpdate(current, task);
        if (task.isAssigned() && !agents.containsKey(task.assignedAgentId())) {
            throw new RecordNotFoundException("agent", task.assignedAgentId());
        }
        Task stored = task.withVersion(current.version() + 1);
        tasks.put(stored.id(), stored);
        applyLoad(TaskUpdateRules.loadDeltas(current, stored));
        return stored;
    }

    private void applyLoad(Map<Long, Integer> deltas) {
        deltas.forEach((agentId, delta) ->
                agents.computeIfPresent(agentId, (id, agent) -> agent.withLoad(agent.currentLoad() + delta)));
    }

    @Override
    public Communication createCommunication(Communication communication) {
        Communication stored = communication.withId(communicationIds.incrementAndGet());
        communications.add(stored);
        return stored;
    }

    @Override
    public List<Communication> findCommunicationsByTask(long taskId) {
        return communications.stream()
                .filter(c -> c.taskId() != null && c.taskId() == taskId)
                .toList();
    }

    @Override
    public List<Communication> findRecentCommunications(int limit) {
        List<Communication> snapshot = new ArrayList<>(communications);
        List<Communication> recent = new ArrayList<>(Math.min(limit, snapshot.size()));
        for (int i = snapshot.size() - 1; i >= 0 && recent.size() < limit; i--) {
            recent.add(snapshot.get(i));
        }
        return recent;
    }

    @Override
    public HealthEvent createHealthEvent(HealthEvent event) {
        HealthEvent stored = event.withId(healthEventIds.incrementAndGet());
        healthEvents.put(stored.id(), stored);
        return stored;
    }

    @Override
    public List<HealthEvent> findHealthEvents(long agentId) {
        return healthEvents.values().stream()
                .filter(e -> e.agentId() == agentId)
                .sorted(Comparator.comparingLong(HealthEvent::id))
                .toList();
    }

    @Override
    public List<HealthEvent> findUnresolvedHealthEvents() {
        return healthEvents.values().stream()
                .filter(e -> !e.resolved())
                .sorted(Comparator.comparingLong(HealthEvent::id))
                .toList();
    }

    @Override
    public HealthEvent resolveHealthEvent(long id) {
        HealthEvent resolved = healthEvents.computeIfPresent(id, (key, event) -> event.resolve());
        if (resolved == null) {
            throw new RecordNotFoundException("health event", id);
        }
        return resolved;
    }

    @Override
    public Notification createNotification(Notification notification) {
        Notification stored = notification.withId(notificationIds.incrementAndGet());
        notifications.put(stored.id(), stored);
        return stored;
    }

    @Override
    public Notification markNotificationSent(long id) {
        Notification sent = notifications.computeIfPresent(id, (key, n) -> n.markSent());
        if (sent == null) {
            throw new RecordNotFoundException("notification", id);
        }
        return sent;
    }

    @Override
    public List<Notification> findNotifications() {
        return notifications.values().stream()
                .sorted(Comparator.comparingLong(Notification::id))
                .toList();
    }
}
