package com.agentflow.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A work item moving through the role pipeline.
 * <p>
 * {@code version} is the optimistic concurrency token: the store bumps it on
 * every update and rejects an update carrying a stale value.
 */
public record Task(
        long id,
        String title,
        String description,
        TaskStatus status,
        TaskPriority priority,
        Long assignedAgentId,
        Long parentTaskId,
        Workflow workflow,
        Map<String, Object> metadata,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt,
        long version
) {

    public Task {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(workflow, "workflow");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        description = description == null ? "" : description;
        metadata = Metadata.copyOf(metadata);
    }

    /** A new pending, unassigned task at intake. */
    public static Task newTask(String title, String description, TaskPriority priority, Long parentTaskId, Instant now) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Task title must not be blank");
        }
        return new Task(0, title, description, TaskStatus.PENDING,
                priority == null ? TaskPriority.MEDIUM : priority,
                null, parentTaskId, Workflow.initial(), Map.of(), now, now, null, 0);
    }

    public Task withId(long newId) {
        return new Task(newId, title, description, status, priority, assignedAgentId, parentTaskId,
                workflow, metadata, createdAt, updatedAt, completedAt, version);
    }

    public Task withVersion(long newVersion) {
        return new Task(id, title, description, status, priority, assignedAgentId, parentTaskId,
                workflow, metadata, createdAt, updatedAt, completedAt, newVersion);
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, title, description, newStatus, priority, assignedAgentId, parentTaskId,
                workflow, metadata, createdAt, updatedAt, completedAt, version);
    }

    public Task assignedTo(Long agentId) {
        return new Task(id, title, description, status, priority, agentId, parentTaskId,
                workflow, metadata, createdAt, updatedAt, completedAt, version);
    }

    public Task withWorkflow(Workflow newWorkflow) {
        return new Task(id, title, description, status, priority, assignedAgentId, parentTaskId,
                newWorkflow, metadata, createdAt, updatedAt, completedAt, version);
    }

    public Task withMetadata(String key, Object value) {
        return new Task(id, title, description, status, priority, assignedAgentId, parentTaskId,
                workflow, Metadata.with(metadata, key, value), createdAt, updatedAt, completedAt, version);
    }

    public Task withMetadata(Map<String, Object> newMetadata) {
        return new Task(id, title, description, status, priority, assignedAgentId, parentTaskId,
                workflow, newMetadata, createdAt, updatedAt, completedAt, version);
    }

    public Task touchedAt(Instant at) {
        return new Task(id, title, description, status, priority, assignedAgentId, parentTaskId,
                workflow, metadata, createdAt, at, completedAt, version);
    }

    public Task completedAt(Instant at) {
        return new Task(id, title, description, status, priority, assignedAgentId, parentTaskId,
                workflow, metadata, createdAt, updatedAt, at, version);
    }

    public Optional<AgentRole> requiredRole() {
        return workflow.requiredRole();
    }

    public boolean isAssigned() {
        return assignedAgentId != null;
    }

    public boolean isAssignedTo(long agentId) {
        return assignedAgentId != null && assignedAgentId == agentId;
    }
}
