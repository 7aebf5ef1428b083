package com.agentflow.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One step in a task's workflow history.
 *
 * @param agentId   agent that took the task at this step, null when no agent was involved
 * @param agentName that agent's name at the time, null when no agent was involved
 * @param stage     stage entered
 * @param timestamp when the stage was entered
 */
public record WorkflowHistoryEntry(Long agentId, String agentName, WorkflowStage stage, Instant timestamp) {

    public WorkflowHistoryEntry {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static WorkflowHistoryEntry of(Agent agent, WorkflowStage stage, Instant timestamp) {
        if (agent == null) {
            return new WorkflowHistoryEntry(null, null, stage, timestamp);
        }
        return new WorkflowHistoryEntry(agent.id(), agent.name(), stage, timestamp);
    }
}
