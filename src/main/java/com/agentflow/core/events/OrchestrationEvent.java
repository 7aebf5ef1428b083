package com.agentflow.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Best-effort broadcast about something the orchestrator did.
 *
 * @param eventType dotted event name, e.g. {@code task.assigned}
 * @param taskId    the task concerned, or null for roster-wide events
 * @param payload   event details
 * @param timestamp when the event was published
 */
public record OrchestrationEvent(
        String eventType,
        Long taskId,
        Map<String, Object> payload,
        Instant timestamp
) implements Serializable {

    public static final String TASK_CREATED = "task.created";
    public static final String TASK_ASSIGNED = "task.assigned";
    public static final String TASK_REASSIGNED = "task.reassigned";
    public static final String STAGE_ADVANCED = "task.stage_advanced";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_ESCALATED = "task.escalated";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_PAUSED = "task.paused";
    public static final String TASK_RESUMED = "task.resumed";
    public static final String NEGOTIATION_RESOLVED = "negotiation.resolved";
    public static final String GOVERNOR_DECISION = "governor.decision";
    public static final String NOTIFICATION = "notification.created";

    public OrchestrationEvent {
        payload = payload == null ? Map.of() : payload;
    }
}
