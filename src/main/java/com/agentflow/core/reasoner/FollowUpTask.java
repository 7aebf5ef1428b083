package com.agentflow.core.reasoner;

import com.agentflow.core.model.TaskPriority;

/**
 * Additional work identified while processing a task.
 *
 * @param priority overrides the parent's priority when non-null
 */
public record FollowUpTask(String title, String description, TaskPriority priority) {

    public FollowUpTask {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Follow-up title must not be blank");
        }
    }

    public static FollowUpTask of(String title, String description) {
        return new FollowUpTask(title, description, null);
    }
}
