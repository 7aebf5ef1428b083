package com.agentflow.core.workflow;

import com.agentflow.core.model.Task;

import java.util.List;

/**
 * What {@link WorkflowStageMachine#advance} did.
 *
 * @param kind      the transition taken
 * @param task      the task after the transition, or as found for {@link Kind#NOOP}
 * @param followUps child tasks created from the outcome
 */
public record AdvanceResult(Kind kind, Task task, List<Task> followUps) {

    public enum Kind {
        /** Guard failed: the outcome no longer applies. */
        NOOP,
        /** Another writer updated the task first. */
        CONFLICT,
        HANDED_OFF,
        /** Next role has no available agent yet; retried by the process sweep. */
        HANDOFF_DEFERRED,
        COMPLETED,
        ESCALATED,
        FAILED,
        COLLABORATIVE
    }

    public AdvanceResult {
        followUps = followUps == null ? List.of() : List.copyOf(followUps);
    }

    static AdvanceResult noop(Task task) {
        return new AdvanceResult(Kind.NOOP, task, List.of());
    }

    public boolean changedTask() {
        return kind != Kind.NOOP && kind != Kind.CONFLICT;
    }
}
