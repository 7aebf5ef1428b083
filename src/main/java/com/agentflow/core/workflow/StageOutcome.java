package com.agentflow.core.workflow;

import com.agentflow.core.model.Task;
import com.agentflow.core.model.WorkflowStage;
import com.agentflow.core.reasoner.ReasonerResult;

import java.util.Objects;

/**
 * A reasoner result together with the task state it was computed against.
 *
 * @param stage       stage the task was in when the reasoner ran
 * @param taskVersion task version the reasoner saw
 * @param result      what the reasoner decided
 */
public record StageOutcome(WorkflowStage stage, long taskVersion, ReasonerResult result) {

    public StageOutcome {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(result, "result");
    }

    public static StageOutcome of(Task task, ReasonerResult result) {
        return new StageOutcome(task.workflow().stage(), task.version(), result);
    }
}
