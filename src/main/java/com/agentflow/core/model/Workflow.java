package com.agentflow.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pipeline position of a task.
 *
 * @param stage          current stage
 * @param nextRoleTag    role required to act on the task now, null once completed
 * @param history        append-only record of stages entered
 * @param handoffPending true when a hand-off to {@code nextRoleTag} found no agent and must be retried
 */
public record Workflow(
        WorkflowStage stage,
        String nextRoleTag,
        List<WorkflowHistoryEntry> history,
        boolean handoffPending
) {

    public Workflow {
        Objects.requireNonNull(stage, "stage");
        history = history == null ? List.of() : List.copyOf(history);
    }

    /** Workflow of a newly created task: intake, waiting for a product manager. */
    public static Workflow initial() {
        return new Workflow(WorkflowStage.INTAKE, AgentRole.PRODUCT_MANAGER.tag(), List.of(), false);
    }

    public Optional<AgentRole> requiredRole() {
        return AgentRole.fromTag(nextRoleTag);
    }

    /** Moves to {@code newStage}, required role {@code role}, recording the entry. */
    public Workflow enter(WorkflowStage newStage, AgentRole role, WorkflowHistoryEntry entry) {
        return new Workflow(newStage, role == null ? null : role.tag(), appended(entry), false);
    }

    /** Keeps the current stage but records that a hand-off to {@code role} is outstanding. */
    public Workflow awaitingHandoff(AgentRole role) {
        return new Workflow(stage, role.tag(), history, true);
    }

    /**
     * Whether {@code other} extends this workflow's history without dropping
     * or reordering any entry.
     */
    public boolean isPrefixOf(Workflow other) {
        if (other.history.size() < history.size()) {
            return false;
        }
        return other.history.subList(0, history.size()).equals(history);
    }

    private List<WorkflowHistoryEntry> appended(WorkflowHistoryEntry entry) {
        var next = new ArrayList<WorkflowHistoryEntry>(history.size() + 1);
        next.addAll(history);
        next.add(Objects.requireNonNull(entry, "entry"));
        return next;
    }
}
