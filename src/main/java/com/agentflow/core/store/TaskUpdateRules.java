package com.agentflow.core.store;

import com.agentflow.core.model.Task;

import java.util.HashMap;
import java.util.Map;

/**
 * Checks and side effects shared by every store implementation when a task
 * is written.
 */
final class TaskUpdateRules {

    private TaskUpdateRules() {}

    static void checkUpdate(Task stored, Task update) {
        if (stored.version() != update.version()) {
            throw new TaskVersionConflictException(stored.id(), update.version(), stored.version());
        }
        if (!stored.workflow().isPrefixOf(update.workflow())) {
            throw new IllegalStateException("Workflow history of task " + stored.id()
                    + " may only be appended to");
        }
    }

    /**
     * Load change per agent id implied by moving a task from {@code before}
     * to {@code after}. A task holds a unit of its assignee's load while it
     * is assigned and not terminal. {@code before} may be null for a new task.
     */
    static Map<Long, Integer> loadDeltas(Task before, Task after) {
        Map<Long, Integer> deltas = new HashMap<>();
        if (before != null && holdsLoad(before)) {
            deltas.merge(before.assignedAgentId(), -1, Integer::sum);
        }
        if (holdsLoad(after)) {
            deltas.merge(after.assignedAgentId(), 1, Integer::sum);
        }
        deltas.values().removeIf(delta -> delta == 0);
        return deltas;
    }

    private static boolean holdsLoad(Task task) {
        return task.isAssigned() && !task.status().isTerminal();
    }
}
