package com.agentflow.core.store;

/**
 * Raised when a task update carries a version that no longer matches the
 * stored one: another writer changed the task first.
 */
public class TaskVersionConflictException extends StoreException {

    private final long taskId;
    private final long expectedVersion;
    private final long actualVersion;

    public TaskVersionConflictException(long taskId, long expectedVersion, long actualVersion) {
        super("Task " + taskId + " changed concurrently (expected version "
                + expectedVersion + ", found " + actualVersion + ")");
        this.taskId = taskId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long getTaskId() {
        return taskId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
