package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum TaskStatus {
    PENDING,
    ACTIVE,
    IN_PROGRESS,
    PAUSED,
    ESCALATED,
    COLLABORATIVE,
    COMPLETED,
    FAILED;

    /** Statuses the process sweep picks up when a task is due. */
    public static final Set<TaskStatus> PROCESSABLE =
            EnumSet.of(PENDING, ACTIVE, IN_PROGRESS, COLLABORATIVE);

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskStatus of(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
