package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AgentStatus {
    ACTIVE,
    BUSY,
    PAUSED,
    UNHEALTHY,
    INACTIVE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AgentStatus of(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Whether an agent in this status still works the tasks already assigned to it.
     * A busy agent is at capacity for new work but keeps processing its own queue.
     */
    public boolean canProcess() {
        return this == ACTIVE || this == BUSY;
    }
}
