package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of {@link Communication} records written by the orchestrator and by
 * agent-to-agent messaging.
 */
public enum CommunicationType {
    TASK_ASSIGNMENT,
    TASK_RESPONSE,
    HANDOFF,
    ESCALATION,
    WORKFLOW_COMPLETION,
    TASK_REASSIGNMENT,
    SYSTEM_ALERT,
    REQUEST,
    DELEGATION,
    NEGOTIATION,
    INFORMATION,
    PROPOSAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CommunicationType of(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
