package com.agentflow.core.governor;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GovernorAction {
    REASSIGN_TASK,
    ESCALATE_TO_USER,
    /** Non-mutating alert to the recovery role. */
    SEND_PING;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
