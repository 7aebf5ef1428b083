package com.agentflow.core.negotiation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum VoteDecision {
    ACCEPT,
    REJECT,
    ABSTAIN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VoteDecision of(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
