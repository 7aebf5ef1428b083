package com.agentflow.core.negotiation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TeamStatus {
    ACTIVE,
    DISBANDED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TeamStatus of(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
