package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HealthSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static HealthSeverity of(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /** High and critical events are forwarded to operators. */
    public boolean isAlerting() {
        return this == HIGH || this == CRITICAL;
    }
}
