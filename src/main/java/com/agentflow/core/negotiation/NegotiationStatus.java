package com.agentflow.core.negotiation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NegotiationStatus {
    OPEN,
    AGREED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != OPEN;
    }

    @JsonCreator
    public static NegotiationStatus of(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
