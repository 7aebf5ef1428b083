package com.agentflow.core.negotiation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProposalStatus {
    PENDING,
    ACCEPTED,
    REJECTED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProposalStatus of(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
