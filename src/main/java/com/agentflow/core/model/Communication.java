package com.agentflow.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable entry of the append-only messaging and audit log.
 * Either end may be null: a null sender is the orchestrator itself.
 */
public record Communication(
        long id,
        Long fromAgentId,
        Long toAgentId,
        Long taskId,
        String message,
        CommunicationType type,
        Map<String, Object> metadata,
        Instant createdAt
) {

    public Communication {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(createdAt, "createdAt");
        metadata = Metadata.copyOf(metadata);
    }

    public static Communication create(Long fromAgentId, Long toAgentId, Long taskId, String message,
                                       CommunicationType type, Map<String, Object> metadata, Instant createdAt) {
        return new Communication(0, fromAgentId, toAgentId, taskId, message, type, metadata, createdAt);
    }

    public Communication withId(long newId) {
        return new Communication(newId, fromAgentId, toAgentId, taskId, message, type, metadata, createdAt);
    }
}
