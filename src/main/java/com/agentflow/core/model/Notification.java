package com.agentflow.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Operator-facing alert. Delivery is fire-and-forget; {@code sent} records
 * whether the sink accepted it.
 */
public record Notification(
        long id,
        String type,
        String subject,
        String message,
        Long recipientAgentId,
        Map<String, Object> metadata,
        boolean sent,
        Instant createdAt
) {

    public Notification {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(createdAt, "createdAt");
        message = message == null ? "" : message;
        metadata = Metadata.copyOf(metadata);
    }

    public static Notification create(String type, String subject, String message, Long recipientAgentId,
                                      Map<String, Object> metadata, Instant createdAt) {
        return new Notification(0, type, subject, message, recipientAgentId, metadata, false, createdAt);
    }

    public Notification withId(long newId) {
        return new Notification(newId, type, subject, message, recipientAgentId, metadata, sent, createdAt);
    }

    public Notification markSent() {
        return new Notification(id, type, subject, message, recipientAgentId, metadata, true, createdAt);
    }
}
