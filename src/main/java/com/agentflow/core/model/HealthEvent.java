package com.agentflow.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A health observation about one agent ({@code task_failure}, {@code overload},
 * {@code low_health}, {@code repeated_failures}).
 */
public record HealthEvent(
        long id,
        long agentId,
        String type,
        HealthSeverity severity,
        String message,
        Map<String, Object> details,
        boolean resolved,
        Instant createdAt
) {

    public static final String TASK_FAILURE = "task_failure";
    public static final String OVERLOAD = "overload";
    public static final String LOW_HEALTH = "low_health";
    public static final String REPEATED_FAILURES = "repeated_failures";

    public HealthEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(createdAt, "createdAt");
        message = message == null ? "" : message;
        details = Metadata.copyOf(details);
    }

    public static HealthEvent create(long agentId, String type, HealthSeverity severity, String message,
                                     Map<String, Object> details, Instant createdAt) {
        return new HealthEvent(0, agentId, type, severity, message, details, false, createdAt);
    }

    public HealthEvent withId(long newId) {
        return new HealthEvent(newId, agentId, type, severity, message, details, resolved, createdAt);
    }

    public HealthEvent resolve() {
        return new HealthEvent(id, agentId, type, severity, message, details, true, createdAt);
    }
}
