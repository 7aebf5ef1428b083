package com.agentflow.core.health;

import java.util.Map;

/**
 * Result of one readiness check.
 *
 * @param metadata counts and settings the check observed, e.g. how many agents can take work
 */
public record HealthStatus(
    Component component,
    Status status,
    String detail,
    Map<String, Object> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    /** What a check looks at. */
    public enum Component {
        STORE("store"),
        SCHEDULER("scheduler"),
        ROSTER("roster");

        private final String key;

        Component(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HealthStatus up(Component component, String detail, Map<String, Object> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(Component component, String detail, Map<String, Object> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(Component component, String detail, Map<String, Object> metadata) {
        return new HealthStatus(component, Status.DOWN, detail, metadata);
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
