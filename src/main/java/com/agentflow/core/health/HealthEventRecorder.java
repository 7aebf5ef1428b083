package com.agentflow.core.health;

import com.agentflow.core.model.Agent;
import com.agentflow.core.model.HealthEvent;
import com.agentflow.core.model.HealthSeverity;
import com.agentflow.core.notification.NotificationService;
import com.agentflow.core.store.OrchestrationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records agent health events. High and critical events are also raised
 * as {@code agent_health} notifications.
 */
@Service
public class HealthEventRecorder {

    private static final Logger log = LoggerFactory.getLogger(HealthEventRecorder.class);

    static final String AGENT_HEALTH_NOTIFICATION = "agent_health";

    private final OrchestrationStore store;
    private final NotificationService notificationService;
    private final Clock clock;

    public HealthEventRecorder(OrchestrationStore store, NotificationService notificationService, Clock clock) {
        this.store = store;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    public HealthEvent record(Agent agent, String type, HealthSeverity severity, String message,
                              Map<String, Object> details) {
        HealthEvent event = store.createHealthEvent(
                HealthEvent.create(agent.id(), type, severity, message, details, clock.instant()));
        log.info("Health event {} ({}) for agent {}: {}", type, severity.value(), agent.name(), message);

        if (severity.isAlerting()) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("agentId", agent.id());
            metadata.put("healthEventId", event.id());
            metadata.put("eventType", type);
            metadata.put("severity", severity.value());
            if (details != null && details.get("taskId") != null) {
                metadata.put("taskId", details.get("taskId"));
            }
            notificationService.notify(AGENT_HEALTH_NOTIFICATION,
                    "Agent health alert: " + agent.name(), message, agent.id(), metadata);
        }
        return event;
    }

    public boolean hasUnresolved(long agentId, String type) {
        return store.findHealthEvents(agentId).stream()
                .anyMatch(e -> !e.resolved() && e.type().equals(type));
    }

    public long countUnresolved(long agentId, String type) {
        return store.findHealthEvents(agentId).stream()
                .filter(e -> !e.resolved() && e.type().equals(type))
                .count();
    }

    /**
     * Marks every open event for the agent resolved.
     *
     * @return number of events resolved
     */
    public int resolveAll(long agentId) {
        int resolved = 0;
        for (HealthEvent event : store.findHealthEvents(agentId)) {
            if (!event.resolved()) {
                store.resolveHealthEvent(event.id());
                resolved++;
            }
        }
        return resolved;
    }
}
