package com.agentflow.core.health;

import com.agentflow.core.model.Agent;
import com.agentflow.core.model.AgentStatus;
import com.agentflow.core.scheduler.OrchestrationScheduler;
import com.agentflow.core.store.OrchestrationStore;
import com.agentflow.core.store.StoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.agentflow.core.health.HealthStatus.Component.ROSTER;
import static com.agentflow.core.health.HealthStatus.Component.SCHEDULER;
import static com.agentflow.core.health.HealthStatus.Component.STORE;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final OrchestrationStore store;
    private final OrchestrationScheduler scheduler;
    private final StoreProperties storeProperties;

    public HealthCheckService(OrchestrationStore store, OrchestrationScheduler scheduler,
                              StoreProperties storeProperties) {
        this.store = store;
        this.scheduler = scheduler;
        this.storeProperties = storeProperties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkScheduler());
        results.add(checkRoster());
        return results;
    }

    public static boolean isHealthy(List<HealthStatus> statuses) {
        return statuses.stream().noneMatch(HealthStatus::isDown);
    }

    private HealthStatus checkStore() {
        try {
            int agents = store.findAgents().size();
            int tasks = store.findTasks().size();
            return HealthStatus.up(STORE, "Store reachable (" + storeProperties.getType() + ")",
                    Map.of("type", storeProperties.getType(), "agents", agents, "tasks", tasks));
        } catch (RuntimeException e) {
            log.warn("Store health check failed: {}", e.getMessage());
            return HealthStatus.down(STORE, "Store error: " + e.getMessage(),
                    Map.of("type", storeProperties.getType()));
        }
    }

    private HealthStatus checkScheduler() {
        if (scheduler.isRunning()) {
            return HealthStatus.up(SCHEDULER, "Sweeps running", Map.of());
        }
        return HealthStatus.degraded(SCHEDULER, "Sweeps stopped", Map.of());
    }

    private HealthStatus checkRoster() {
        List<Agent> agents;
        try {
            agents = store.findAgents();
        } catch (RuntimeException e) {
            return HealthStatus.down(ROSTER, "Roster unavailable", Map.of());
        }
        if (agents.isEmpty()) {
            return HealthStatus.down(ROSTER, "No agents in the roster", Map.of("agents", 0));
        }
        long working = agents.stream().filter(a -> a.status().canProcess()).count();
        long unhealthy = agents.stream().filter(a -> a.status() == AgentStatus.UNHEALTHY).count();
        Map<String, Object> metadata = Map.of("agents", agents.size(), "working", working, "unhealthy", unhealthy);
        if (working == 0) {
            return HealthStatus.down(ROSTER, "No agent can take work", metadata);
        }
        if (unhealthy > 0) {
            return HealthStatus.degraded(ROSTER, unhealthy + " agent(s) unhealthy", metadata);
        }
        return HealthStatus.up(ROSTER, working + " agent(s) available", metadata);
    }
}
