package com.agentflow.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposes the component checks under {@code /actuator/health}.
 */
@Component("orchestrator")
public class OrchestratorHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public OrchestratorHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        var statuses = healthCheckService.checkAll();
        Health.Builder builder = HealthCheckService.isHealthy(statuses) ? Health.up() : Health.down();
        for (HealthStatus status : statuses) {
            builder.withDetail(status.component().key(), status.status() + ": " + status.detail());
        }
        return builder.build();
    }
}
