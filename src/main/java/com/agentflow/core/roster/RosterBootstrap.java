package com.agentflow.core.roster;

import com.agentflow.core.config.OrchestratorProperties;
import com.agentflow.core.scheduler.OrchestrationScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds the roster once the context is up and, when configured, starts the sweeps.
 */
@Component
public class RosterBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(RosterBootstrap.class);

    private final RosterService rosterService;
    private final OrchestrationScheduler scheduler;
    private final OrchestratorProperties properties;

    public RosterBootstrap(RosterService rosterService, OrchestrationScheduler scheduler,
                           OrchestratorProperties properties) {
        this.rosterService = rosterService;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        rosterService.seedIfEmpty();
        if (properties.isAutoStart()) {
            scheduler.start();
        } else {
            log.info("Orchestrator auto-start disabled; start it through the API");
        }
    }
}
