package com.agentflow.core.roster;

import com.agentflow.core.config.RosterProperties;
import com.agentflow.core.health.HealthEventRecorder;
import com.agentflow.core.model.Agent;
import com.agentflow.core.model.AgentRole;
import com.agentflow.core.model.AgentStatus;
import com.agentflow.core.store.OrchestrationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * The agent roster: bootstrap seeding and the operator controls on agents.
 */
@Service
public class RosterService {

    private static final Logger log = LoggerFactory.getLogger(RosterService.class);

    static final int FULL_HEALTH = 100;

    private final OrchestrationStore store;
    private final RosterProperties properties;
    private final HealthEventRecorder healthEventRecorder;
    private final Clock clock;

    public RosterService(OrchestrationStore store, RosterProperties properties,
                         HealthEventRecorder healthEventRecorder, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.healthEventRecorder = healthEventRecorder;
        this.clock = clock;
    }

    /**
     * Creates the configured agents when the store has none.
     *
     * @return number of agents created
     * @throws IllegalArgumentException if a roster entry names an unknown role
     */
    public int seedIfEmpty() {
        if (!store.findAgents().isEmpty()) {
            log.debug("Roster already present; skipping seed");
            return 0;
        }
        int created = 0;
        for (RosterProperties.AgentDefinition definition : properties.getAgents()) {
            AgentRole role = AgentRole.fromTag(definition.getRole())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown roster role: " + definition.getRole()));
            store.createAgent(Agent.create(role, definition.getName(), definition.getMaxLoad(),
                    definition.getSkills(), clock.instant()));
            created++;
        }
        log.info("Seeded {} agent(s) into the roster", created);
        return created;
    }

    public List<Agent> listAgents() {
        return store.findAgents();
    }

    public Optional<Agent> pauseAgent(long agentId) {
        return store.findAgent(agentId).map(agent -> {
            Agent paused = store.updateAgent(agent.withStatus(AgentStatus.PAUSED));
            log.info("Agent {} paused", paused.name());
            return paused;
        });
    }

    /**
     * Puts an agent back to work: active, or busy when already at capacity.
     * An unhealthy agent also gets its health score restored and its open
     * health events resolved.
     */
    public Optional<Agent> resumeAgent(long agentId) {
        return store.findAgent(agentId).map(agent -> {
            Agent resumed = agent.withStatus(agent.currentLoad() >= agent.maxLoad()
                    ? AgentStatus.BUSY : AgentStatus.ACTIVE);
            if (agent.status() == AgentStatus.UNHEALTHY) {
                int resolved = healthEventRecorder.resolveAll(agent.id());
                resumed = resumed.withHealthScore(FULL_HEALTH);
                log.info("Agent {} recovered; {} health event(s) resolved", agent.name(), resolved);
            }
            Agent stored = store.updateAgent(resumed.withLastActivity(clock.instant()));
            log.info("Agent {} resumed ({})", stored.name(), stored.status().value());
            return stored;
        });
    }
}
