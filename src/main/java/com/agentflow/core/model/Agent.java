package com.agentflow.core.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * A named worker bound to one role, carrying load and health state.
 * <p>
 * Agents are immutable snapshots; every change goes through
 * {@link com.agentflow.core.store.OrchestrationStore#updateAgent(Agent)}.
 *
 * @param id            store-assigned identifier, 0 before creation
 * @param role          the fixed role the agent works
 * @param name          display name
 * @param status        availability
 * @param currentLoad   number of open tasks assigned to the agent (soft bound)
 * @param maxLoad       declared capacity
 * @param healthScore   0-100
 * @param capabilities  declared skill set
 * @param lastActivity  last time the agent was touched by the orchestrator
 */
public record Agent(
        long id,
        AgentRole role,
        String name,
        AgentStatus status,
        int currentLoad,
        int maxLoad,
        int healthScore,
        Set<String> capabilities,
        Instant lastActivity
) {

    public Agent {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        if (maxLoad < 0) {
            throw new IllegalArgumentException("maxLoad must be >= 0: " + maxLoad);
        }
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        healthScore = Math.max(0, Math.min(100, healthScore));
    }

    /** A fresh, active, idle and fully healthy agent. */
    public static Agent create(AgentRole role, String name, int maxLoad, Collection<String> skills, Instant now) {
        return new Agent(0, role, name, AgentStatus.ACTIVE, 0, maxLoad, 100,
                skills == null ? Set.of() : Set.copyOf(skills), now);
    }

    public Agent withId(long newId) {
        return new Agent(newId, role, name, status, currentLoad, maxLoad, healthScore, capabilities, lastActivity);
    }

    public Agent withStatus(AgentStatus newStatus) {
        return new Agent(id, role, name, newStatus, currentLoad, maxLoad, healthScore, capabilities, lastActivity);
    }

    public Agent withHealthScore(int newHealthScore) {
        return new Agent(id, role, name, status, currentLoad, maxLoad, newHealthScore, capabilities, lastActivity);
    }

    public Agent withLastActivity(Instant at) {
        return new Agent(id, role, name, status, currentLoad, maxLoad, healthScore, capabilities, at);
    }

    /**
     * Returns a copy with the given load, floored at zero. An agent that is
     * active or busy flips to busy when the load reaches capacity and back to
     * active below it; paused, unhealthy and inactive agents keep their status.
     */
    public Agent withLoad(int load) {
        int bounded = Math.max(0, load);
        AgentStatus next = status;
        if (status == AgentStatus.ACTIVE || status == AgentStatus.BUSY) {
            next = bounded >= maxLoad ? AgentStatus.BUSY : AgentStatus.ACTIVE;
        }
        return new Agent(id, role, name, next, bounded, maxLoad, healthScore, capabilities, lastActivity);
    }

    public boolean isActive() {
        return status == AgentStatus.ACTIVE;
    }

    public boolean hasAnyCapability(Collection<String> skills) {
        if (skills == null || skills.isEmpty()) {
            return true;
        }
        for (String skill : skills) {
            if (capabilities.contains(skill)) {
                return true;
            }
        }
        return false;
    }
}
