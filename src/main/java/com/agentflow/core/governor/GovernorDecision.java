package com.agentflow.core.governor;

import java.util.Objects;

/**
 * One corrective action produced by an audit.
 *
 * @param action      what to do
 * @param fromAgentId agent the decision concerns
 * @param toAgentId   receiving agent for reassignments and pings, otherwise null
 * @param taskId      task concerned, null for pings
 * @param reason      human-readable cause
 */
public record GovernorDecision(GovernorAction action, Long fromAgentId, Long toAgentId, Long taskId, String reason) {

    public GovernorDecision {
        Objects.requireNonNull(action, "action");
    }
}
