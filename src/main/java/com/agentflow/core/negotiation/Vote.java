package com.agentflow.core.negotiation;

import java.time.Instant;
import java.util.Objects;

/**
 * One agent's decision on a proposal. Abstentions count toward the quorum
 * but not toward the majority.
 */
public record Vote(long agentId, VoteDecision decision, String reasoning, Instant timestamp) {

    public Vote {
        Objects.requireNonNull(decision, "decision");
        Objects.requireNonNull(timestamp, "timestamp");
        reasoning = reasoning == null ? "" : reasoning;
    }
}
