package com.agentflow.core.negotiation;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of a proposal within a negotiation.
 */
public record Proposal(
        String id,
        long proposerId,
        String content,
        Map<String, Object> terms,
        List<Vote> votes,
        ProposalStatus status
) {

    public Proposal {
        terms = terms == null ? Map.of() : Map.copyOf(terms);
        votes = votes == null ? List.of() : List.copyOf(votes);
    }

    public long count(VoteDecision decision) {
        return votes.stream().filter(v -> v.decision() == decision).count();
    }
}
