package com.agentflow.core.negotiation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Snapshot of a negotiation session.
 *
 * @param participantIds     every agent expected to vote, exactly as listed by the initiator
 * @param acceptedProposalId the winning proposal once agreed
 */
public record Negotiation(
        String id,
        String topic,
        long initiatorId,
        List<Long> participantIds,
        List<Proposal> proposals,
        NegotiationStatus status,
        Instant createdAt,
        Instant deadline,
        Instant resolvedAt,
        String acceptedProposalId
) {

    public Negotiation {
        participantIds = List.copyOf(participantIds);
        proposals = List.copyOf(proposals);
    }

    public Optional<Proposal> proposal(String proposalId) {
        return proposals.stream().filter(p -> p.id().equals(proposalId)).findFirst();
    }
}
