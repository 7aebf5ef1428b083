package com.agentflow.core.negotiation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state behind a {@link Negotiation}. All access is synchronized on
 * the session.
 */
final class NegotiationSession {

    private final String id;
    private final String topic;
    private final long initiatorId;
    private final List<Long> participants;
    private final Instant createdAt;
    private final Instant deadline;
    private final Map<String, ProposalState> proposals = new LinkedHashMap<>();

    private NegotiationStatus status = NegotiationStatus.OPEN;
    private Instant resolvedAt;
    private String acceptedProposalId;

    NegotiationSession(String id, String topic, long initiatorId, List<Long> participants,
                       List<ProposalDraft> drafts, Instant createdAt, Instant deadline) {
        this.id = id;
        this.topic = topic;
        this.initiatorId = initiatorId;
        this.participants = List.copyOf(participants);
        this.createdAt = createdAt;
        this.deadline = deadline;
        int n = 0;
        for (ProposalDraft draft : drafts) {
            String proposalId = id + "-P" + (++n);
            proposals.put(proposalId, new ProposalState(proposalId, initiatorId, draft));
        }
    }

    String id() {
        return id;
    }

    List<Long> participants() {
        return participants;
    }

    /**
     * Fails the session if it is still open past its deadline.
     *
     * @return true if this call expired it
     */
    synchronized boolean expireIfOverdue(Instant now) {
        if (status == NegotiationStatus.OPEN && now.isAfter(deadline)) {
            status = NegotiationStatus.FAILED;
            resolvedAt = now;
            return true;
        }
        return false;
    }

    synchronized VoteResult vote(Vote vote, String proposalId, Instant now) {
        if (status != NegotiationStatus.OPEN) {
            return VoteResult.NOT_OPEN;
        }
        if (expireIfOverdue(now)) {
            return VoteResult.EXPIRED;
        }
        if (!participants.contains(vote.agentId())) {
            return VoteResult.NOT_A_PARTICIPANT;
        }
        ProposalState proposal = proposals.get(proposalId);
        if (proposal == null) {
            return VoteResult.UNKNOWN_PROPOSAL;
        }
        proposal.votes.remove(vote.agentId());
        proposal.votes.put(vote.agentId(), vote);
        recompute(now);
        return VoteResult.RECORDED;
    }

    private void recompute(Instant now) {
        for (ProposalState proposal : proposals.values()) {
            if (proposal.status != ProposalStatus.PENDING || proposal.votes.size() < participants.size()) {
                continue;
            }
            long accepts = proposal.count(VoteDecision.ACCEPT);
            long rejects = proposal.count(VoteDecision.REJECT);
            proposal.status = accepts > rejects ? ProposalStatus.ACCEPTED : ProposalStatus.REJECTED;
        }

        for (ProposalState proposal : proposals.values()) {
            if (proposal.status == ProposalStatus.ACCEPTED) {
                status = NegotiationStatus.AGREED;
                acceptedProposalId = proposal.id;
                resolvedAt = now;
                return;
            }
        }
        boolean allRejected = proposals.values().stream()
                .allMatch(p -> p.status == ProposalStatus.REJECTED);
        if (allRejected) {
            status = NegotiationStatus.FAILED;
            resolvedAt = now;
        }
    }

    synchronized NegotiationStatus status() {
        return status;
    }

    synchronized Negotiation snapshot() {
        List<Proposal> proposalSnapshots = new ArrayList<>(proposals.size());
        for (ProposalState p : proposals.values()) {
            proposalSnapshots.add(new Proposal(p.id, p.proposerId, p.draft.content(), p.draft.terms(),
                    new ArrayList<>(p.votes.values()), p.status));
        }
        return new Negotiation(id, topic, initiatorId, participants, proposalSnapshots, status,
                createdAt, deadline, resolvedAt, acceptedProposalId);
    }

    private static final class ProposalState {
        private final String id;
        private final long proposerId;
        private final ProposalDraft draft;
        private final Map<Long, Vote> votes = new LinkedHashMap<>();
        private ProposalStatus status = ProposalStatus.PENDING;

        ProposalState(String id, long proposerId, ProposalDraft draft) {
            this.id = id;
            this.proposerId = proposerId;
            this.draft = draft;
        }

        long count(VoteDecision decision) {
            return votes.values().stream().filter(v -> v.decision() == decision).count();
        }
    }
}
