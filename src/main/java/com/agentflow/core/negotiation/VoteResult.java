package com.agentflow.core.negotiation;

/**
 * Outcome of a {@link NegotiationCoordinator#vote} call. Everything except
 * {@link #RECORDED} means the vote was rejected and nothing changed.
 */
public enum VoteResult {
    RECORDED,
    NEGOTIATION_NOT_FOUND,
    NOT_OPEN,
    EXPIRED,
    NOT_A_PARTICIPANT,
    UNKNOWN_PROPOSAL;

    public boolean isRecorded() {
        return this == RECORDED;
    }
}
