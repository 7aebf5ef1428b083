package com.agentflow.dispatch.api;

/**
 * Request body for POST /api/v1/negotiations/{id}/votes.
 *
 * @param decision accept, reject or abstain
 */
public record VoteRequest(Long agentId, String proposalId, String decision, String reasoning) {
}
