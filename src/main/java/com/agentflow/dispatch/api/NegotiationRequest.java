package com.agentflow.dispatch.api;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/v1/negotiations.
 */
public record NegotiationRequest(
        Long initiatorId,
        String topic,
        List<Long> participantIds,
        List<ProposalRequest> proposals
) {

    public record ProposalRequest(String content, Map<String, Object> terms) {
    }
}
