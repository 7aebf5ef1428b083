package com.agentflow.core.negotiation;

import java.util.Map;

/**
 * A proposal as submitted when a negotiation starts.
 */
public record ProposalDraft(String content, Map<String, Object> terms) {

    public ProposalDraft {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Proposal content must not be blank");
        }
        terms = terms == null ? Map.of() : Map.copyOf(terms);
    }

    public static ProposalDraft of(String content) {
        return new ProposalDraft(content, Map.of());
    }
}
