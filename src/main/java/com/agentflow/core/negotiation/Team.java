package com.agentflow.core.negotiation;

import java.time.Instant;
import java.util.List;

/**
 * A group of agents formed around a purpose. Members include the leader.
 */
public record Team(
        String id,
        String name,
        long leaderId,
        List<Long> memberIds,
        String purpose,
        TeamStatus status,
        Instant createdAt
) {

    public Team {
        memberIds = List.copyOf(memberIds);
    }

    public Team disband() {
        return new Team(id, name, leaderId, memberIds, purpose, TeamStatus.DISBANDED, createdAt);
    }
}
