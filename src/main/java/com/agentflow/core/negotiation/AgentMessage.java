package com.agentflow.core.negotiation;

import com.agentflow.core.model.CommunicationType;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A point-to-point or broadcast message between agents.
 *
 * @param fromAgentId      sender, null for the orchestrator
 * @param toAgentId        recipient, null to broadcast to every other agent
 * @param taskId           task the message is about, if any
 * @param type             communication type
 * @param content          human-readable body
 * @param data             structured payload
 * @param priority         1 (lowest) to 10
 * @param requiresResponse whether the recipient is expected to answer
 * @param responseDeadline advisory deadline for the answer
 */
public record AgentMessage(
        Long fromAgentId,
        Long toAgentId,
        Long taskId,
        CommunicationType type,
        String content,
        Map<String, Object> data,
        int priority,
        boolean requiresResponse,
        Instant responseDeadline
) {

    public static final int REQUEST_PRIORITY = 7;
    public static final int DELEGATION_PRIORITY = 8;
    public static final int NEGOTIATION_PRIORITY = 6;
    public static final int INFORMATION_PRIORITY = 5;
    public static final int PROPOSAL_PRIORITY = 6;

    public AgentMessage {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(content, "content");
        data = data == null ? Map.of() : data;
        if (priority < 1 || priority > 10) {
            throw new IllegalArgumentException("priority must be within 1..10: " + priority);
        }
    }

    /** A message that expects no answer. */
    public static AgentMessage notice(Long fromAgentId, Long toAgentId, Long taskId, CommunicationType type,
                                      String content, Map<String, Object> data, int priority) {
        return new AgentMessage(fromAgentId, toAgentId, taskId, type, content, data, priority, false, null);
    }
}
