package com.agentflow.core.negotiation;

import com.agentflow.core.model.Agent;
import com.agentflow.core.model.Communication;
import com.agentflow.core.store.OrchestrationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Messaging primitive shared by negotiations, teams, help and delegation
 * requests. Each delivered message becomes one {@link Communication} per
 * recipient, all carrying the same {@code messageId}.
 */
@Component
public class AgentMessenger {

    private static final Logger log = LoggerFactory.getLogger(AgentMessenger.class);

    private final OrchestrationStore store;
    private final Clock clock;

    public AgentMessenger(OrchestrationStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Sends a message. A null recipient fans the message out to every agent
     * except the sender.
     *
     * @return the communications written, one per recipient
     */
    public List<Communication> send(AgentMessage message) {
        String messageId = UUID.randomUUID().toString();
        List<Long> recipients = new ArrayList<>();
        if (message.toAgentId() != null) {
            recipients.add(message.toAgentId());
        } else {
            for (Agent agent : store.findAgents()) {
                if (message.fromAgentId() == null || agent.id() != message.fromAgentId()) {
                    recipients.add(agent.id());
                }
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("messageId", messageId);
        metadata.put("priority", message.priority());
        metadata.put("requiresResponse", message.requiresResponse());
        if (message.responseDeadline() != null) {
            metadata.put("responseDeadline", message.responseDeadline().toString());
        }
        if (!message.data().isEmpty()) {
            metadata.put("data", message.data());
        }

        List<Communication> written = new ArrayList<>(recipients.size());
        for (Long recipient : recipients) {
            written.add(store.createCommunication(Communication.create(
                    message.fromAgentId(), recipient, message.taskId(), message.content(),
                    message.type(), metadata, clock.instant())));
        }
        log.debug("Message {} ({}) from {} delivered to {} recipient(s)",
                messageId, message.type().value(), message.fromAgentId(), written.size());
        return written;
    }
}
