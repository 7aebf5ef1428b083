package com.agentflow.core.negotiation;

import com.agentflow.core.config.NegotiationProperties;
import com.agentflow.core.events.EventBus;
import com.agentflow.core.events.OrchestrationEvent;
import com.agentflow.core.metrics.OrchestrationMetrics;
import com.agentflow.core.model.Agent;
import com.agentflow.core.model.CommunicationType;
import com.agentflow.core.store.OrchestrationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Multi-party consensus and collaboration between agents.
 * <p>
 * A negotiation moves {@code open -> agreed | failed}. A proposal is decided
 * once every participant has voted on it: accepted when accept votes strictly
 * outnumber reject votes, rejected otherwise. The first accepted proposal
 * settles the session; if every proposal is rejected the session fails.
 * Deadlines are checked lazily whenever a session is read or voted on.
 * <p>
 * Negotiations and teams live only in this process and are lost on restart.
 * They coordinate agents; the durable record of work stays with the tasks.
 */
@Service
public class NegotiationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(NegotiationCoordinator.class);

    private final OrchestrationStore store;
    private final AgentMessenger messenger;
    private final EventBus eventBus;
    private final OrchestrationMetrics metrics;
    private final NegotiationProperties properties;
    private final Clock clock;

    private final Map<String, NegotiationSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Team> teams = new ConcurrentHashMap<>();
    private final AtomicInteger negotiationCounter = new AtomicInteger();
    private final AtomicInteger teamCounter = new AtomicInteger();

    public NegotiationCoordinator(OrchestrationStore store, AgentMessenger messenger, EventBus eventBus,
                                  OrchestrationMetrics metrics, NegotiationProperties properties, Clock clock) {
        this.store = store;
        this.messenger = messenger;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    // -- negotiations ---------------------------------------------------------

    /**
     * Opens a negotiation and invites every participant other than the
     * initiator. The initiator votes only when listed among the participants.
     */
    public Negotiation startNegotiation(long initiatorId, String topic, Collection<Long> participantIds,
                                        List<ProposalDraft> proposals) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Negotiation topic must not be blank");
        }
        if (proposals == null || proposals.isEmpty()) {
            throw new IllegalArgumentException("A negotiation needs at least one proposal");
        }
        if (participantIds == null || participantIds.isEmpty()) {
            throw new IllegalArgumentException("A negotiation needs at least one participant");
        }
        if (participantIds.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Participant ids must not be null");
        }
        Set<Long> participants = new LinkedHashSet<>(participantIds);

        Instant now = clock.instant();
        String id = "NEG-%04d".formatted(negotiationCounter.incrementAndGet());
        var session = new NegotiationSession(id, topic, initiatorId, new ArrayList<>(participants), proposals,
                now, now.plus(properties.getDefaultDeadline()));
        sessions.put(id, session);
        Negotiation snapshot = session.snapshot();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("negotiationId", id);
        data.put("topic", topic);
        data.put("proposalIds", snapshot.proposals().stream().map(Proposal::id).toList());
        for (Long participant : participants) {
            if (participant.longValue() == initiatorId) {
                continue;
            }
            messenger.send(new AgentMessage(initiatorId, participant, null, CommunicationType.NEGOTIATION,
                    "You are invited to negotiate: " + topic, data, AgentMessage.NEGOTIATION_PRIORITY,
                    true, snapshot.deadline()));
        }

        log.info("Negotiation {} opened by agent {} on '{}' with {} participant(s) and {} proposal(s)",
                id, initiatorId, topic, participants.size(), proposals.size());
        return snapshot;
    }

    /**
     * Records or replaces an agent's vote on a proposal.
     *
     * @return {@link VoteResult#RECORDED}, or why the vote was rejected
     */
    public VoteResult vote(long agentId, String negotiationId, String proposalId, VoteDecision decision,
                           String reasoning) {
        Objects.requireNonNull(decision, "decision");
        NegotiationSession session = sessions.get(negotiationId);
        if (session == null) {
            return VoteResult.NEGOTIATION_NOT_FOUND;
        }

        Instant now = clock.instant();
        VoteResult result;
        Negotiation after;
        synchronized (session) {
            result = session.vote(new Vote(agentId, decision, reasoning, now), proposalId, now);
            after = session.snapshot();
        }

        if (result == VoteResult.EXPIRED || (result.isRecorded() && after.status().isTerminal())) {
            announceResolution(after);
        }
        if (!result.isRecorded()) {
            log.debug("Vote by agent {} on {}/{} rejected: {}", agentId, negotiationId, proposalId, result);
        }
        return result;
    }

    /**
     * Current state of a negotiation; an open session past its deadline is
     * failed by this call.
     */
    public Optional<Negotiation> getNegotiation(String negotiationId) {
        NegotiationSession session = sessions.get(negotiationId);
        if (session == null) {
            return Optional.empty();
        }
        if (session.expireIfOverdue(clock.instant())) {
            Negotiation expired = session.snapshot();
            announceResolution(expired);
            return Optional.of(expired);
        }
        return Optional.of(session.snapshot());
    }

    public Optional<NegotiationStatus> checkStatus(String negotiationId) {
        return getNegotiation(negotiationId).map(Negotiation::status);
    }

    public List<Negotiation> getActiveNegotiations() {
        List<Negotiation> active = new ArrayList<>();
        for (String id : sessions.keySet()) {
            getNegotiation(id)
                    .filter(n -> n.status() == NegotiationStatus.OPEN)
                    .ifPresent(active::add);
        }
        return active;
    }

    private void announceResolution(Negotiation negotiation) {
        log.info("Negotiation {} on '{}' concluded: {}", negotiation.id(), negotiation.topic(),
                negotiation.status().value());
        metrics.recordNegotiationResolved(negotiation.status().value());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("negotiationId", negotiation.id());
        data.put("status", negotiation.status().value());
        if (negotiation.acceptedProposalId() != null) {
            data.put("acceptedProposalId", negotiation.acceptedProposalId());
        }
        for (Long participant : negotiation.participantIds()) {
            messenger.send(AgentMessage.notice(null, participant, null, CommunicationType.INFORMATION,
                    "Negotiation '" + negotiation.topic() + "' concluded: " + negotiation.status().value(),
                    data, AgentMessage.INFORMATION_PRIORITY));
        }
        eventBus.publish(OrchestrationEvent.NEGOTIATION_RESOLVED, null, data);
    }

    // -- teams ----------------------------------------------------------------

    /**
     * Forms a team led by {@code leaderId} and invites the other members.
     */
    public Team formTeam(long leaderId, String name, Collection<Long> memberIds, String purpose) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Team name must not be blank");
        }
        Set<Long> members = new LinkedHashSet<>();
        members.add(leaderId);
        members.addAll(memberIds);

        Instant now = clock.instant();
        var team = new Team("TEAM-%04d".formatted(teamCounter.incrementAndGet()), name, leaderId,
                new ArrayList<>(members), purpose, TeamStatus.ACTIVE, now);
        teams.put(team.id(), team);

        Map<String, Object> data = Map.of("teamId", team.id(), "teamName", name);
        for (Long member : members) {
            if (member == leaderId) {
                continue;
            }
            messenger.send(new AgentMessage(leaderId, member, null, CommunicationType.PROPOSAL,
                    "You are invited to join team '" + name + "': " + purpose, data,
                    AgentMessage.PROPOSAL_PRIORITY, true, now.plus(properties.getTeamInviteDeadline())));
        }
        log.info("Team {} '{}' formed by agent {} with {} member(s)", team.id(), name, leaderId, members.size());
        return team;
    }

    /**
     * @return false if the team is unknown or already disbanded
     */
    public boolean disbandTeam(String teamId) {
        Team current = teams.get(teamId);
        if (current == null || current.status() == TeamStatus.DISBANDED) {
            return false;
        }
        boolean replaced = teams.replace(teamId, current, current.disband());
        if (replaced) {
            log.info("Team {} disbanded", teamId);
        }
        return replaced;
    }

    public Optional<Team> getTeam(String teamId) {
        return Optional.ofNullable(teams.get(teamId));
    }

    public List<Team> getActiveTeams() {
        return teams.values().stream()
                .filter(t -> t.status() == TeamStatus.ACTIVE)
                .toList();
    }

    // -- help, delegation, knowledge -----------------------------------------

    /**
     * Asks every other active agent with at least one of the required skills
     * for help.
     *
     * @return the agents asked, empty when nobody matches
     */
    public List<Agent> requestHelp(long requesterId, Long taskId, Collection<String> requiredSkills,
                                   String description) {
        List<Agent> helpers = store.findAgents().stream()
                .filter(a -> a.id() != requesterId)
                .filter(Agent::isActive)
                .filter(a -> a.hasAnyCapability(requiredSkills))
                .toList();
        if (helpers.isEmpty()) {
            log.info("No agent can help agent {} with {}", requesterId, requiredSkills);
            return helpers;
        }

        Instant deadline = clock.instant().plus(properties.getHelpDeadline());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("requiredSkills", List.copyOf(requiredSkills));
        if (taskId != null) {
            data.put("taskId", taskId);
        }
        for (Agent helper : helpers) {
            messenger.send(new AgentMessage(requesterId, helper.id(), taskId, CommunicationType.REQUEST,
                    "Help requested: " + description, data, AgentMessage.REQUEST_PRIORITY, true, deadline));
        }
        log.info("Agent {} asked {} agent(s) for help with {}", requesterId, helpers.size(), requiredSkills);
        return helpers;
    }

    /**
     * Delegates a task to another agent, provided that agent declares at
     * least one of the required skills.
     *
     * @return false if the target is unknown or lacks the skills
     */
    public boolean delegateTask(long fromAgentId, long toAgentId, long taskId, String instructions,
                                Collection<String> requiredSkills) {
        Optional<Agent> target = store.findAgent(toAgentId);
        if (target.isEmpty()) {
            log.warn("Cannot delegate task {}: agent {} not found", taskId, toAgentId);
            return false;
        }
        if (!target.get().hasAnyCapability(requiredSkills)) {
            log.info("Agent {} lacks {} for delegated task {}", target.get().name(), requiredSkills, taskId);
            return false;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("taskId", taskId);
        data.put("requiredSkills", requiredSkills == null ? List.of() : List.copyOf(requiredSkills));
        messenger.send(new AgentMessage(fromAgentId, toAgentId, taskId, CommunicationType.DELEGATION,
                "Task delegated: " + instructions, data, AgentMessage.DELEGATION_PRIORITY, true,
                clock.instant().plus(properties.getDelegationDeadline())));
        log.info("Agent {} delegated task {} to agent {}", fromAgentId, taskId, toAgentId);
        return true;
    }

    /**
     * Shares information with the given agents, or with everyone when none are named.
     *
     * @return number of messages written
     */
    public int shareKnowledge(long fromAgentId, Collection<Long> recipientIds, String topic, String content) {
        Map<String, Object> data = Map.of("topic", topic);
        if (recipientIds == null || recipientIds.isEmpty()) {
            return messenger.send(AgentMessage.notice(fromAgentId, null, null, CommunicationType.INFORMATION,
                    content, data, AgentMessage.INFORMATION_PRIORITY)).size();
        }
        int sent = 0;
        for (Long recipient : recipientIds) {
            sent += messenger.send(AgentMessage.notice(fromAgentId, recipient, null, CommunicationType.INFORMATION,
                    content, data, AgentMessage.INFORMATION_PRIORITY)).size();
        }
        return sent;
    }
}
