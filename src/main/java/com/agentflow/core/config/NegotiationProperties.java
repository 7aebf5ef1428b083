package com.agentflow.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Response deadlines for agent-to-agent requests. Deadlines are advisory and
 * only checked when a session is read or voted on.
 */
@Component
@ConfigurationProperties(prefix = "agentflow.negotiation")
public class NegotiationProperties {

    private Duration defaultDeadline = Duration.ofHours(24);
    private Duration helpDeadline = Duration.ofMinutes(30);
    private Duration delegationDeadline = Duration.ofHours(1);
    private Duration teamInviteDeadline = Duration.ofHours(2);

    public Duration getDefaultDeadline() { return defaultDeadline; }
    public void setDefaultDeadline(Duration defaultDeadline) { this.defaultDeadline = defaultDeadline; }

    public Duration getHelpDeadline() { return helpDeadline; }
    public void setHelpDeadline(Duration helpDeadline) { this.helpDeadline = helpDeadline; }

    public Duration getDelegationDeadline() { return delegationDeadline; }
    public void setDelegationDeadline(Duration delegationDeadline) { this.delegationDeadline = delegationDeadline; }

    public Duration getTeamInviteDeadline() { return teamInviteDeadline; }
    public void setTeamInviteDeadline(Duration teamInviteDeadline) { this.teamInviteDeadline = teamInviteDeadline; }
}
