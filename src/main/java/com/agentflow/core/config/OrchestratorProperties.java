package com.agentflow.core.config;

import com.agentflow.core.model.AgentRole;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Timing and threshold configuration for the orchestration sweeps.
 */
@Component
@ConfigurationProperties(prefix = "agentflow.orchestrator")
public class OrchestratorProperties {

    /** Start the sweeps once the roster has been seeded. */
    private boolean autoStart = false;

    /** How often the driver checks the job table for due sweeps. */
    private Duration tickInterval = Duration.ofMillis(250);

    private Duration processInterval = Duration.ofSeconds(2);
    private Duration assignmentInterval = Duration.ofSeconds(10);
    private Duration healthInterval = Duration.ofSeconds(30);
    private Duration governorInterval = Duration.ofMinutes(10);

    /** Delay before re-running a sweep that threw. */
    private Duration errorBackoff = Duration.ofSeconds(5);

    /** A task untouched for this long is due for processing. */
    private Duration staleAfter = Duration.ofSeconds(30);

    /** Upper bound on tasks handed to the reasoner at the same time. */
    private int maxConcurrentTasks = 4;

    /** Role that receives escalations and alerts. */
    private String recoveryRole = "engineering_lead";

    /** Load above this fraction of capacity triggers reassignment in the health sweep. */
    private double overloadRatio = 0.9;

    private int lowHealthThreshold = 70;

    /** Failed tasks after which an active agent is marked unhealthy. */
    private int failureThreshold = 3;

    public boolean isAutoStart() { return autoStart; }
    public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }

    public Duration getTickInterval() { return tickInterval; }
    public void setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; }

    public Duration getProcessInterval() { return processInterval; }
    public void setProcessInterval(Duration processInterval) { this.processInterval = processInterval; }

    public Duration getAssignmentInterval() { return assignmentInterval; }
    public void setAssignmentInterval(Duration assignmentInterval) { this.assignmentInterval = assignmentInterval; }

    public Duration getHealthInterval() { return healthInterval; }
    public void setHealthInterval(Duration healthInterval) { this.healthInterval = healthInterval; }

    public Duration getGovernorInterval() { return governorInterval; }
    public void setGovernorInterval(Duration governorInterval) { this.governorInterval = governorInterval; }

    public Duration getErrorBackoff() { return errorBackoff; }
    public void setErrorBackoff(Duration errorBackoff) { this.errorBackoff = errorBackoff; }

    public Duration getStaleAfter() { return staleAfter; }
    public void setStaleAfter(Duration staleAfter) { this.staleAfter = staleAfter; }

    public int getMaxConcurrentTasks() { return maxConcurrentTasks; }
    public void setMaxConcurrentTasks(int maxConcurrentTasks) { this.maxConcurrentTasks = maxConcurrentTasks; }

    public String getRecoveryRole() { return recoveryRole; }
    public void setRecoveryRole(String recoveryRole) { this.recoveryRole = recoveryRole; }

    /** The configured recovery role, engineering lead when the tag is unknown. */
    public AgentRole resolveRecoveryRole() {
        return AgentRole.fromTag(recoveryRole).orElse(AgentRole.ENGINEERING_LEAD);
    }

    public double getOverloadRatio() { return overloadRatio; }
    public void setOverloadRatio(double overloadRatio) { this.overloadRatio = overloadRatio; }

    public int getLowHealthThreshold() { return lowHealthThreshold; }
    public void setLowHealthThreshold(int lowHealthThreshold) { this.lowHealthThreshold = lowHealthThreshold; }

    public int getFailureThreshold() { return failureThreshold; }
    public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
}
