package com.agentflow.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "agentflow.governor")
public class GovernorProperties {

    /** Open tasks as a fraction of capacity above which work is moved away. */
    private double loadThreshold = 0.8;

    /** An in-progress task untouched for this long is escalated to a human. */
    private Duration stuckAfter = Duration.ofHours(4);

    private double successRateThreshold = 0.7;

    /** Completed plus failed tasks needed before the success rate is judged. */
    private int minObservedTasks = 3;

    public double getLoadThreshold() { return loadThreshold; }
    public void setLoadThreshold(double loadThreshold) { this.loadThreshold = loadThreshold; }

    public Duration getStuckAfter() { return stuckAfter; }
    public void setStuckAfter(Duration stuckAfter) { this.stuckAfter = stuckAfter; }

    public double getSuccessRateThreshold() { return successRateThreshold; }
    public void setSuccessRateThreshold(double successRateThreshold) { this.successRateThreshold = successRateThreshold; }

    public int getMinObservedTasks() { return minObservedTasks; }
    public void setMinObservedTasks(int minObservedTasks) { this.minObservedTasks = minObservedTasks; }
}
