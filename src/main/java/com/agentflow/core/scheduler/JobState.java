package com.agentflow.core.scheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * Observable state of one periodic job.
 */
public record JobState(
        String name,
        Duration period,
        boolean enabled,
        boolean running,
        Instant nextRunAt,
        Instant lastRunAt,
        int consecutiveFailures
) {
}
