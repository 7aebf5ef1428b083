package com.agentflow.core.scheduler;

import java.util.List;
import java.util.Map;

/**
 * Operator snapshot of the orchestrator.
 *
 * @param running             whether sweeps are scheduled
 * @param inFlightTaskIds     tasks being processed right now
 * @param taskCountsByStatus  task count per status value
 * @param agentCountsByStatus agent count per status value
 * @param sweeps              state of each periodic job
 */
public record OrchestratorStatus(
        boolean running,
        List<Long> inFlightTaskIds,
        Map<String, Long> taskCountsByStatus,
        Map<String, Long> agentCountsByStatus,
        List<JobState> sweeps
) {
}
