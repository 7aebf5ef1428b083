package com.agentflow.core.scoring;

import com.agentflow.core.model.Agent;

/**
 * A candidate agent with its assignment score (0-100).
 */
public record ScoredAgent(Agent agent, double score) {
}
