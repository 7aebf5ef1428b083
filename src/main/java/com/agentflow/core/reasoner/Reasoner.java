package com.agentflow.core.reasoner;

import com.agentflow.core.model.Agent;
import com.agentflow.core.model.Task;

/**
 * Decision capability invoked once per (agent, task) pair.
 * <p>
 * Implementations may throw; the scheduler converts any runtime exception
 * into {@link ReasonerResult#failure(String)}.
 */
@FunctionalInterface
public interface Reasoner {

    ReasonerResult processTask(Agent agent, Task task);
}
