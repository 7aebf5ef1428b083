package com.agentflow.core.reasoner;

import com.agentflow.core.model.Agent;
import com.agentflow.core.model.AgentRole;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.WorkflowStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Deterministic {@link Reasoner} that walks a task through the pipeline
 * without producing any content of its own.
 * <p>
 * Every stage succeeds and names the owner of the following stage; acceptance
 * completes the task. An agent whose health score has dropped below
 * {@value #ESCALATION_HEALTH} escalates instead.
 */
public class StagePipelineReasoner implements Reasoner {

    private static final Logger log = LoggerFactory.getLogger(StagePipelineReasoner.class);

    static final int ESCALATION_HEALTH = 50;

    @Override
    public ReasonerResult processTask(Agent agent, Task task) {
        if (agent.healthScore() < ESCALATION_HEALTH) {
            return ReasonerResult.escalate(
                    agent.name() + " cannot continue on '" + task.title() + "'",
                    "Agent health degraded (score " + agent.healthScore() + ")");
        }

        WorkflowStage stage = task.workflow().stage();
        if (!stage.isPipeline()) {
            log.debug("Task {} at non-pipeline stage {}; restarting at intake", task.id(), stage.value());
            return ReasonerResult.handOff(agent.name() + " restarted '" + task.title() + "'",
                    AgentRole.PRODUCT_MANAGER.tag());
        }

        String response = agent.name() + " finished " + stage.value() + " for '" + task.title() + "'";
        List<String> artifacts = List.of(stage.value() + "-" + task.id());
        return stage.next()
                .flatMap(WorkflowStage::owner)
                .map(next -> ReasonerResult.handOff(response, next.tag()))
                .orElseGet(() -> ReasonerResult.completed(response))
                .withArtifacts(artifacts);
    }
}
