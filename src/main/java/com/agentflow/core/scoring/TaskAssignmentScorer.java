package com.agentflow.core.scoring;

import com.agentflow.core.model.Agent;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskPriority;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ranks candidate agents for a task.
 * <p>
 * Score = 40 x loadFactor + 30 x healthFactor + 30 x roleFit, where
 * <ul>
 *   <li>loadFactor = spare capacity, (maxLoad - currentLoad) / maxLoad, clamped to [0, 1]</li>
 *   <li>healthFactor = healthScore / 100</li>
 *   <li>roleFit depends on the task priority only: high priority prefers senior and
 *       manager roles (1.0, others 0.5), medium scores 0.8, anything else 0.6</li>
 * </ul>
 * Role specialisation is handled by stage routing, not here. The highest score
 * wins; ties go to the lowest agent id.
 * <p>
 * Pure function of the snapshot it is given. Agents that are not active are
 * never selected, whatever the caller passes in.
 */
@Component
public class TaskAssignmentScorer {

    private static final double LOAD_WEIGHT = 40.0;
    private static final double HEALTH_WEIGHT = 30.0;
    private static final double ROLE_WEIGHT = 30.0;

    private static final Comparator<ScoredAgent> BEST_FIRST =
            Comparator.comparingDouble(ScoredAgent::score).reversed()
                    .thenComparingLong(scored -> scored.agent().id());

    public double score(Task task, Agent agent) {
        return LOAD_WEIGHT * loadFactor(agent)
                + HEALTH_WEIGHT * (agent.healthScore() / 100.0)
                + ROLE_WEIGHT * roleFit(task.priority(), agent);
    }

    /**
     * Active candidates ordered best first.
     */
    public List<ScoredAgent> rank(Task task, Collection<Agent> candidates) {
        return candidates.stream()
                .filter(Agent::isActive)
                .map(agent -> new ScoredAgent(agent, score(task, agent)))
                .sorted(BEST_FIRST)
                .toList();
    }

    /**
     * @return the best active candidate, or empty when there is none
     */
    public Optional<ScoredAgent> selectBest(Task task, Collection<Agent> candidates) {
        return rank(task, candidates).stream().findFirst();
    }

    static double loadFactor(Agent agent) {
        if (agent.maxLoad() <= 0) {
            return 0.0;
        }
        double spare = (double) (agent.maxLoad() - agent.currentLoad()) / agent.maxLoad();
        return Math.max(0.0, Math.min(1.0, spare));
    }

    static double roleFit(TaskPriority priority, Agent agent) {
        return switch (priority) {
            case HIGH -> isSeniorRole(agent) ? 1.0 : 0.5;
            case MEDIUM -> 0.8;
            default -> 0.6;
        };
    }

    private static boolean isSeniorRole(Agent agent) {
        String tag = agent.role().tag().toLowerCase(Locale.ROOT);
        return tag.contains("senior") || tag.contains("manager");
    }
}
