package com.agentflow.core.reasoner;

import java.util.List;

/**
 * Structured outcome of one {@link Reasoner#processTask} call.
 *
 * @param success          whether the agent finished its part
 * @param response         the agent's reply, recorded as a task response
 * @param nextRoleTag      role to hand the task to, null when the pipeline is exhausted
 * @param shouldEscalate   route the task to the recovery role instead of handing off
 * @param escalationReason why, when escalating
 * @param artifacts        names of produced artifacts
 * @param followUpTasks    new work to spawn as child tasks
 * @param helpSkills       skills the agent needs help with before it can finish
 * @param error            failure description when {@code success} is false
 */
public record ReasonerResult(
        boolean success,
        String response,
        String nextRoleTag,
        boolean shouldEscalate,
        String escalationReason,
        List<String> artifacts,
        List<FollowUpTask> followUpTasks,
        List<String> helpSkills,
        String error
) {

    public ReasonerResult {
        response = response == null ? "" : response;
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        followUpTasks = followUpTasks == null ? List.of() : List.copyOf(followUpTasks);
        helpSkills = helpSkills == null ? List.of() : List.copyOf(helpSkills);
    }

    /** Stage finished; hand off to {@code nextRoleTag}. */
    public static ReasonerResult handOff(String response, String nextRoleTag) {
        return new ReasonerResult(true, response, nextRoleTag, false, null, List.of(), List.of(), List.of(), null);
    }

    /** Stage finished and nothing follows: the task is complete. */
    public static ReasonerResult completed(String response) {
        return new ReasonerResult(true, response, null, false, null, List.of(), List.of(), List.of(), null);
    }

    public static ReasonerResult escalate(String response, String reason) {
        return new ReasonerResult(true, response, null, true, reason, List.of(), List.of(), List.of(), null);
    }

    public static ReasonerResult failure(String error) {
        return new ReasonerResult(false, "", null, false, null, List.of(), List.of(), List.of(),
                error == null ? "Unknown reasoner failure" : error);
    }

    public ReasonerResult withArtifacts(List<String> newArtifacts) {
        return new ReasonerResult(success, response, nextRoleTag, shouldEscalate, escalationReason,
                newArtifacts, followUpTasks, helpSkills, error);
    }

    public ReasonerResult withFollowUps(List<FollowUpTask> newFollowUps) {
        return new ReasonerResult(success, response, nextRoleTag, shouldEscalate, escalationReason,
                artifacts, newFollowUps, helpSkills, error);
    }

    public ReasonerResult withHelpSkills(List<String> skills) {
        return new ReasonerResult(success, response, nextRoleTag, shouldEscalate, escalationReason,
                artifacts, followUpTasks, skills, error);
    }
}
