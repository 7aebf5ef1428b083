package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Stages a task moves through.
 * <p>
 * The pipeline stages form a fixed total order, each owned by one role:
 * intake (product manager), elaboration (business analyst), implementation
 * (developer), verification (QA) and acceptance (product owner).
 * {@link #COMPLETED} and {@link #ESCALATED} are absorbing for the automatic
 * machine; {@link #REASSIGNED} is the operator-driven recovery step that leads
 * back to {@link #INTAKE}.
 */
public enum WorkflowStage {
    INTAKE(AgentRole.PRODUCT_MANAGER),
    ELABORATION(AgentRole.BUSINESS_ANALYST),
    IMPLEMENTATION(AgentRole.DEVELOPER),
    VERIFICATION(AgentRole.QA_ENGINEER),
    ACCEPTANCE(AgentRole.PRODUCT_OWNER),
    REASSIGNED(null),
    ESCALATED(null),
    COMPLETED(null);

    private final AgentRole owner;

    WorkflowStage(AgentRole owner) {
        this.owner = owner;
    }

    /** The role that works this stage, empty for the non-pipeline stages. */
    public Optional<AgentRole> owner() {
        return Optional.ofNullable(owner);
    }

    public boolean isPipeline() {
        return owner != null;
    }

    /** The pipeline stage after this one, empty after acceptance or outside the pipeline. */
    public Optional<WorkflowStage> next() {
        if (!isPipeline() || this == ACCEPTANCE) {
            return Optional.empty();
        }
        return Optional.of(values()[ordinal() + 1]);
    }

    /** The pipeline stage owned by the given role, if the role owns one. */
    public static Optional<WorkflowStage> ownedBy(AgentRole role) {
        for (WorkflowStage stage : values()) {
            if (stage.owner == role && stage.owner != null) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkflowStage of(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
