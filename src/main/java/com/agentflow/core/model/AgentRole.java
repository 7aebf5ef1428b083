package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of roles an {@link Agent} can be bound to.
 * <p>
 * Roles are carried on the wire and in storage by their lower-case tag
 * ({@code product_manager}, {@code qa_engineer}, ...).
 */
public enum AgentRole {
    PRODUCT_MANAGER("product_manager"),
    BUSINESS_ANALYST("business_analyst"),
    DEVELOPER("developer"),
    QA_ENGINEER("qa_engineer"),
    PRODUCT_OWNER("product_owner"),
    SOLUTION_DESIGNER("solution_designer"),
    SOLUTIONS_ARCHITECT("solutions_architect"),
    DEVOPS_ENGINEER("devops_engineer"),
    ENGINEERING_MANAGER("engineering_manager"),
    ENGINEERING_LEAD("engineering_lead"),
    ADMIN_GOVERNOR("admin_governor");

    private final String tag;

    AgentRole(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * Resolves a role tag, case-insensitively.
     *
     * @return the role, or empty for a tag outside the closed set
     */
    public static Optional<AgentRole> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (AgentRole role : values()) {
            if (role.tag.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static AgentRole of(String tag) {
        return fromTag(tag).orElseThrow(() -> new IllegalArgumentException("Unknown role tag: " + tag));
    }
}
