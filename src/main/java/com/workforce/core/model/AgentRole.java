package com.workforce.core.model;

/**
 * Position of an agent in the company hierarchy.
 */
public enum AgentRole {
    ORCHESTRATOR("Orchestrator"),
    LEAD("Lead"),
    WORKER("Worker"),
    REVIEWER("Reviewer");

    private final String displayName;

    AgentRole(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Parses either the enum name or the display name, case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no role
     */
    public static AgentRole fromString(String value) {
        if (value != null) {
            for (AgentRole role : values()) {
                if (role.name().equalsIgnoreCase(value.trim()) || role.displayName.equalsIgnoreCase(value.trim())) {
                    return role;
                }
            }
        }
        throw new IllegalArgumentException("Unknown agent role: " + value);
    }
}
