package com.workforce.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * One agent in a company hierarchy. Immutable for the lifetime of the company.
 *
 * @param id          stable identifier used for routing (e.g. "marketing_head")
 * @param displayName human readable name (e.g. "Marketing Head")
 * @param role        hierarchy role
 * @param description short statement of what the agent handles, used when delegating
 * @param children    ids of agents this agent may delegate to
 * @param parent      id of the owning agent; null for the orchestrator
 * @param tools       names of the company tools bound to this agent
 */
public record AgentNode(
    String id,
    String displayName,
    AgentRole role,
    String description,
    List<String> children,
    String parent,
    List<String> tools
) implements Serializable {

    public AgentNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        displayName = displayName != null && !displayName.isBlank() ? displayName : id;
        description = description != null ? description : "";
        children = children != null ? List.copyOf(children) : List.of();
        tools = tools != null ? List.copyOf(tools) : List.of();
    }

    public boolean isOrchestrator() {
        return role == AgentRole.ORCHESTRATOR;
    }
}
