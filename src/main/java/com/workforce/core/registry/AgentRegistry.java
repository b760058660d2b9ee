package com.workforce.core.registry;

import com.workforce.core.model.AgentNode;
import com.workforce.core.model.AgentRole;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of one company's agent hierarchy.
 * <p>
 * Built once when a company is loaded and never mutated afterwards, so a single
 * instance is safely shared by every concurrent run of that company.
 */
public final class AgentRegistry {

    private final Map<String, AgentNode> agents;
    private final AgentNode orchestrator;

    private AgentRegistry(Map<String, AgentNode> agents, AgentNode orchestrator) {
        this.agents = Collections.unmodifiableMap(agents);
        this.orchestrator = orchestrator;
    }

    /**
     * Builds a registry and checks the hierarchy is well formed: exactly one orchestrator,
     * unique ids, and parent/child links that agree with each other.
     *
     * @throws IllegalArgumentException if the hierarchy is inconsistent
     */
    public static AgentRegistry of(Collection<AgentNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("Agent hierarchy is empty");
        }
        Map<String, AgentNode> byId = new LinkedHashMap<>();
        AgentNode orchestrator = null;
        for (AgentNode node : nodes) {
            if (byId.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate agent id: " + node.id());
            }
            if (node.isOrchestrator()) {
                if (orchestrator != null) {
                    throw new IllegalArgumentException("More than one orchestrator: "
                            + orchestrator.id() + ", " + node.id());
                }
                orchestrator = node;
            }
        }
        if (orchestrator == null) {
            throw new IllegalArgumentException("Agent hierarchy has no orchestrator");
        }
        if (orchestrator.parent() != null) {
            throw new IllegalArgumentException("Orchestrator '" + orchestrator.id() + "' must not have a parent");
        }

        for (AgentNode node : byId.values()) {
            for (String childId : node.children()) {
                AgentNode child = byId.get(childId);
                if (child == null) {
                    throw new IllegalArgumentException("Agent '" + node.id() + "' lists unknown child '" + childId + "'");
                }
                if (!node.id().equals(child.parent())) {
                    throw new IllegalArgumentException("Agent '" + childId + "' is a child of '" + node.id()
                            + "' but names parent '" + child.parent() + "'");
                }
            }
            if (!node.isOrchestrator()) {
                AgentNode parent = byId.get(node.parent());
                if (parent == null) {
                    throw new IllegalArgumentException("Agent '" + node.id() + "' has unknown parent '" + node.parent() + "'");
                }
                if (!parent.children().contains(node.id())) {
                    throw new IllegalArgumentException("Agent '" + node.id() + "' is not listed among the children of '"
                            + parent.id() + "'");
                }
            }
        }
        return new AgentRegistry(byId, orchestrator);
    }

    public Optional<AgentNode> find(String agentId) {
        return Optional.ofNullable(agentId != null ? agents.get(agentId) : null);
    }

    /**
     * @throws IllegalArgumentException if no agent has the id
     */
    public AgentNode require(String agentId) {
        return find(agentId).orElseThrow(() -> new IllegalArgumentException("Unknown agent: " + agentId));
    }

    public boolean contains(String agentId) {
        return agentId != null && agents.containsKey(agentId);
    }

    public AgentNode orchestrator() {
        return orchestrator;
    }

    /**
     * The agent that evaluates deliverables, if the company has one.
     */
    public Optional<AgentNode> reviewer() {
        return agents.values().stream()
                .filter(a -> a.role() == AgentRole.REVIEWER)
                .findFirst();
    }

    public List<AgentNode> childrenOf(String agentId) {
        return require(agentId).children().stream()
                .map(agents::get)
                .toList();
    }

    /** All agents in declaration order. */
    public List<AgentNode> agents() {
        return List.copyOf(agents.values());
    }

    public int size() {
        return agents.size();
    }
}
