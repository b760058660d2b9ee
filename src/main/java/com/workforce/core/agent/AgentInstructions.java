package com.workforce.core.agent;

import com.workforce.core.company.CompanyProfile;
import com.workforce.core.model.AgentNode;
import com.workforce.core.model.AgentRole;
import com.workforce.core.registry.AgentRegistry;

import java.util.List;

/**
 * Builds the system and user prompts for one agent turn.
 * Pure functions, no Spring dependencies.
 */
public final class AgentInstructions {

    static final int MAX_CONVERSATION_ENTRIES = 12;
    static final int MAX_ENTRY_CHARS = 1_500;

    private AgentInstructions() {}

    public static String system(AgentTurn turn) {
        CompanyProfile company = turn.company();
        AgentNode agent = turn.agent();
        var sb = new StringBuilder();

        sb.append("You are the ").append(agent.displayName()).append(" of ").append(company.name()).append(".\n\n");
        if (!agent.description().isBlank()) {
            sb.append("## Your Role\n\n").append(agent.description()).append("\n\n");
        }

        sb.append("## Company Context\n\n");
        appendField(sb, "Company", company.name());
        appendField(sb, "Mission", company.mission());
        appendField(sb, "Brand Voice", company.brandVoice());
        appendField(sb, "Target Audience", company.targetAudience());
        appendField(sb, "Philosophy", company.philosophy());
        if (!company.products().isEmpty()) {
            appendField(sb, "Products", String.join(", ", company.products()));
        }
        sb.append("\n");

        appendTeam(sb, turn, company.registry());

        if (!agent.tools().isEmpty()) {
            sb.append("## Tools Available\n\n");
            agent.tools().forEach(t -> sb.append("- ").append(t).append("\n"));
            sb.append("\n");
        }

        sb.append("## Protocol\n\n");
        sb.append(roleRules(agent.role()));
        sb.append("\nEnd every turn with exactly one decision. Valid handoff targets right now: ");
        sb.append(turn.allowedTargets().isEmpty() ? "(none)" : String.join(", ", turn.allowedTargets()));
        sb.append(".\n");
        return sb.toString();
    }

    public static String user(AgentTurn turn) {
        var sb = new StringBuilder();
        AgentTurn.TaskSnapshot task = turn.task();
        sb.append("## Task\n\n");
        sb.append("- **Goal:** ").append(task.goal()).append("\n");
        sb.append("- **Type:** ").append(task.taskType().wireName()).append("\n");
        sb.append("- **Revision:** ").append(task.iteration()).append(" of ").append(task.maxIterations()).append("\n\n");

        List<ConversationEntry> history = turn.conversation();
        if (history.size() > 1) {
            sb.append("## Conversation So Far\n\n");
            int from = Math.max(0, history.size() - MAX_CONVERSATION_ENTRIES);
            if (from > 0) {
                sb.append("(").append(from).append(" earlier messages omitted)\n");
            }
            for (ConversationEntry entry : history.subList(from, history.size())) {
                sb.append("- ").append(entry.from()).append(" -> ").append(entry.to())
                  .append(" [").append(entry.kind().wireName()).append("]: ")
                  .append(truncate(entry.payload())).append("\n");
            }
            sb.append("\n");
        }

        sb.append("## Incoming ").append(turn.input().kind().wireName()).append(" from ").append(turn.sender()).append("\n\n");
        sb.append(turn.input().payload()).append("\n");
        return sb.toString();
    }

    private static void appendTeam(StringBuilder sb, AgentTurn turn, AgentRegistry registry) {
        AgentNode agent = turn.agent();
        List<AgentNode> team = agent.isOrchestrator()
                ? registry.agents().stream().filter(a -> !a.isOrchestrator()).toList()
                : registry.childrenOf(agent.id());
        if (team.isEmpty()) {
            return;
        }
        sb.append("## Your Team\n\n");
        for (AgentNode member : team) {
            sb.append("- **").append(member.id()).append("** (").append(member.displayName()).append(", ")
              .append(member.role().displayName()).append(")");
            if (!member.description().isBlank()) {
                sb.append(": ").append(member.description());
            }
            sb.append("\n");
        }
        sb.append("\n");
    }

    private static String roleRules(AgentRole role) {
        return switch (role) {
            case ORCHESTRATOR -> """
                    You receive the user's request. Delegate work with action HANDOFF, kind "task", to one team \
                    member at a time and wait for the result. Results come back to you. Revision feedback from \
                    the reviewer is routed automatically. When you have what you need, reply to the user with \
                    action ANSWER and the complete final response as content.
                    """;
            case LEAD -> """
                    You are a LEAD agent. You may delegate to your own workers with kind "task". When your work is \
                    complete, report back to the agent that delegated to you with kind "result" and the full \
                    deliverable as content. You never answer the user directly.
                    """;
            case WORKER -> """
                    You are a WORKER agent. Do the task, then report back to the agent that delegated to you with \
                    action HANDOFF, kind "result", and the full deliverable as content. You never answer the user \
                    directly and never contact other agents.
                    """;
            case REVIEWER -> """
                    You are the REVIEWER. Evaluate the deliverable against the goal and the brand. Reply to the \
                    orchestrator with action HANDOFF, kind "evaluation", and content that is a JSON object: \
                    {"verdict": "PASS" or "REVISE", "scores": {"brand_voice": 1-5, "quality": 1-5, \
                    "completion": 1-5}, "feedback": "specific, actionable notes"}. Use REVISE only when the \
                    deliverable genuinely needs changes.
                    """;
        };
    }

    private static void appendField(StringBuilder sb, String label, String value) {
        if (value != null && !value.isBlank()) {
            sb.append("- **").append(label).append(":** ").append(value).append("\n");
        }
    }

    static String truncate(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replace('\n', ' ');
        return flat.length() <= MAX_ENTRY_CHARS ? flat : flat.substring(0, MAX_ENTRY_CHARS - 3) + "...";
    }
}
