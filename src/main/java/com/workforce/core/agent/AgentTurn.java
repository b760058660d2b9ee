package com.workforce.core.agent;

import com.workforce.core.company.CompanyProfile;
import com.workforce.core.model.AgentNode;
import com.workforce.core.model.TaskStatus;
import com.workforce.core.model.TaskType;
import com.workforce.core.protocol.Message;

import java.util.List;

/**
 * Everything an agent needs to take one turn.
 *
 * @param runId          owning run
 * @param company        company the agent works for
 * @param agent          the agent taking the turn
 * @param sender         who addressed {@code input} to it ("user" for the opening task)
 * @param input          the message it must act on
 * @param conversation   messages delivered so far in this run, oldest first
 * @param task           current state of the task
 * @param allowedTargets agents it may address this turn
 */
public record AgentTurn(
    String runId,
    CompanyProfile company,
    AgentNode agent,
    String sender,
    Message input,
    List<ConversationEntry> conversation,
    TaskSnapshot task,
    List<String> allowedTargets
) {

    public AgentTurn {
        conversation = conversation != null ? List.copyOf(conversation) : List.of();
        allowedTargets = allowedTargets != null ? List.copyOf(allowedTargets) : List.of();
    }

    /**
     * Read-only copy of the task state at the start of the turn.
     */
    public record TaskSnapshot(
        String goal,
        TaskType taskType,
        int iteration,
        int maxIterations,
        TaskStatus status
    ) {}
}
