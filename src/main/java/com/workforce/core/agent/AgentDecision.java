package com.workforce.core.agent;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Structured decision the model returns at the end of an agent turn.
 *
 * @param action  HANDOFF to address another agent, ANSWER to reply to the user
 * @param target  agent id to hand off to; empty for ANSWER
 * @param kind    message kind for HANDOFF: task, result, evaluation or feedback
 * @param content the message payload or the final answer
 */
public record AgentDecision(
    @JsonPropertyDescription("HANDOFF to send a message to another agent, ANSWER to reply to the user")
    String action,
    @JsonPropertyDescription("Id of the agent to hand off to. Empty when action is ANSWER")
    String target,
    @JsonPropertyDescription("Message kind for HANDOFF: task, result, evaluation or feedback")
    String kind,
    @JsonPropertyDescription("The message payload, or the final answer text")
    String content
) {}
