package com.workforce.core.agent;

import com.workforce.core.model.TokenUsage;
import com.workforce.core.protocol.Message;

/**
 * What an agent did with its turn.
 */
public sealed interface TurnOutcome {

    TokenUsage usage();

    /** Address {@code message} to {@code target}. */
    record Handoff(String target, Message message, TokenUsage usage) implements TurnOutcome {}

    /** Answer the user directly. Only legal for the orchestrator. */
    record FinalAnswer(String text, TokenUsage usage) implements TurnOutcome {}
}
