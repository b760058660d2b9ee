package com.workforce.core.routing;

import com.workforce.core.protocol.Message;

/**
 * Outcome of routing one turn.
 */
public sealed interface RouteDecision {

    /**
     * Hand control to {@code to}, carrying {@code message}; {@code nextStack} replaces the caller's stack.
     */
    record Deliver(String from, String to, Message message, DelegationStack nextStack) implements RouteDecision {}

    /**
     * The orchestrator answered the user; the run ends.
     */
    record Terminate(String from, String answer) implements RouteDecision {}
}
