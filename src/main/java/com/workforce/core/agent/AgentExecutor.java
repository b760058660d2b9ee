package com.workforce.core.agent;

/**
 * Runs a single agent turn. The reasoning behind the turn is opaque to the engine;
 * only the returned outcome and the reported activity matter.
 */
public interface AgentExecutor {

    /**
     * @throws AgentExecutionException if the turn cannot be completed
     */
    TurnOutcome execute(AgentTurn turn, TurnListener listener);
}
