package com.workforce.core.session;

import com.workforce.core.model.OrchestrationException;

/**
 * A run used up its agent turn allowance without finishing.
 */
public class TurnLimitExceededException extends OrchestrationException {

    public TurnLimitExceededException(int maxTurns) {
        super("Run exceeded the limit of " + maxTurns + " agent turns");
    }

    @Override
    public String errorType() {
        return "turn_limit";
    }
}
