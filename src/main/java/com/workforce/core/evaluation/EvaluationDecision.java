package com.workforce.core.evaluation;

import com.workforce.core.model.EvaluationOutcome;
import com.workforce.core.protocol.EvaluationPayload;
import com.workforce.core.protocol.Message;
import com.workforce.core.state.ArtifactEntry;

/**
 * Outcome of applying a reviewer verdict to the task.
 */
public sealed interface EvaluationDecision {

    EvaluationPayload evaluation();

    /**
     * The task is done. {@code answer} is the evaluated deliverable; {@code outcome} tells a
     * clean pass from ceiling exhaustion.
     */
    record Finish(EvaluationPayload evaluation, ArtifactEntry artifact, String answer,
                  EvaluationOutcome outcome) implements EvaluationDecision {}

    /** Send {@code feedback} back to {@code producerId} for another revision. */
    record Revise(EvaluationPayload evaluation, String producerId, Message feedback,
                  int iteration) implements EvaluationDecision {}
}
