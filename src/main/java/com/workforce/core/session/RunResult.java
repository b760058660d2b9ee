package com.workforce.core.session;

import com.workforce.core.model.CostEstimate;
import com.workforce.core.model.EvaluationOutcome;
import com.workforce.core.model.RunOutcome;
import com.workforce.core.model.TaskStatus;
import com.workforce.core.model.TokenUsage;

import java.util.List;

/**
 * Summary of a finished run.
 *
 * @param runId             run id
 * @param response          final answer; null unless the run completed
 * @param agentsInvolved    agents that took part, in order of first appearance
 * @param durationMs        wall time from start to terminal state
 * @param eventCount        events emitted
 * @param artifactsPath     run directory, or null when artifacts are disabled
 * @param usage             accumulated token usage
 * @param cost              estimated cost
 * @param outcome           how the run ended
 * @param evaluationOutcome how the review loop ended
 * @param taskStatus        final task status
 * @param iteration         revisions used
 * @param error             error message when the run errored
 * @param errorType         error category when the run errored
 */
public record RunResult(
    String runId,
    String response,
    List<String> agentsInvolved,
    long durationMs,
    int eventCount,
    String artifactsPath,
    TokenUsage usage,
    CostEstimate cost,
    RunOutcome outcome,
    EvaluationOutcome evaluationOutcome,
    TaskStatus taskStatus,
    int iteration,
    String error,
    String errorType
) {

    public boolean isCompleted() {
        return outcome == RunOutcome.COMPLETED;
    }
}
