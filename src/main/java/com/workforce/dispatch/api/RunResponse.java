package com.workforce.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.workforce.core.model.CostEstimate;
import com.workforce.core.model.TokenUsage;
import com.workforce.core.session.RunResult;

import java.util.List;

/**
 * JSON response for a non-streaming chat request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
    @JsonProperty("run_id") String runId,
    String response,
    @JsonProperty("agents_involved") List<String> agentsInvolved,
    @JsonProperty("duration_ms") long durationMs,
    @JsonProperty("event_count") int eventCount,
    @JsonProperty("artifacts_path") String artifactsPath,
    TokenUsage usage,
    CostEstimate cost,
    String outcome,
    @JsonProperty("evaluation_outcome") String evaluationOutcome,
    @JsonProperty("task_status") String taskStatus,
    int iteration,
    String error,
    @JsonProperty("error_type") String errorType
) {

    static RunResponse from(RunResult result) {
        return new RunResponse(
                result.runId(),
                result.response(),
                result.agentsInvolved(),
                result.durationMs(),
                result.eventCount(),
                result.artifactsPath(),
                result.usage(),
                result.cost(),
                result.outcome().name(),
                result.evaluationOutcome().name(),
                result.taskStatus().name(),
                result.iteration(),
                result.error(),
                result.errorType());
    }
}
