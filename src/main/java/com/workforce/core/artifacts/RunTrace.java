package com.workforce.core.artifacts;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.workforce.core.model.CostEstimate;
import com.workforce.core.model.EvaluationOutcome;
import com.workforce.core.model.HandoffStep;
import com.workforce.core.model.RunOutcome;
import com.workforce.core.model.TaskStatus;
import com.workforce.core.model.TaskType;
import com.workforce.core.model.TokenUsage;

import java.time.Instant;
import java.util.List;

/**
 * Contents of {@code trace.json}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunTrace(
    @JsonProperty("run_id") String runId,
    @JsonProperty("company_id") String companyId,
    String goal,
    @JsonProperty("task_type") TaskType taskType,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("ended_at") Instant endedAt,
    @JsonProperty("duration_ms") long durationMs,
    RunOutcome outcome,
    @JsonProperty("evaluation_outcome") EvaluationOutcome evaluationOutcome,
    @JsonProperty("task_status") TaskStatus taskStatus,
    int iteration,
    @JsonProperty("max_iterations") int maxIterations,
    List<HandoffStep> handoffs,
    @JsonProperty("agents_involved") List<String> agentsInvolved,
    TokenUsage usage,
    CostEstimate cost,
    String error,
    @JsonProperty("error_type") String errorType
) {}
