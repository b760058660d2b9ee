package com.workforce.core.state;

import com.workforce.core.model.EvaluationOutcome;
import com.workforce.core.model.HandoffStep;
import com.workforce.core.model.RunOutcome;
import com.workforce.core.model.TokenUsage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ledger of one run: trace, usage and how it ended. Sealed exactly once.
 */
public class RunRecord {

    private final String runId;
    private final String companyId;
    private final Instant startedAt;
    private Instant endedAt;
    private final List<HandoffStep> trace = new ArrayList<>();
    private final Set<String> agentsInvolved = new LinkedHashSet<>();
    private TokenUsage usage = TokenUsage.empty();
    private String response;
    private RunOutcome outcome = RunOutcome.RUNNING;
    private EvaluationOutcome evaluationOutcome = EvaluationOutcome.NOT_REVIEWED;
    private String errorMessage;
    private String errorType;
    private int eventCount;

    public RunRecord(String runId, String companyId, Instant startedAt) {
        this.runId = runId;
        this.companyId = companyId;
        this.startedAt = startedAt;
    }

    public void recordHandoff(HandoffStep step) {
        requireRunning();
        trace.add(step);
        agentsInvolved.add(step.from());
        agentsInvolved.add(step.to());
    }

    public void involve(String agentId) {
        agentsInvolved.add(agentId);
    }

    public void addUsage(TokenUsage turnUsage) {
        usage = usage.plus(turnUsage);
    }

    public void countEvent() {
        eventCount++;
    }

    public void evaluationOutcome(EvaluationOutcome value) {
        this.evaluationOutcome = value;
    }

    public void complete(String finalResponse, Instant at) {
        seal(RunOutcome.COMPLETED, at);
        this.response = finalResponse;
    }

    public void fail(String type, String message, Instant at) {
        seal(RunOutcome.ERRORED, at);
        this.errorType = type;
        this.errorMessage = message;
    }

    public void abort(Instant at) {
        seal(RunOutcome.ABORTED, at);
    }

    private void seal(RunOutcome terminal, Instant at) {
        requireRunning();
        this.outcome = terminal;
        this.endedAt = at;
    }

    private void requireRunning() {
        if (outcome != RunOutcome.RUNNING) {
            throw new IllegalStateException("Run " + runId + " already ended as " + outcome);
        }
    }

    public boolean isTerminal() {
        return outcome != RunOutcome.RUNNING;
    }

    public long durationMs() {
        Instant end = endedAt != null ? endedAt : Instant.now();
        return Duration.between(startedAt, end).toMillis();
    }

    public String runId() {
        return runId;
    }

    public String companyId() {
        return companyId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant endedAt() {
        return endedAt;
    }

    public List<HandoffStep> trace() {
        return Collections.unmodifiableList(trace);
    }

    public List<String> agentsInvolved() {
        return List.copyOf(agentsInvolved);
    }

    public TokenUsage usage() {
        return usage;
    }

    public String response() {
        return response;
    }

    public RunOutcome outcome() {
        return outcome;
    }

    public EvaluationOutcome evaluationOutcome() {
        return evaluationOutcome;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String errorType() {
        return errorType;
    }

    public int eventCount() {
        return eventCount;
    }
}
