package com.workforce.core.metrics;

import com.workforce.core.model.RunOutcome;
import com.workforce.core.model.TokenUsage;
import com.workforce.core.protocol.MessageKind;
import com.workforce.core.protocol.Verdict;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkforceMetricsTest {

    private SimpleMeterRegistry registry;
    private WorkforceMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new WorkforceMetrics(registry);
    }

    @Test
    @DisplayName("recordRunResult counts by outcome and times the run")
    void recordRunResult() {
        metrics.recordRunResult(RunOutcome.COMPLETED, 1200);
        metrics.recordRunResult(RunOutcome.COMPLETED, 800);
        metrics.recordRunResult(RunOutcome.ERRORED, 50);

        assertEquals(2.0, registry.find("workforce.runs.total").tag("outcome", "completed").counter().count());
        assertEquals(1.0, registry.find("workforce.runs.total").tag("outcome", "errored").counter().count());
        var timer = registry.find("workforce.run.duration").tag("outcome", "completed").timer();
        assertNotNull(timer);
        assertEquals(2, timer.count());
    }

    @Test
    @DisplayName("recordHandoff tags by message kind")
    void recordHandoff() {
        metrics.recordHandoff(MessageKind.TASK);
        metrics.recordHandoff(MessageKind.FEEDBACK);

        assertEquals(1.0, registry.find("workforce.handoffs.total").tag("kind", "task").counter().count());
        assertEquals(1.0, registry.find("workforce.handoffs.total").tag("kind", "feedback").counter().count());
    }

    @Test
    @DisplayName("recordEvaluation tags by verdict")
    void recordEvaluation() {
        metrics.recordEvaluation(Verdict.PASS);
        metrics.recordEvaluation(Verdict.REVISE);
        metrics.recordEvaluation(Verdict.REVISE);

        assertEquals(1.0, registry.find("workforce.evaluations.total").tag("verdict", "pass").counter().count());
        assertEquals(2.0, registry.find("workforce.evaluations.total").tag("verdict", "revise").counter().count());
    }

    @Test
    @DisplayName("recordIterationDepth feeds a distribution summary")
    void recordIterationDepth() {
        metrics.recordIterationDepth(0);
        metrics.recordIterationDepth(2);

        var summary = registry.find("workforce.iteration.depth").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(2.0, summary.max());
    }

    @Test
    @DisplayName("recordTokens splits input and output; null is ignored")
    void recordTokens() {
        metrics.recordTokens(TokenUsage.of(100, 40, "gpt-4.1"));
        metrics.recordTokens(null);

        assertEquals(100.0, registry.find("workforce.tokens.total").tag("direction", "input").counter().count());
        assertEquals(40.0, registry.find("workforce.tokens.total").tag("direction", "output").counter().count());
    }
}
