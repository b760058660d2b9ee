package com.workforce.core.metrics;

import com.workforce.core.model.RunOutcome;
import com.workforce.core.model.TokenUsage;
import com.workforce.core.protocol.MessageKind;
import com.workforce.core.protocol.Verdict;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for session execution.
 */
@Service
public class WorkforceMetrics {

    private final MeterRegistry registry;

    public WorkforceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunResult(RunOutcome outcome, long durationMs) {
        Counter.builder("workforce.runs.total")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
        Timer.builder("workforce.run.duration")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordHandoff(MessageKind kind) {
        Counter.builder("workforce.handoffs.total")
                .tag("kind", kind.wireName())
                .register(registry)
                .increment();
    }

    public void recordEvaluation(Verdict verdict) {
        Counter.builder("workforce.evaluations.total")
                .tag("verdict", verdict.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Records how many revisions a reviewed task took before it finished.
     */
    public void recordIterationDepth(int depth) {
        DistributionSummary.builder("workforce.iteration.depth")
                .register(registry)
                .record(depth);
    }

    public void recordTokens(TokenUsage usage) {
        if (usage == null) {
            return;
        }
        Counter.builder("workforce.tokens.total")
                .description("Tokens consumed by agent turns")
                .tag("direction", "input")
                .register(registry)
                .increment(usage.inputTokens());
        Counter.builder("workforce.tokens.total")
                .description("Tokens consumed by agent turns")
                .tag("direction", "output")
                .register(registry)
                .increment(usage.outputTokens());
    }
}
