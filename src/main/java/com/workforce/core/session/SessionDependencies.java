package com.workforce.core.session;

import com.workforce.core.agent.AgentExecutor;
import com.workforce.core.artifacts.ArtifactStore;
import com.workforce.core.cost.CostEstimator;
import com.workforce.core.events.EventBus;
import com.workforce.core.metrics.WorkforceMetrics;
import com.workforce.core.protocol.MessageCodec;

import java.time.Clock;
import java.util.Objects;

/**
 * Collaborators a session needs. Shared across runs; none of them hold run state.
 */
public record SessionDependencies(
    AgentExecutor executor,
    MessageCodec codec,
    ArtifactStore artifactStore,
    CostEstimator costEstimator,
    EventBus eventBus,
    WorkforceMetrics metrics,
    Clock clock
) {

    public SessionDependencies {
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(artifactStore, "artifactStore");
        Objects.requireNonNull(costEstimator, "costEstimator");
        Objects.requireNonNull(eventBus, "eventBus");
        Objects.requireNonNull(metrics, "metrics");
        clock = clock != null ? clock : Clock.systemUTC();
    }
}
