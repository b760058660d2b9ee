package com.workforce.core.session;

import com.workforce.core.model.TaskType;
import com.workforce.core.state.TaskContext;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-run limits and the task types that go through review.
 *
 * @param maxIterations     evaluation ceiling
 * @param maxTurns          agent turns allowed per run
 * @param reviewedTaskTypes task types whose deliverables the reviewer must see
 */
public record SessionSettings(
    int maxIterations,
    int maxTurns,
    Set<TaskType> reviewedTaskTypes
) {

    public static final int DEFAULT_MAX_TURNS = 30;

    public SessionSettings {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1");
        }
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be at least 1");
        }
        reviewedTaskTypes = reviewedTaskTypes == null || reviewedTaskTypes.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(reviewedTaskTypes));
    }

    public static SessionSettings defaults() {
        return new SessionSettings(TaskContext.DEFAULT_MAX_ITERATIONS, DEFAULT_MAX_TURNS,
                EnumSet.of(TaskType.CONTENT_CREATION));
    }
}
