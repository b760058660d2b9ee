package com.workforce.core.state;

import com.workforce.core.model.TaskStatus;
import com.workforce.core.model.TaskType;
import com.workforce.core.protocol.MessageKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The single unit of work a run is solving, with its revision counter and artifact ledger.
 * <p>
 * Owned by exactly one session and mutated only by that session's driver, so it carries
 * no synchronization. Illegal status moves throw {@link IllegalStateException}.
 */
public class TaskContext {

    public static final int DEFAULT_MAX_ITERATIONS = 3;

    private final String goal;
    private final TaskType taskType;
    private final int maxIterations;
    private int iteration;
    private TaskStatus status = TaskStatus.IN_PROGRESS;
    private String feedback;
    private final LinkedHashMap<String, ArtifactEntry> artifacts = new LinkedHashMap<>();
    private ArtifactEntry lastArtifact;

    public TaskContext(String goal, TaskType taskType, int maxIterations) {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("Goal must not be blank");
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        this.goal = goal;
        this.taskType = Objects.requireNonNull(taskType, "taskType");
        this.maxIterations = maxIterations;
    }

    public TaskContext(String goal, TaskType taskType) {
        this(goal, taskType, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Appends a deliverable under {@code {agentId}_v{iteration}}. Existing entries are never
     * overwritten: a second deliverable from the same agent in the same iteration gets a
     * {@code -2}, {@code -3}... suffix.
     */
    public ArtifactEntry recordArtifact(String agentId, MessageKind kind, String payload) {
        requireNotDone("record an artifact");
        String base = agentId + "_v" + iteration;
        String key = base;
        int n = 2;
        while (artifacts.containsKey(key)) {
            key = base + "-" + n++;
        }
        ArtifactEntry entry = new ArtifactEntry(key, agentId, iteration, kind, payload);
        artifacts.put(key, entry);
        lastArtifact = entry;
        return entry;
    }

    /**
     * Records a REVISE verdict: bumps the iteration and stores the feedback.
     * Moves to NEEDS_REVISION while below the ceiling; at the ceiling the caller must finish the task.
     *
     * @return true if another revision is allowed
     */
    public boolean requestRevision(String reviewerFeedback) {
        requireNotDone("request a revision");
        if (iteration >= maxIterations) {
            throw new IllegalStateException("Iteration ceiling " + maxIterations + " already reached");
        }
        iteration++;
        feedback = reviewerFeedback != null ? reviewerFeedback : "";
        if (iteration < maxIterations) {
            status = TaskStatus.NEEDS_REVISION;
            return true;
        }
        return false;
    }

    /**
     * Takes the pending feedback for re-delegation and moves NEEDS_REVISION back to IN_PROGRESS.
     */
    public String consumeFeedback() {
        if (status != TaskStatus.NEEDS_REVISION) {
            throw new IllegalStateException("No revision pending; status is " + status);
        }
        String pending = feedback;
        feedback = null;
        status = TaskStatus.IN_PROGRESS;
        return pending;
    }

    public void markDone() {
        status = TaskStatus.DONE;
    }

    public boolean isCeilingReached() {
        return iteration >= maxIterations;
    }

    private void requireNotDone(String action) {
        if (status == TaskStatus.DONE) {
            throw new IllegalStateException("Cannot " + action + ": task is already done");
        }
    }

    public String goal() {
        return goal;
    }

    public TaskType taskType() {
        return taskType;
    }

    public int iteration() {
        return iteration;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public TaskStatus status() {
        return status;
    }

    public Optional<String> feedback() {
        return Optional.ofNullable(feedback);
    }

    public Optional<ArtifactEntry> lastArtifact() {
        return Optional.ofNullable(lastArtifact);
    }

    public Optional<ArtifactEntry> artifact(String key) {
        return Optional.ofNullable(artifacts.get(key));
    }

    /** Read-only view, in insertion order. */
    public Map<String, ArtifactEntry> artifacts() {
        return Collections.unmodifiableMap(artifacts);
    }
}
