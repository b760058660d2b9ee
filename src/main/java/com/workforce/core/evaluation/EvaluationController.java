package com.workforce.core.evaluation;

import com.workforce.core.model.AgentNode;
import com.workforce.core.model.EvaluationOutcome;
import com.workforce.core.model.TaskType;
import com.workforce.core.protocol.EvaluationPayload;
import com.workforce.core.protocol.Message;
import com.workforce.core.protocol.MessageCodec;
import com.workforce.core.protocol.Verdict;
import com.workforce.core.registry.AgentRegistry;
import com.workforce.core.routing.RoutingException;
import com.workforce.core.state.ArtifactEntry;
import com.workforce.core.state.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Gates user-facing deliverables behind a bounded PASS/REVISE loop.
 * <p>
 * A result reaching the orchestrator is recorded in the task's artifact ledger. When its task
 * type requires review and the company has a reviewer, the result is handed to the reviewer.
 * A PASS ends the task with the evaluated artifact. A REVISE bumps the iteration: below the
 * ceiling the feedback goes back to the producing agent, at the ceiling the task ends with
 * the last artifact anyway (fail-open).
 */
public class EvaluationController {

    private static final Logger log = LoggerFactory.getLogger(EvaluationController.class);

    private final AgentRegistry registry;
    private final MessageCodec codec;
    private final Set<TaskType> reviewedTypes;

    /** Artifact currently with the reviewer, if any. */
    private ArtifactEntry underReview;

    public EvaluationController(AgentRegistry registry, MessageCodec codec, Set<TaskType> reviewedTypes) {
        this.registry = registry;
        this.codec = codec;
        this.reviewedTypes = reviewedTypes.isEmpty() ? EnumSet.noneOf(TaskType.class) : EnumSet.copyOf(reviewedTypes);
    }

    public boolean requiresReview(TaskType taskType) {
        return reviewedTypes.contains(taskType) && registry.reviewer().isPresent();
    }

    /**
     * Handles a result addressed to the orchestrator by {@code producerId}.
     */
    public ResultDisposition onResult(TaskContext task, String producerId, Message result) {
        ArtifactEntry artifact = task.recordArtifact(producerId, result.kind(), result.payload());
        Optional<AgentNode> reviewer = registry.reviewer();
        if (!reviewedTypes.contains(task.taskType()) || reviewer.isEmpty()) {
            log.debug("Result {} from {} needs no review (task type {})", artifact.key(), producerId, task.taskType());
            return new ResultDisposition.ToOrchestrator(artifact);
        }

        underReview = artifact;
        Map<String, Object> review = new LinkedHashMap<>();
        review.put("goal", task.goal());
        review.put("task_type", task.taskType().wireName());
        review.put("artifact_key", artifact.key());
        review.put("iteration", task.iteration());
        review.put("max_iterations", task.maxIterations());
        review.put("deliverable", artifact.payload());
        log.info("Sending {} to reviewer {} (iteration {}/{})", artifact.key(), reviewer.get().id(),
                task.iteration(), task.maxIterations());
        return new ResultDisposition.ToReviewer(artifact, reviewer.get().id(), Message.task(codec.encode(review)));
    }

    /**
     * Applies a reviewer's evaluation to the task.
     *
     * @throws com.workforce.core.protocol.ProtocolException if the evaluation cannot be decoded
     * @throws RoutingException if no deliverable is awaiting review
     */
    public EvaluationDecision onEvaluation(TaskContext task, Message evaluation) {
        if (underReview == null) {
            throw new RoutingException("Evaluation received but no deliverable is awaiting review");
        }
        EvaluationPayload payload = codec.decodeEvaluation(evaluation);
        ArtifactEntry artifact = underReview;
        underReview = null;

        if (payload.verdict() == Verdict.PASS) {
            task.markDone();
            log.info("Deliverable {} passed review at iteration {}", artifact.key(), task.iteration());
            return new EvaluationDecision.Finish(payload, artifact, artifact.payload(), EvaluationOutcome.PASSED);
        }

        boolean anotherRound = task.requestRevision(payload.feedback());
        if (!anotherRound) {
            task.markDone();
            log.warn("Deliverable {} still needs revision but the ceiling of {} iterations is reached; returning it",
                    artifact.key(), task.maxIterations());
            return new EvaluationDecision.Finish(payload, artifact, artifact.payload(), EvaluationOutcome.CEILING_REACHED);
        }

        String feedback = task.consumeFeedback();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("goal", task.goal());
        body.put("feedback", feedback);
        body.put("iteration", task.iteration());
        body.put("max_iterations", task.maxIterations());
        body.put("scores", payload.scores());
        body.put("previous_artifact_key", artifact.key());
        body.put("previous_deliverable", artifact.payload());
        log.info("Deliverable {} needs revision; re-delegating to {} (iteration {}/{})",
                artifact.key(), artifact.agentId(), task.iteration(), task.maxIterations());
        return new EvaluationDecision.Revise(payload, artifact.agentId(), Message.feedback(codec.encode(body)),
                task.iteration());
    }

    /** True while a deliverable is with the reviewer. */
    public boolean isAwaitingEvaluation() {
        return underReview != null;
    }
}
