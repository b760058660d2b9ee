package com.workforce.core.evaluation;

import com.workforce.core.protocol.Message;
import com.workforce.core.state.ArtifactEntry;

/**
 * What happens to a result that has reached the orchestrator.
 */
public sealed interface ResultDisposition {

    ArtifactEntry artifact();

    /** The task type needs no review: the orchestrator takes the result and continues. */
    record ToOrchestrator(ArtifactEntry artifact) implements ResultDisposition {}

    /** The result goes to the reviewer first, carried by {@code reviewTask}. */
    record ToReviewer(ArtifactEntry artifact, String reviewerId, Message reviewTask) implements ResultDisposition {}
}
