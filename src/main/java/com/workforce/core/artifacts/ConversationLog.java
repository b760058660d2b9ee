package com.workforce.core.artifacts;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.workforce.core.agent.ConversationEntry;
import com.workforce.core.state.ArtifactEntry;

import java.util.List;

/**
 * Contents of {@code conversation.json}: every delivered message plus the artifact ledger.
 */
public record ConversationLog(
    @JsonProperty("run_id") String runId,
    String goal,
    List<ConversationEntry> messages,
    List<ArtifactEntry> artifacts,
    String response
) {}
