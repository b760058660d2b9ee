package com.workforce.core.artifacts;

import com.workforce.core.events.SessionEventType;
import com.workforce.core.model.HandoffStep;
import com.workforce.core.protocol.MessageKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rebuilds a run's handoff trace and final answer from its {@code events.jsonl} alone.
 * For a completed run the result matches {@code trace.json} and {@code response.md}.
 */
public class ArtifactReplayer {

    private final ArtifactStore store;

    public ArtifactReplayer(ArtifactStore store) {
        this.store = store;
    }

    public ReplayedRun replay(String runId) {
        return replay(runId, store.readEvents(runId));
    }

    /**
     * Replays an already loaded event list.
     */
    public static ReplayedRun replay(String runId, List<Map<String, Object>> events) {
        List<HandoffStep> handoffs = new ArrayList<>();
        String answer = null;
        String error = null;
        String terminal = null;
        for (Map<String, Object> event : events) {
            SessionEventType type = SessionEventType.fromWire(String.valueOf(event.get("type")));
            switch (type) {
                case AGENT_CHANGE -> handoffs.add(new HandoffStep(
                        text(event, "from"),
                        text(event, "to"),
                        MessageKind.fromWire(text(event, "kind")),
                        Instant.parse(text(event, "timestamp")),
                        text(event, "note")));
                case COMPLETE -> {
                    answer = text(event, "response");
                    terminal = type.wireName();
                }
                case ERROR -> {
                    error = text(event, "error");
                    terminal = type.wireName();
                }
                default -> {
                    // tool and delta events carry no routing information
                }
            }
        }
        return new ReplayedRun(runId, List.copyOf(handoffs), Optional.ofNullable(answer),
                Optional.ofNullable(error), Optional.ofNullable(terminal), events.size());
    }

    private static String text(Map<String, Object> event, String key) {
        Object value = event.get(key);
        return value != null ? value.toString() : null;
    }

    /**
     * @param terminal "complete", "error", or empty for an aborted or interrupted run
     */
    public record ReplayedRun(
        String runId,
        List<HandoffStep> handoffs,
        Optional<String> answer,
        Optional<String> error,
        Optional<String> terminal,
        int eventCount
    ) {}
}
