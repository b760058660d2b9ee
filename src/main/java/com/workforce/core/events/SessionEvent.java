package com.workforce.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One element of a run's event stream, used for SSE streaming, the CLI and the
 * {@code events.jsonl} artifact.
 *
 * @param type      event type
 * @param runId     the run this event belongs to
 * @param agent     agent the event concerns (nullable for run-level events)
 * @param data      type-specific fields ({@code tool}, {@code content}, {@code response}, ...)
 * @param timestamp when the event occurred
 */
public record SessionEvent(
    SessionEventType type,
    String runId,
    String agent,
    Map<String, Object> data,
    Instant timestamp
) implements Serializable {

    public SessionEvent {
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    public boolean isTerminal() {
        return type.isTerminal();
    }

    /**
     * Flat wire shape: {@code {type, timestamp, run_id, agent, ...data}}. {@code agent} is always present.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> flat = new LinkedHashMap<>();
        flat.put("type", type.wireName());
        flat.put("timestamp", timestamp.toString());
        flat.put("run_id", runId);
        flat.put("agent", agent);
        flat.putAll(data);
        return flat;
    }
}
