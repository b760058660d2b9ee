package com.workforce.dispatch.api;

import com.workforce.core.artifacts.ArtifactReplayer;
import com.workforce.core.artifacts.ArtifactStore;
import com.workforce.core.artifacts.ArtifactStoreException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for stored runs and live run observation.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private final ArtifactStore artifactStore;
    private final ArtifactReplayer replayer;
    private final SseStreamingService sseStreamingService;

    public RunController(ArtifactStore artifactStore,
                         ArtifactReplayer replayer,
                         SseStreamingService sseStreamingService) {
        this.artifactStore = artifactStore;
        this.replayer = replayer;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * GET /api/v1/runs: Recent runs, newest first.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listRuns(@RequestParam(defaultValue = "20") int limit) {
        if (limit < 1) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be positive"));
        }
        return ResponseEntity.ok(Map.of("runs", artifactStore.listRuns(limit)));
    }

    /**
     * GET /api/v1/runs/{runId}: Trace and response of a run. Accepts a unique id prefix.
     */
    @GetMapping("/{runId}")
    public ResponseEntity<?> getRun(@PathVariable String runId) {
        Optional<String> resolved;
        try {
            resolved = artifactStore.resolveRun(runId);
        } catch (ArtifactStoreException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        if (resolved.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        String id = resolved.get();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("run_id", id);
        artifactStore.readInput(id).ifPresent(input -> body.put("input", input));
        artifactStore.readTrace(id).ifPresent(trace -> body.put("trace", trace));
        artifactStore.readResponse(id).ifPresent(response -> body.put("response", response));
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/v1/runs/{runId}/replay: Handoffs and answer rebuilt from the event log alone.
     */
    @GetMapping("/{runId}/replay")
    public ResponseEntity<?> replayRun(@PathVariable String runId) {
        Optional<String> resolved;
        try {
            resolved = artifactStore.resolveRun(runId);
        } catch (ArtifactStoreException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        if (resolved.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        var replayed = replayer.replay(resolved.get());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("run_id", replayed.runId());
        body.put("handoffs", replayed.handoffs());
        replayed.answer().ifPresent(answer -> body.put("response", answer));
        replayed.error().ifPresent(error -> body.put("error", error));
        body.put("terminal", replayed.terminal().orElse("none"));
        body.put("event_count", replayed.eventCount());
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/v1/runs/{runId}/events: SSE stream of a run that is in progress.
     * Only events published after subscribing are delivered.
     */
    @GetMapping(value = "/{runId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String runId) {
        SseEmitter emitter = sseStreamingService.createEmitter(runId);
        return ResponseEntity.ok(emitter);
    }
}
