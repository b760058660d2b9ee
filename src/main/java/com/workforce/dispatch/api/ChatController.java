package com.workforce.dispatch.api;

import com.workforce.core.company.CompanyNotFoundException;
import com.workforce.core.engine.WorkforceEngine;
import com.workforce.core.model.TaskType;
import com.workforce.core.session.RunResult;
import com.workforce.core.session.SessionEventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for running goals against a company.
 */
@RestController
@RequestMapping("/api/v1")
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    private final WorkforceEngine engine;
    private final SseStreamingService sseStreamingService;

    public ChatController(WorkforceEngine engine, SseStreamingService sseStreamingService) {
        this.engine = engine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/companies/{id}/chat: Run a goal for the given company.
     * With {@code stream=true} the response is an event stream; otherwise the call blocks
     * until the run finishes.
     */
    @PostMapping("/companies/{id}/chat")
    public ResponseEntity<?> chat(@PathVariable String id, @RequestBody ChatRequest request) {
        if (request.message() == null || request.message().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Message is required"));
        }

        TaskType taskType;
        try {
            taskType = request.taskType() != null ? TaskType.fromString(request.taskType()) : null;
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(
                    Map.of("error", "Invalid task_type: " + request.taskType()));
        }

        try {
            if (request.isStream()) {
                SessionEventStream stream = engine.runStream(id, request.message(), taskType);
                log.info("Streaming run {} for company {}", stream.runId(), id);
                return ResponseEntity.ok()
                        .contentType(MediaType.TEXT_EVENT_STREAM)
                        .body(sseStreamingService.streamRun(stream));
            }

            RunResult result = engine.run(id, request.message(), taskType);
            RunResponse body = RunResponse.from(result);
            if (!result.isCompleted()) {
                log.warn("Run {} ended as {}: {}", result.runId(), result.outcome(), result.error());
                return ResponseEntity.internalServerError().body(body);
            }
            return ResponseEntity.ok(body);
        } catch (CompanyNotFoundException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/chat: Run a goal for the default company.
     */
    @PostMapping("/chat")
    public ResponseEntity<?> chatDefault(@RequestBody ChatRequest request) {
        return chat(engine.defaultCompanyId(), request);
    }
}
