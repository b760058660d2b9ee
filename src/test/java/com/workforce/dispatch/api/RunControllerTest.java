package com.workforce.dispatch.api;

import com.workforce.core.artifacts.ArtifactReplayer;
import com.workforce.core.artifacts.ArtifactStore;
import com.workforce.core.artifacts.ArtifactStoreException;
import com.workforce.core.artifacts.RunSummary;
import com.workforce.core.model.HandoffStep;
import com.workforce.core.protocol.MessageKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RunController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class RunControllerTest {

    private static final String RUN_ID = "20260101_120000_000001-abcd";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ArtifactStore artifactStore;

    @MockitoBean
    private ArtifactReplayer replayer;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    // ── GET /api/v1/runs ─────────────────────────────────────────────

    @Test
    @DisplayName("GET /runs lists recent runs with the default limit")
    void listRuns() throws Exception {
        when(artifactStore.listRuns(20)).thenReturn(List.of(
                new RunSummary(RUN_ID, "Research tea", "COMPLETED", "/tmp/runs/" + RUN_ID)));

        mockMvc.perform(get("/api/v1/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runs", hasSize(1)))
                .andExpect(jsonPath("$.runs[0].run_id").value(RUN_ID))
                .andExpect(jsonPath("$.runs[0].outcome").value("COMPLETED"));
    }

    @Test
    @DisplayName("GET /runs with a non-positive limit returns 400")
    void badLimit() throws Exception {
        mockMvc.perform(get("/api/v1/runs").param("limit", "0"))
                .andExpect(status().isBadRequest());
    }

    // ── GET /api/v1/runs/{runId} ─────────────────────────────────────

    @Test
    @DisplayName("GET /runs/{prefix} resolves the run and returns its artifacts")
    void getRun() throws Exception {
        when(artifactStore.resolveRun("20260101_12")).thenReturn(Optional.of(RUN_ID));
        when(artifactStore.readInput(RUN_ID)).thenReturn(Optional.of("Research tea"));
        when(artifactStore.readTrace(RUN_ID)).thenReturn(Optional.empty());
        when(artifactStore.readResponse(RUN_ID)).thenReturn(Optional.of("Matcha"));

        mockMvc.perform(get("/api/v1/runs/20260101_12"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.run_id").value(RUN_ID))
                .andExpect(jsonPath("$.input").value("Research tea"))
                .andExpect(jsonPath("$.response").value("Matcha"))
                .andExpect(jsonPath("$.trace").doesNotExist());
    }

    @Test
    @DisplayName("GET /runs/{runId} for an unknown run returns 404")
    void unknownRun() throws Exception {
        when(artifactStore.resolveRun("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/runs/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /runs/{prefix} with an ambiguous prefix returns 400")
    void ambiguousRun() throws Exception {
        when(artifactStore.resolveRun("2026")).thenThrow(new ArtifactStoreException("Run prefix '2026' is ambiguous"));

        mockMvc.perform(get("/api/v1/runs/2026"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("ambiguous")));
    }

    // ── GET /api/v1/runs/{runId}/replay ──────────────────────────────

    @Test
    @DisplayName("GET /runs/{runId}/replay returns handoffs rebuilt from events")
    void replay() throws Exception {
        when(artifactStore.resolveRun(RUN_ID)).thenReturn(Optional.of(RUN_ID));
        when(replayer.replay(RUN_ID)).thenReturn(new ArtifactReplayer.ReplayedRun(RUN_ID,
                List.of(new HandoffStep("founder", "market_researcher", MessageKind.TASK,
                        Instant.parse("2026-01-01T12:00:00Z"), "")),
                Optional.of("Matcha"), Optional.empty(), Optional.of("complete"), 6));

        mockMvc.perform(get("/api/v1/runs/" + RUN_ID + "/replay"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.handoffs", hasSize(1)))
                .andExpect(jsonPath("$.handoffs[0].kind").value("task"))
                .andExpect(jsonPath("$.response").value("Matcha"))
                .andExpect(jsonPath("$.terminal").value("complete"))
                .andExpect(jsonPath("$.event_count").value(6));
    }

    // ── GET /api/v1/runs/{runId}/events ──────────────────────────────

    @Test
    @DisplayName("GET /runs/{runId}/events opens an observer stream")
    void events() throws Exception {
        when(sseStreamingService.createEmitter(RUN_ID)).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/api/v1/runs/" + RUN_ID + "/events"))
                .andExpect(status().isOk())
                .andExpect(request().asyncStarted());

        verify(sseStreamingService).createEmitter(RUN_ID);
    }
}
