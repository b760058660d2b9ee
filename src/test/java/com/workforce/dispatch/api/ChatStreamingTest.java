package com.workforce.dispatch.api;

import com.workforce.core.artifacts.ArtifactStore;
import com.workforce.core.cost.CostEstimator;
import com.workforce.core.cost.PricingProperties;
import com.workforce.core.engine.WorkforceEngine;
import com.workforce.core.events.EventBus;
import com.workforce.core.metrics.WorkforceMetrics;
import com.workforce.core.model.TaskType;
import com.workforce.core.protocol.MessageCodec;
import com.workforce.core.protocol.MessageKind;
import com.workforce.core.session.Session;
import com.workforce.core.session.SessionSettings;
import com.workforce.core.session.SessionDependencies;
import com.workforce.core.support.CompanyFixtures;
import com.workforce.core.support.ScriptedAgentExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

import static com.workforce.core.support.CompanyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;

/**
 * Drives a scripted run through the real {@link SseStreamingService} and checks the wire format.
 */
@WebMvcTest(ChatController.class)
@Import({SseStreamingService.class, EventBus.class})
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ChatStreamingTest {

    @TempDir
    Path tempDir;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private EventBus eventBus;

    @MockitoBean
    private WorkforceEngine engine;

    @Test
    @DisplayName("streamed runs send named events ending with complete")
    void streamsEvents() throws Exception {
        var executor = new ScriptedAgentExecutor()
                .handoff(FOUNDER, MARKET_RESEARCHER, MessageKind.TASK, "Trends please")
                .handoff(MARKET_RESEARCHER, FOUNDER, MessageKind.RESULT, "Matcha")
                .answer(FOUNDER, "Matcha is in");
        var mapper = CompanyFixtures.objectMapper();
        var deps = new SessionDependencies(executor, new MessageCodec(mapper), new ArtifactStore(tempDir, true, mapper),
                new CostEstimator(new PricingProperties()), eventBus, new WorkforceMetrics(new SimpleMeterRegistry()),
                Clock.systemUTC());
        var session = new Session("20260101_120000_000004-f00d", CompanyFixtures.acme(), FOUNDER,
                "Research tea trends", TaskType.RESEARCH, SessionSettings.defaults(), deps);
        when(engine.runStream("acme", "Research tea trends", null)).thenReturn(session.stream());

        MvcResult result = mockMvc.perform(post("/api/v1/companies/acme/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Research tea trends\",\"stream\":true}"))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(10_000);

        String body = result.getResponse().getContentAsString();
        int start = body.indexOf("event:start");
        int change = body.indexOf("event:agent_change");
        int saved = body.indexOf("event:artifacts_saved");
        int complete = body.indexOf("event:complete");
        assertTrue(start >= 0, body);
        assertTrue(start < change && change < saved && saved < complete, body);
        assertTrue(body.contains("\"response\":\"Matcha is in\""), body);
        assertTrue(body.contains("\"run_id\":\"20260101_120000_000004-f00d\""), body);
        assertEquals(0, executor.remainingSteps());
        assertEquals(Optional.of("Matcha is in"), new ArtifactStore(tempDir, true, mapper)
                .readResponse("20260101_120000_000004-f00d"));
    }
}
