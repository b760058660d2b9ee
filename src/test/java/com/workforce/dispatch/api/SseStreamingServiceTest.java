package com.workforce.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workforce.core.artifacts.ArtifactStore;
import com.workforce.core.cost.CostEstimator;
import com.workforce.core.cost.ModelRate;
import com.workforce.core.events.EventBus;
import com.workforce.core.events.SessionEvent;
import com.workforce.core.events.SessionEventType;
import com.workforce.core.metrics.WorkforceMetrics;
import com.workforce.core.model.TaskType;
import com.workforce.core.protocol.MessageCodec;
import com.workforce.core.protocol.MessageKind;
import com.workforce.core.session.Session;
import com.workforce.core.session.SessionDependencies;
import com.workforce.core.session.SessionSettings;
import com.workforce.core.support.CompanyFixtures;
import com.workforce.core.support.ScriptedAgentExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.workforce.core.support.CompanyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    @TempDir
    Path tempDir;

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        service = new SseStreamingService(eventBus);
    }

    @AfterEach
    void tearDown() {
        service.stop();
    }

    private Session researchSession(String runId) {
        ObjectMapper mapper = CompanyFixtures.objectMapper();
        var executor = new ScriptedAgentExecutor()
                .handoff(FOUNDER, MARKET_RESEARCHER, MessageKind.TASK, "Find tea trends")
                .handoff(MARKET_RESEARCHER, FOUNDER, MessageKind.RESULT, "Matcha is growing")
                .answer(FOUNDER, "Matcha lattes.");
        var deps = new SessionDependencies(
                executor,
                new MessageCodec(mapper),
                new ArtifactStore(tempDir, true, mapper),
                new CostEstimator(model -> Optional.of(new ModelRate(2.0, 8.0)), "gpt-4.1"),
                eventBus,
                new WorkforceMetrics(new SimpleMeterRegistry()),
                Clock.systemUTC());
        return new Session(runId, CompanyFixtures.acme(), FOUNDER, "Tea trends?", TaskType.RESEARCH,
                SessionSettings.defaults(), deps);
    }

    private static SessionEvent event(SessionEventType type, String runId) {
        return new SessionEvent(type, runId, null, Map.of(), Instant.now());
    }

    // -- Observer emitters ----------------------------------------------------

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitterTests {

        @Test
        @DisplayName("creates a distinct emitter per call for the same run")
        void distinctEmitters() {
            SseEmitter first = service.createEmitter("R-001");
            SseEmitter second = service.createEmitter("R-001");

            assertNotNull(first);
            assertNotSame(first, second);
            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("subscribes to the event bus for that run only")
        void subscribesPerRun() {
            service.createEmitter("R-001");

            assertTrue(eventBus.hasSubscribers("R-001"));
            assertFalse(eventBus.hasSubscribers("R-002"));
        }

        @Test
        @DisplayName("a terminal event ends the bus subscription")
        void terminalEndsSubscription() {
            service.createEmitter("R-001");

            eventBus.publish(event(SessionEventType.START, "R-001"));
            assertTrue(eventBus.hasSubscribers("R-001"));

            eventBus.publish(event(SessionEventType.COMPLETE, "R-001"));
            assertFalse(eventBus.hasSubscribers("R-001"));
        }

        @Test
        @DisplayName("concurrent publishing to an observed run does not throw")
        void concurrentPublish() throws InterruptedException {
            service.createEmitter("R-001");

            int threadCount = 5;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                new Thread(() -> {
                    for (int i = 0; i < 20; i++) {
                        eventBus.publish(event(SessionEventType.DELTA, "R-001"));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
    }

    // -- Run emitters ---------------------------------------------------------

    @Nested
    @DisplayName("streamRun")
    class StreamRunTests {

        @Test
        @DisplayName("drives the session to its terminal event on a worker thread")
        void drivesSessionToCompletion() throws InterruptedException {
            String runId = "20260101_120000_000001-sse";
            List<SessionEventType> seen = new CopyOnWriteArrayList<>();
            CountDownLatch done = new CountDownLatch(1);
            eventBus.subscribe(runId, e -> {
                seen.add(e.type());
                if (e.isTerminal()) {
                    done.countDown();
                }
            });

            SseEmitter emitter = service.streamRun(researchSession(runId).stream());

            assertNotNull(emitter);
            assertTrue(done.await(10, TimeUnit.SECONDS), "session should reach its terminal event");
            assertEquals(SessionEventType.START, seen.get(0));
            assertEquals(SessionEventType.COMPLETE, seen.get(seen.size() - 1));
        }

        @Test
        @DisplayName("registers the run emitter for heartbeats")
        void registersEmitter() throws InterruptedException {
            String runId = "20260101_120000_000002-sse";
            CountDownLatch done = new CountDownLatch(1);
            eventBus.subscribe(runId, e -> {
                if (e.isTerminal()) {
                    done.countDown();
                }
            });
            assertEquals(0, service.activeEmitterCount());

            service.streamRun(researchSession(runId).stream());

            assertEquals(1, service.activeEmitterCount());
            assertTrue(done.await(10, TimeUnit.SECONDS));
        }
    }
}
