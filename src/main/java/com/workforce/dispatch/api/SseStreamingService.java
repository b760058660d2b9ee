package com.workforce.dispatch.api;

import com.workforce.core.events.EventBus;
import com.workforce.core.events.SessionEvent;
import com.workforce.core.session.SessionEventStream;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges session events to {@link SseEmitter} instances.
 * <p>
 * Two kinds of emitters exist. A run emitter drives a {@link SessionEventStream} on a worker
 * thread and forwards each element; when the client goes away the run is cancelled. An observer
 * emitter subscribes to the {@link EventBus} for a run started elsewhere and only watches.
 * <p>
 * Heartbeats are sent as SSE comments to keep idle connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    private final ExecutorService runExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "session-stream");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stop() {
        heartbeatScheduler.shutdown();
        runExecutor.shutdownNow();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE streaming stopped");
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                log.debug("Heartbeat failed for run {} (connection likely closed): {}",
                        registration.runId, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for run {} (emitter not active)", registration.runId);
            }
        }
    }

    /**
     * Streams a run to the client. The run advances on a worker thread as events are sent.
     * A client disconnect, timeout or send failure cancels the run.
     */
    public SseEmitter streamRun(SessionEventStream stream) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        String runId = stream.runId();
        var registration = new EmitterRegistration(runId, emitter, stream::cancel);
        register(registration);

        runExecutor.submit(() -> pump(stream, emitter));
        log.info("SSE run stream opened for run {} (timeout={}ms)", runId, timeoutMs);
        return emitter;
    }

    /**
     * Creates an observer emitter that follows a run through the event bus.
     * The emitter completes after the run's terminal event.
     */
    public SseEmitter createEmitter(String runId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventBus.Subscription subscription = eventBus.subscribe(runId, event -> {
            if (sendEvent(emitter, event) && event.isTerminal()) {
                emitter.complete();
            }
        });
        register(new EmitterRegistration(runId, emitter, subscription::unsubscribe));

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for run {}: {}", runId, e.getMessage());
        }
        log.info("SSE observer created for run {} (timeout={}ms)", runId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void pump(SessionEventStream stream, SseEmitter emitter) {
        try (stream) {
            while (stream.hasNext()) {
                if (!sendEvent(emitter, stream.next())) {
                    stream.cancel();
                    return;
                }
            }
            emitter.complete();
        } catch (RuntimeException e) {
            log.error("Run stream {} failed: {}", stream.runId(), e.getMessage(), e);
            stream.cancel();
            emitter.completeWithError(e);
        }
    }

    private void register(EmitterRegistration registration) {
        activeRegistrations.add(registration);
        String runId = registration.runId;
        registration.emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for run {}", runId);
            cleanup(registration);
        });
        registration.emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for run {}", runId);
            cleanup(registration);
        });
        registration.emitter.onError(ex -> {
            log.debug("SSE emitter error for run {}: {}", runId, ex.getMessage());
            cleanup(registration);
        });
    }

    /**
     * @return false if the client can no longer be reached
     */
    private boolean sendEvent(SseEmitter emitter, SessionEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.type().wireName())
                    .data(event.toMap()));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for run {}: {}",
                    event.type().wireName(), event.runId(), e.getMessage());
            return false;
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (activeRegistrations.remove(registration)) {
            registration.onClose.run();
            log.debug("Cleaned up SSE registration for run {}", registration.runId);
        }
    }

    private record EmitterRegistration(
            String runId,
            SseEmitter emitter,
            Runnable onClose
    ) {}
}
