package com.workforce.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for session events.
 * <p>
 * Supports per-run subscriptions and global subscriptions that receive all events. Observers
 * never see run state, only published events, so a slow or failing subscriber cannot affect
 * the run that produced them.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<SessionEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<SessionEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to the run's subscribers, then to global subscribers.
     * Per-run subscriptions are dropped once a terminal event has been delivered.
     */
    public void publish(SessionEvent event) {
        log.debug("Publishing {} for run {}", event.type().wireName(), event.runId());

        List<Consumer<SessionEvent>> runSubs = runSubscribers.get(event.runId());
        if (runSubs != null) {
            for (Consumer<SessionEvent> subscriber : runSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<SessionEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
        if (event.isTerminal()) {
            runSubscribers.remove(event.runId());
        }
    }

    /**
     * Subscribe to events of one run.
     *
     * @return a handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<SessionEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to run {}", runId);
        return () -> {
            CopyOnWriteArrayList<Consumer<SessionEvent>> subs = runSubscribers.get(runId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events from all runs.
     */
    public Subscription subscribeAll(Consumer<SessionEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    public boolean hasSubscribers(String runId) {
        List<Consumer<SessionEvent>> subs = runSubscribers.get(runId);
        return subs != null && !subs.isEmpty();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<SessionEvent> subscriber, SessionEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing {} for run {}: {}",
                    event.type().wireName(), event.runId(), e.getMessage(), e);
        }
    }
}
