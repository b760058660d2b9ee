package com.workforce.core.session;

import com.workforce.core.events.SessionEvent;

import java.util.Iterator;

/**
 * Lazy, finite, non-restartable sequence of a run's events.
 * <p>
 * The run advances only as the consumer pulls: each {@link #hasNext()} on an empty buffer drives
 * the next agent turn. The last element is always {@code complete} or {@code error}, unless the
 * run is cancelled, in which case the stream simply ends. Closing an unfinished stream cancels the run.
 */
public interface SessionEventStream extends Iterator<SessionEvent>, AutoCloseable {

    String runId();

    /**
     * Stops the run. Safe to call from any thread and more than once. No further events are
     * produced and the run is recorded as aborted.
     */
    void cancel();

    /**
     * @throws IllegalStateException if the run has not reached a terminal state
     */
    RunResult result();

    @Override
    void close();
}
