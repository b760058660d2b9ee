package com.workforce.core.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Open delegations of a run, innermost last. Each frame records who handed work to whom
 * and therefore who owes whom a result.
 * <p>
 * Immutable: push and pop return new stacks, which keeps {@link HandoffRouter} a pure function.
 */
public final class DelegationStack {

    private static final DelegationStack EMPTY = new DelegationStack(List.of());

    private final List<Delegation> frames;

    private DelegationStack(List<Delegation> frames) {
        this.frames = frames;
    }

    public static DelegationStack empty() {
        return EMPTY;
    }

    public DelegationStack push(String delegator, String delegate) {
        List<Delegation> next = new ArrayList<>(frames);
        next.add(new Delegation(delegator, delegate));
        return new DelegationStack(Collections.unmodifiableList(next));
    }

    /**
     * @throws IllegalStateException if nothing is open
     */
    public DelegationStack pop() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("No open delegation to close");
        }
        return new DelegationStack(List.copyOf(frames.subList(0, frames.size() - 1)));
    }

    public Optional<Delegation> top() {
        return frames.isEmpty() ? Optional.empty() : Optional.of(frames.get(frames.size() - 1));
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int depth() {
        return frames.size();
    }

    public List<Delegation> frames() {
        return frames;
    }

    @Override
    public String toString() {
        return frames.toString();
    }

    /**
     * One open delegation: {@code delegate} owes {@code delegator} a single result.
     */
    public record Delegation(String delegator, String delegate) {}
}
