package com.workforce.core.support;

import com.workforce.core.agent.AgentExecutor;
import com.workforce.core.agent.AgentTurn;
import com.workforce.core.agent.TurnListener;
import com.workforce.core.agent.TurnOutcome;
import com.workforce.core.model.TokenUsage;
import com.workforce.core.protocol.Message;
import com.workforce.core.protocol.MessageKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.BiFunction;

/**
 * {@link AgentExecutor} that plays back a fixed sequence of turns.
 * <p>
 * Each scripted step names the agent expected to take that turn. A turn by a different agent,
 * or a turn past the end of the script, fails with {@link AssertionError} so the test sees it
 * instead of the session converting it into an error event.
 */
public class ScriptedAgentExecutor implements AgentExecutor {

    public static final TokenUsage TURN_USAGE = TokenUsage.of(100, 40, "gpt-4.1");

    private record Step(String agentId, BiFunction<AgentTurn, TurnListener, TurnOutcome> action) {}

    private final Deque<Step> steps = new ArrayDeque<>();
    private final List<AgentTurn> turns = new ArrayList<>();

    public ScriptedAgentExecutor handoff(String agentId, String target, MessageKind kind, String payload) {
        return step(agentId, (turn, listener) ->
                new TurnOutcome.Handoff(target, new Message(kind, payload), TURN_USAGE));
    }

    public ScriptedAgentExecutor answer(String agentId, String text) {
        return step(agentId, (turn, listener) -> {
            listener.onDelta(text);
            return new TurnOutcome.FinalAnswer(text, TURN_USAGE);
        });
    }

    public ScriptedAgentExecutor fail(String agentId, RuntimeException error) {
        return step(agentId, (turn, listener) -> {
            throw error;
        });
    }

    public ScriptedAgentExecutor step(String agentId, BiFunction<AgentTurn, TurnListener, TurnOutcome> action) {
        steps.add(new Step(agentId, action));
        return this;
    }

    @Override
    public synchronized TurnOutcome execute(AgentTurn turn, TurnListener listener) {
        turns.add(turn);
        Step step = steps.poll();
        if (step == null) {
            throw new AssertionError("Unscripted turn for " + turn.agent().id());
        }
        if (!step.agentId().equals(turn.agent().id())) {
            throw new AssertionError("Expected a turn by " + step.agentId() + " but " + turn.agent().id() + " was called");
        }
        return step.action().apply(turn, listener);
    }

    public synchronized List<AgentTurn> turns() {
        return List.copyOf(turns);
    }

    public synchronized int remainingSteps() {
        return steps.size();
    }
}
