package com.workforce.core.agent;

import java.util.Map;

/**
 * Receives sub-turn activity while an agent works.
 */
public interface TurnListener {

    TurnListener NOOP = new TurnListener() {};

    default void onToolCall(String tool, Map<String, Object> arguments) {}

    default void onToolResult(String tool, String output) {}

    default void onDelta(String content) {}
}
