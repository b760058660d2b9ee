package com.workforce.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.ai.tool.metadata.ToolMetadata;

import java.util.Map;

/**
 * Wraps a tool so every invocation is reported to the turn's {@link TurnListener}.
 */
class RecordingToolCallback implements ToolCallback {

    private static final TypeReference<Map<String, Object>> ARGS = new TypeReference<>() {};

    private final ToolCallback delegate;
    private final TurnListener listener;
    private final ObjectMapper objectMapper;

    RecordingToolCallback(ToolCallback delegate, TurnListener listener, ObjectMapper objectMapper) {
        this.delegate = delegate;
        this.listener = listener;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return delegate.getToolDefinition();
    }

    @Override
    public ToolMetadata getToolMetadata() {
        return delegate.getToolMetadata();
    }

    @Override
    public String call(String toolInput) {
        return call(toolInput, null);
    }

    @Override
    public String call(String toolInput, ToolContext toolContext) {
        String name = getToolDefinition().name();
        listener.onToolCall(name, arguments(toolInput));
        String output = toolContext != null ? delegate.call(toolInput, toolContext) : delegate.call(toolInput);
        listener.onToolResult(name, output);
        return output;
    }

    private Map<String, Object> arguments(String toolInput) {
        if (toolInput == null || toolInput.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(toolInput, ARGS);
        } catch (JsonProcessingException e) {
            return Map.of("raw", toolInput);
        }
    }
}
