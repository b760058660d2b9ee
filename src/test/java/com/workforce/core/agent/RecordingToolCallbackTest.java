package com.workforce.core.agent;

import com.workforce.core.support.CompanyFixtures;
import com.workforce.core.tools.CompanyTools;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RecordingToolCallbackTest {

    private final List<String> calls = new ArrayList<>();
    private final List<Map<String, Object>> arguments = new ArrayList<>();
    private final List<String> results = new ArrayList<>();

    private final TurnListener listener = new TurnListener() {
        @Override
        public void onToolCall(String tool, Map<String, Object> args) {
            calls.add(tool);
            arguments.add(args);
        }

        @Override
        public void onToolResult(String tool, String output) {
            results.add(output);
        }
    };

    private ToolCallback tool(String name) {
        ToolCallback[] callbacks = MethodToolCallbackProvider.builder()
                .toolObjects(new CompanyTools(CompanyFixtures.acme(), CompanyFixtures.objectMapper()))
                .build()
                .getToolCallbacks();
        ToolCallback delegate = Arrays.stream(callbacks)
                .filter(c -> c.getToolDefinition().name().equals(name))
                .findFirst()
                .orElseThrow();
        return new RecordingToolCallback(delegate, listener, CompanyFixtures.objectMapper());
    }

    @Test
    @DisplayName("reports the call and its output around the delegate")
    void reportsCallAndResult() {
        ToolCallback callback = tool(CompanyTools.GET_MARKET_RESEARCH);

        String output = callback.call("{}");

        assertEquals(CompanyTools.GET_MARKET_RESEARCH, callback.getToolDefinition().name());
        assertEquals(List.of(CompanyTools.GET_MARKET_RESEARCH), calls);
        assertEquals(Map.of(), arguments.get(0));
        assertEquals(List.of(output), results);
        assertTrue(output.contains("Matcha lattes"));
    }

    @Test
    @DisplayName("arguments that are not a JSON object are reported raw")
    void rawArguments() {
        ToolCallback delegate = mock(ToolCallback.class);
        when(delegate.getToolDefinition()).thenReturn(ToolDefinition.builder()
                .name(CompanyTools.GET_ANALYTICS).description("analytics").inputSchema("{}").build());
        when(delegate.call("not json")).thenReturn("ok");

        String output = new RecordingToolCallback(delegate, listener, CompanyFixtures.objectMapper()).call("not json");

        assertEquals("ok", output);
        assertEquals(Map.of("raw", "not json"), arguments.get(0));
        assertEquals(List.of("ok"), results);
    }
}
