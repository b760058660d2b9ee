package com.workforce.core.agent;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workforce.core.company.CompanyProfile;
import com.workforce.core.model.AgentNode;
import com.workforce.core.model.TokenUsage;
import com.workforce.core.protocol.MessageCodec;
import com.workforce.core.protocol.ProtocolException;
import com.workforce.core.tools.CompanyTools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link AgentExecutor} backed by Spring AI's {@link ChatClient}.
 * <p>
 * Each turn sends role instructions plus the incoming message, exposes the company tools the
 * agent owns, and asks for a structured {@link AgentDecision}. Tool invocations are reported
 * as they happen; a final answer is also reported as a single delta.
 */
@Service
public class ChatClientAgentExecutor implements AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(ChatClientAgentExecutor.class);

    private final ChatClient chatClient;
    private final MessageCodec codec;
    private final ObjectMapper objectMapper;
    private final LlmProperties llmProperties;
    private final BeanOutputConverter<AgentDecision> converter = new BeanOutputConverter<>(AgentDecision.class);

    /** Tool callbacks per company id; companies are immutable once loaded. */
    private final Map<String, List<ToolCallback>> companyTools = new ConcurrentHashMap<>();

    public ChatClientAgentExecutor(ChatClient.Builder builder, MessageCodec codec, ObjectMapper objectMapper,
                                   LlmProperties llmProperties) {
        this.chatClient = builder.build();
        this.codec = codec;
        this.objectMapper = objectMapper;
        this.llmProperties = llmProperties;
        log.info("Agent executor initialized (model: {})", llmProperties.getModel());
    }

    @Override
    public TurnOutcome execute(AgentTurn turn, TurnListener listener) {
        AgentNode agent = turn.agent();
        List<ToolCallback> tools = toolsFor(turn.company(), agent, listener);
        log.info("Agent {} taking turn ({} tool(s), input {} from {})",
                agent.id(), tools.size(), turn.input().kind().wireName(), turn.sender());
        long start = System.currentTimeMillis();

        ChatResponse response;
        try {
            var request = chatClient.prompt()
                    .system(AgentInstructions.system(turn))
                    .user(AgentInstructions.user(turn) + "\n\n" + converter.getFormat());
            if (!tools.isEmpty()) {
                request = request.toolCallbacks(tools.toArray(new ToolCallback[0]));
            }
            response = request.call().chatResponse();
        } catch (RuntimeException e) {
            throw new AgentExecutionException("Model call failed for " + agent.id() + ": " + e.getMessage(), e);
        }

        String text = response != null && response.getResult() != null && response.getResult().getOutput() != null
                ? response.getResult().getOutput().getText()
                : null;
        if (text == null || text.isBlank()) {
            throw new AgentExecutionException("Model returned empty content for " + agent.id());
        }
        TokenUsage usage = usageOf(response);
        log.info("Agent {} responded in {}s ({} tokens)", agent.id(),
                String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0), usage.totalTokens());

        TurnOutcome outcome = toOutcome(parse(text), usage, codec);
        if (outcome instanceof TurnOutcome.FinalAnswer answer) {
            listener.onDelta(answer.text());
        }
        return outcome;
    }

    /**
     * Maps a model decision onto a turn outcome.
     *
     * @throws ProtocolException if the decision names no valid action or message kind
     */
    static TurnOutcome toOutcome(AgentDecision decision, TokenUsage usage, MessageCodec codec) {
        if (decision == null || decision.action() == null || decision.action().isBlank()) {
            throw new ProtocolException("Agent decision has no action");
        }
        String action = decision.action().trim().toUpperCase(Locale.ROOT);
        String content = decision.content() != null ? decision.content() : "";
        return switch (action) {
            case "ANSWER" -> new TurnOutcome.FinalAnswer(content, usage);
            case "HANDOFF" -> new TurnOutcome.Handoff(
                    decision.target() != null ? decision.target().trim() : null,
                    codec.message(decision.kind(), content),
                    usage);
            default -> throw new ProtocolException("Unknown agent action: " + decision.action());
        };
    }

    /**
     * @throws ProtocolException if the reply cannot be decoded into a decision
     */
    private AgentDecision parse(String text) {
        try {
            return converter.convert(text);
        } catch (RuntimeException e) {
            log.debug("Structured conversion failed ({}), trying lenient parse", e.getMessage());
        }
        ObjectMapper lenient = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
        return new MessageCodec(lenient).decode(text, AgentDecision.class);
    }

    private List<ToolCallback> toolsFor(CompanyProfile company, AgentNode agent, TurnListener listener) {
        if (agent.tools().isEmpty()) {
            return List.of();
        }
        List<ToolCallback> all = companyTools.computeIfAbsent(company.id(), id -> Arrays.asList(
                MethodToolCallbackProvider.builder()
                        .toolObjects(new CompanyTools(company, objectMapper))
                        .build()
                        .getToolCallbacks()));
        return all.stream()
                .filter(tool -> agent.tools().contains(tool.getToolDefinition().name()))
                .<ToolCallback>map(tool -> new RecordingToolCallback(tool, listener, objectMapper))
                .toList();
    }

    private TokenUsage usageOf(ChatResponse response) {
        String model = llmProperties.getModel();
        long input = 0;
        long output = 0;
        if (response.getMetadata() != null) {
            if (response.getMetadata().getModel() != null && !response.getMetadata().getModel().isBlank()) {
                model = response.getMetadata().getModel();
            }
            Usage usage = response.getMetadata().getUsage();
            if (usage != null) {
                input = usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
                output = usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
            }
        }
        return TokenUsage.of(input, output, model);
    }
}
