package com.purchasingpower.flowinsight.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.flowinsight.exception.ModelTransientException;
import com.purchasingpower.flowinsight.exception.ModelTransientException.Kind;
import com.purchasingpower.flowinsight.model.llm.ModelRequest;
import com.purchasingpower.flowinsight.model.llm.ModelTurn;
import com.purchasingpower.flowinsight.model.llm.ResolvedModel;
import com.purchasingpower.flowinsight.model.llm.ToolDefinition;
import com.purchasingpower.flowinsight.workflow.state.ChatMessage;
import com.purchasingpower.flowinsight.workflow.state.ToolCall;
import dev.langchain4j.agent.tool.JsonSchemaProperty;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InterruptedIOException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link ModelGateway} backed by LangChain4j chat models.
 *
 * <p>Structured replies are read with Jackson after removing a surrounding
 * markdown code fence. Anything else that fails to parse is reported as
 * {@link Kind#MALFORMED}; no further guessing happens here or downstream.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LangChain4jModelGateway implements ModelGateway {

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ChatModelFactory chatModelFactory;
    private final ObjectMapper objectMapper;

    @Override
    public String generateText(ModelRequest request) {
        ResolvedModel resolved = resolve(request);
        AiMessage reply = call(resolved, request, null);
        String text = reply.text();
        if (text == null || text.isBlank()) {
            throw new ModelTransientException(Kind.EMPTY, "empty reply from " + resolved);
        }
        return text;
    }

    @Override
    public <T> T generateStructured(ModelRequest request, Class<T> type) {
        String text = generateText(request);
        String json = stripCodeFence(text);
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) {
                throw new ModelTransientException(Kind.MALFORMED, "null " + type.getSimpleName() + " in reply");
            }
            return value;
        } catch (JsonProcessingException e) {
            log.warn("Reply is not a valid {}: {}", type.getSimpleName(), preview(text));
            throw new ModelTransientException(Kind.MALFORMED,
                    "could not map reply to " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public ModelTurn generateWithTools(ModelRequest request, List<ToolDefinition> tools) {
        ResolvedModel resolved = resolve(request);
        List<ToolSpecification> specifications = tools.stream().map(LangChain4jModelGateway::toSpecification).toList();
        AiMessage reply = call(resolved, request, specifications);

        ModelTurn.ModelTurnBuilder turn = ModelTurn.builder().text(reply.text());
        if (reply.hasToolExecutionRequests()) {
            for (ToolExecutionRequest toolRequest : reply.toolExecutionRequests()) {
                turn.toolCall(toToolCall(toolRequest));
            }
        } else if (reply.text() == null || reply.text().isBlank()) {
            throw new ModelTransientException(Kind.EMPTY, "empty reply without tool calls from " + resolved);
        }
        return turn.build();
    }

    @Override
    public boolean supportsToolCalling(ModelRequest request) {
        return chatModelFactory.supportsTools(resolve(request));
    }

    private ResolvedModel resolve(ModelRequest request) {
        return chatModelFactory.resolve(request.getTask(), request.getAnalysisMode(), request.getProvider());
    }

    private AiMessage call(ResolvedModel resolved, ModelRequest request, List<ToolSpecification> tools) {
        ChatLanguageModel model = chatModelFactory.getModel(resolved);
        List<dev.langchain4j.data.message.ChatMessage> messages = toProviderMessages(request);

        long start = System.currentTimeMillis();
        try {
            Response<AiMessage> response = tools == null || tools.isEmpty()
                    ? model.generate(messages)
                    : model.generate(messages, tools);
            log.debug("🤖 {} task={} answered in {}ms", resolved, request.getTask(),
                    System.currentTimeMillis() - start);
            if (response == null || response.content() == null) {
                throw new ModelTransientException(Kind.EMPTY, "no content from " + resolved);
            }
            return response.content();
        } catch (ModelTransientException e) {
            throw e;
        } catch (RuntimeException e) {
            Kind kind = isTimeout(e) ? Kind.TIMEOUT : Kind.TRANSPORT;
            log.error("❌ {} call failed for task={} ({})", resolved, request.getTask(), kind, e);
            throw new ModelTransientException(kind, resolved + " call failed: " + e.getMessage(), e);
        }
    }

    private List<dev.langchain4j.data.message.ChatMessage> toProviderMessages(ModelRequest request) {
        List<dev.langchain4j.data.message.ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        for (ChatMessage message : request.getMessages()) {
            messages.add(toProviderMessage(message));
        }
        if (request.getUserPrompt() != null && !request.getUserPrompt().isBlank()) {
            messages.add(UserMessage.from(request.getUserPrompt()));
        }
        return messages;
    }

    private dev.langchain4j.data.message.ChatMessage toProviderMessage(ChatMessage message) {
        return switch (message.getRole()) {
            case SYSTEM -> SystemMessage.from(message.getContent());
            case USER -> UserMessage.from(message.getContent());
            case ASSISTANT -> message.hasToolCalls()
                    ? AiMessage.from(message.getToolCalls().stream().map(this::toRequest).toList())
                    : AiMessage.from(message.getContent() == null ? "" : message.getContent());
            case TOOL -> ToolExecutionResultMessage.from(
                    message.getToolCallId(), message.getToolName(), message.getContent());
        };
    }

    private ToolExecutionRequest toRequest(ToolCall call) {
        return ToolExecutionRequest.builder()
                .id(call.getId())
                .name(call.getName())
                .arguments(call.getRawArguments() == null ? "{}" : call.getRawArguments())
                .build();
    }

    private ToolCall toToolCall(ToolExecutionRequest request) {
        Map<String, Object> arguments = Map.of();
        String raw = request.arguments();
        if (raw != null && !raw.isBlank()) {
            try {
                arguments = objectMapper.readValue(raw, ARGUMENTS_TYPE);
            } catch (JsonProcessingException e) {
                log.warn("Unreadable arguments for tool {}: {}", request.name(), preview(raw));
            }
        }
        return ToolCall.builder()
                .id(request.id())
                .name(request.name())
                .arguments(arguments)
                .rawArguments(raw)
                .build();
    }

    private static ToolSpecification toSpecification(ToolDefinition definition) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(definition.name())
                .description(definition.description());
        for (ToolDefinition.Parameter parameter : definition.parameters()) {
            builder.addParameter(parameter.name(), JsonSchemaProperty.STRING,
                    JsonSchemaProperty.description(parameter.description()));
        }
        return builder.build();
    }

    static String stripCodeFence(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).trim();
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof HttpTimeoutException
                    || t instanceof InterruptedIOException) {
                return true;
            }
        }
        return false;
    }

    private static String preview(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
