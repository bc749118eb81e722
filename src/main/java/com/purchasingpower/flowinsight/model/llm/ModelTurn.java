package com.purchasingpower.flowinsight.model.llm;

import com.purchasingpower.flowinsight.workflow.state.ChatMessage;
import com.purchasingpower.flowinsight.workflow.state.ToolCall;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Reply of a tool-enabled model call: optional text plus any requested tool calls.
 */
@Value
@Builder
public class ModelTurn {

    String text;

    @Singular
    List<ToolCall> toolCalls;

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public ChatMessage toMessage() {
        return ChatMessage.assistant(text, toolCalls);
    }
}
