package com.purchasingpower.flowinsight.model.llm;

import com.purchasingpower.flowinsight.workflow.state.ChatMessage;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One model invocation.
 *
 * <p>The gateway sends {@code systemPrompt} first, then {@code messages} in
 * order, then {@code userPrompt}. Blank prompts are skipped.
 */
@Value
@Builder
public class ModelRequest {

    /** Task name used for model resolution: extraction, clarification, explanation, analysis. */
    String task;

    /** Optional preset: cost_optimized, balanced, deep_analysis. */
    String analysisMode;

    /** Optional provider override for this call. */
    String provider;

    String systemPrompt;

    @Singular
    List<ChatMessage> messages;

    String userPrompt;
}
