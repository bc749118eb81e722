package com.purchasingpower.flowinsight.client;

import com.purchasingpower.flowinsight.model.llm.ModelRequest;
import com.purchasingpower.flowinsight.model.llm.ModelTurn;
import com.purchasingpower.flowinsight.model.llm.ToolDefinition;

import java.util.List;

/**
 * Single entry point for language model calls.
 *
 * <p>Implementations resolve provider, model and temperature from the request's
 * task and analysis mode, apply a timeout, and report failures as:
 * <ul>
 *   <li>{@link com.purchasingpower.flowinsight.exception.ConfigurationException}
 *       for unknown providers or missing credentials (never retried)</li>
 *   <li>{@link com.purchasingpower.flowinsight.exception.ModelTransientException}
 *       for empty, malformed, timed-out or failed calls</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface ModelGateway {

    /**
     * Plain text completion.
     *
     * @return non-blank reply text
     */
    String generateText(ModelRequest request);

    /**
     * Completion mapped onto {@code type}. A reply that cannot be mapped is a
     * {@code MALFORMED} transient failure; callers never see partial objects.
     */
    <T> T generateStructured(ModelRequest request, Class<T> type);

    /**
     * Completion with tool calling enabled.
     */
    ModelTurn generateWithTools(ModelRequest request, List<ToolDefinition> tools);

    /**
     * Whether the model resolved for this request can take tool specifications.
     */
    boolean supportsToolCalling(ModelRequest request);
}
