package com.purchasingpower.flowinsight.model.llm;

import java.util.List;

/**
 * Provider-neutral description of a tool the model may call.
 * All parameters are strings.
 */
public record ToolDefinition(String name, String description, List<Parameter> parameters) {

    public record Parameter(String name, String description) {
    }
}
