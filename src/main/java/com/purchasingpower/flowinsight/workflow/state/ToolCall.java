package com.purchasingpower.flowinsight.workflow.state;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.util.Map;

/**
 * A tool invocation requested by the model.
 */
@Value
@Builder
@Jacksonized
public class ToolCall implements Serializable {

    /** Provider-assigned id, echoed back with the result. */
    String id;

    String name;

    /** Parsed arguments; empty when the raw JSON could not be read. */
    Map<String, Object> arguments;

    String rawArguments;

    public String argument(String key) {
        Object value = arguments == null ? null : arguments.get(key);
        return value == null ? null : value.toString();
    }
}
