package com.purchasingpower.flowinsight.model.roi;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of improvement an ROI estimate can be made for.
 */
public enum SuggestionType {
    AUTOMATION,
    PROCESS_REDESIGN,
    RESOURCE_REALLOCATION,
    TRAINING,
    TOOL_UPGRADE,
    ELIMINATION,
    PARALLELIZATION;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse. Unknown values map to {@code null} so the calculator can
     * apply its fallback factors.
     */
    @JsonCreator
    public static SuggestionType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (SuggestionType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim().replace(' ', '_'))) {
                return type;
            }
        }
        return null;
    }
}
