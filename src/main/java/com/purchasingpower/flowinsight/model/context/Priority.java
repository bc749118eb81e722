package com.purchasingpower.flowinsight.model.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Primary optimization goal.
 */
public enum Priority {
    COST_REDUCTION,
    TIME_REDUCTION,
    QUALITY_IMPROVEMENT,
    COMPLIANCE;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Priority fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_'));
    }
}
