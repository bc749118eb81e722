package com.purchasingpower.flowinsight.model.process;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How steps sharing a group id relate to each other.
 */
public enum StepGroupType {
    /** Only one of the grouped steps runs per instance. */
    ALTERNATIVE,
    /** All grouped steps run at the same time. */
    PARALLEL;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StepGroupType fromValue(String value) {
        return value == null || value.isBlank() ? null : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
