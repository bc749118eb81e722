package com.purchasingpower.flowinsight.model.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse step category inferred from the step name. Advisory only.
 */
public enum StepCategory {
    REVIEW,
    HANDOFF,
    PROCESSING,
    EXTERNAL,
    CREATIVE,
    ADMINISTRATIVE,
    UNKNOWN;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
