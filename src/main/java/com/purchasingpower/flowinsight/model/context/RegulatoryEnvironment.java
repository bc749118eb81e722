package com.purchasingpower.flowinsight.model.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Regulatory strictness.
 */
public enum RegulatoryEnvironment {
    MINIMAL,
    MODERATE,
    STRICT,
    HIGHLY_REGULATED;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RegulatoryEnvironment fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_'));
    }
}
