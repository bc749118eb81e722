package com.purchasingpower.flowinsight.model.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Industry classification.
 */
public enum Industry {
    FINANCIAL_SERVICES,
    HEALTHCARE,
    MANUFACTURING,
    RETAIL,
    TECHNOLOGY,
    GOVERNMENT,
    EDUCATION,
    OTHER;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Industry fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_'));
    }
}
