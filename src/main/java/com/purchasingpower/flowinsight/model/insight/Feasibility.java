package com.purchasingpower.flowinsight.model.insight;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Feasibility {
    EASY,
    MODERATE,
    COMPLEX;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Feasibility fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
