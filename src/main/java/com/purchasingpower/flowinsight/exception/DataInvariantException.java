package com.purchasingpower.flowinsight.exception;

import lombok.Getter;

/**
 * Input or internal data that violates a hard invariant
 * (zero-step process, out-of-range step values, scoring weights not summing to 1).
 */
@Getter
public class DataInvariantException extends FlowInsightException {

    private final String field;

    public DataInvariantException(String field, String message) {
        super(message, "Invalid process data: " + message);
        this.field = field;
    }

    @Override
    public String getErrorCode() {
        return "invalid_data";
    }
}
