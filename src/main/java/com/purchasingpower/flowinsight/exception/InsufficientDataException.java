package com.purchasingpower.flowinsight.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when an operation needs fields the caller has not supplied.
 */
@Getter
public class InsufficientDataException extends FlowInsightException {

    private final List<String> missingFields;

    public InsufficientDataException(String message, List<String> missingFields) {
        super(message, message);
        this.missingFields = List.copyOf(missingFields);
    }

    @Override
    public String getErrorCode() {
        return "insufficient_data";
    }
}
