package com.purchasingpower.flowinsight.exception;

import lombok.Getter;

/**
 * Base type for failures raised by the analysis pipeline.
 *
 * <p>Carries a short message that is safe to show to the person who
 * requested the analysis, separate from the technical message used in logs.
 */
@Getter
public class FlowInsightException extends RuntimeException {

    private final String userMessage;

    public FlowInsightException(String message, String userMessage) {
        super(message);
        this.userMessage = userMessage;
    }

    public FlowInsightException(String message, String userMessage, Throwable cause) {
        super(message, cause);
        this.userMessage = userMessage;
    }

    /**
     * Stable short code for API responses (e.g. "configuration_error").
     */
    public String getErrorCode() {
        return "analysis_error";
    }
}
