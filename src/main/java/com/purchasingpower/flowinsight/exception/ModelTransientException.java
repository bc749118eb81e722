package com.purchasingpower.flowinsight.exception;

import lombok.Getter;

import java.util.Locale;

/**
 * A model call that failed in a way worth retrying once.
 */
@Getter
public class ModelTransientException extends FlowInsightException {

    public enum Kind {
        /** Blank or whitespace-only reply. */
        EMPTY,
        /** Reply could not be mapped to the requested type. */
        MALFORMED,
        /** Call did not complete in time. */
        TIMEOUT,
        /** Network or provider-side failure. */
        TRANSPORT
    }

    private final Kind kind;

    public ModelTransientException(Kind kind, String message) {
        super(message, "LLM analysis failed. Please try again.");
        this.kind = kind;
    }

    public ModelTransientException(Kind kind, String message, Throwable cause) {
        super(message, "LLM analysis failed. Please try again.", cause);
        this.kind = kind;
    }

    @Override
    public String getErrorCode() {
        return "model_" + kind.name().toLowerCase(Locale.ROOT);
    }
}
