package com.purchasingpower.flowinsight.exception;

import lombok.Getter;

/**
 * Unresolvable provider, unknown model or missing credential.
 *
 * <p>Fatal for the run. Never retried.
 */
@Getter
public class ConfigurationException extends FlowInsightException {

    private final String configKey;

    public ConfigurationException(String message, String configKey) {
        super(message, "The analysis service is not configured correctly: " + message);
        this.configKey = configKey;
    }

    @Override
    public String getErrorCode() {
        return "configuration_error";
    }
}
