package com.purchasingpower.flowinsight.config;

import com.purchasingpower.flowinsight.model.llm.ResolvedModel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Language model configuration.
 *
 * <p>Properties are loaded from the {@code app.llm} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   llm:
 *     provider: openai
 *     temperature: 0.0
 *     timeout-seconds: 120
 *     providers:
 *       openai:
 *         api-key: ${OPENAI_API_KEY:}
 *         default-model: gpt-5-nano
 *     tasks:
 *       clarification:
 *         temperature: 0.3
 *     presets:
 *       openai:
 *         balanced:
 *           analysis: gpt-5-mini
 * </pre>
 *
 * <p><b>Resolution order</b> for a call (later steps win when set):
 * <ol>
 *   <li>global provider and temperature, or the per-call provider override</li>
 *   <li>preset model for provider + analysis mode + task</li>
 *   <li>task override (provider, model, temperature)</li>
 *   <li>provider default model when no model was chosen</li>
 * </ol>
 *
 * @since 1.0.0
 */
@Data
@ConfigurationProperties(prefix = "app.llm")
public class ModelConfig {

    /**
     * Active provider: openai, anthropic or ollama.
     * Default: openai
     */
    private String provider = "openai";

    /**
     * Global model override. Empty means the provider default.
     */
    private String model = "";

    /**
     * Global temperature. 0.0 gives the most repeatable output.
     */
    private double temperature = 0.0;

    /**
     * Timeout applied to every model call, in seconds.
     * Default: 120
     */
    private int timeoutSeconds = 120;

    /**
     * Per-provider connection settings keyed by provider name.
     */
    private Map<String, ProviderSettings> providers = new HashMap<>();

    /**
     * Per-task overrides keyed by task name.
     */
    private Map<String, TaskOverride> tasks = new HashMap<>();

    /**
     * Preset models: provider -> analysis mode -> task -> model.
     */
    private Map<String, Map<String, Map<String, String>>> presets = new HashMap<>();

    public ResolvedModel resolve(String task, String analysisMode, String providerOverride) {
        String resolvedProvider = notBlank(providerOverride) ? providerOverride : provider;
        double resolvedTemperature = temperature;
        String resolvedModel = null;

        if (notBlank(task) && notBlank(analysisMode)) {
            resolvedModel = presetModel(resolvedProvider, analysisMode, task);
        }

        TaskOverride override = task == null ? null : tasks.get(task);
        if (override != null) {
            if (notBlank(override.getProvider())) {
                resolvedProvider = override.getProvider();
            }
            if (override.getTemperature() != null) {
                resolvedTemperature = override.getTemperature();
            }
            if (notBlank(override.getModel())) {
                resolvedModel = override.getModel();
            }
        }

        if (resolvedModel == null) {
            resolvedModel = defaultModel(resolvedProvider);
        }
        return new ResolvedModel(resolvedProvider.toLowerCase(Locale.ROOT), resolvedModel, resolvedTemperature);
    }

    /**
     * Global model when it applies to this provider, else the provider's default.
     */
    public String defaultModel(String providerName) {
        if (providerName.equalsIgnoreCase(provider) && notBlank(model)) {
            return model;
        }
        ProviderSettings settings = providers.get(providerName.toLowerCase(Locale.ROOT));
        return settings == null ? null : settings.getDefaultModel();
    }

    public ProviderSettings settingsFor(String providerName) {
        return providers.get(providerName.toLowerCase(Locale.ROOT));
    }

    private String presetModel(String providerName, String analysisMode, String task) {
        Map<String, Map<String, String>> byMode = presets.get(providerName.toLowerCase(Locale.ROOT));
        if (byMode == null) {
            return null;
        }
        Map<String, String> byTask = byMode.get(analysisMode);
        return byTask == null ? null : byTask.get(task);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Connection settings for one provider.
     */
    @Data
    public static class ProviderSettings {

        /** API key. Required for hosted providers, unused by Ollama. */
        private String apiKey;

        /** Endpoint override; required for Ollama. */
        private String baseUrl;

        private String defaultModel;

        /** Whether this provider's models accept tool specifications. */
        private boolean supportsTools = true;

        private int maxRetries = 0;
    }

    /**
     * Overrides for one task. Unset fields inherit.
     */
    @Data
    public static class TaskOverride {
        private String provider;
        private String model;
        private Double temperature;
    }
}
