package com.purchasingpower.flowinsight.client;

import com.purchasingpower.flowinsight.config.ModelConfig;
import com.purchasingpower.flowinsight.exception.ConfigurationException;
import com.purchasingpower.flowinsight.model.llm.ResolvedModel;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds LangChain4j chat models for a {@link ResolvedModel}.
 *
 * <p>One instance per provider/model/temperature is built on first use and
 * reused afterwards. Supported providers: openai, anthropic, ollama.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatModelFactory {

    private final ModelConfig modelConfig;
    private final Map<ResolvedModel, ChatLanguageModel> models = new ConcurrentHashMap<>();

    public ResolvedModel resolve(String task, String analysisMode, String providerOverride) {
        ResolvedModel resolved = modelConfig.resolve(task, analysisMode, providerOverride);
        if (resolved.modelName() == null || resolved.modelName().isBlank()) {
            throw new ConfigurationException("no model configured for provider '" + resolved.provider() + "'",
                    "app.llm.providers." + resolved.provider() + ".default-model");
        }
        return resolved;
    }

    public ChatLanguageModel getModel(ResolvedModel resolved) {
        return models.computeIfAbsent(resolved, this::create);
    }

    public boolean supportsTools(ResolvedModel resolved) {
        ModelConfig.ProviderSettings settings = modelConfig.settingsFor(resolved.provider());
        return settings == null || settings.isSupportsTools();
    }

    private ChatLanguageModel create(ResolvedModel resolved) {
        Duration timeout = Duration.ofSeconds(modelConfig.getTimeoutSeconds());
        ModelConfig.ProviderSettings settings = modelConfig.settingsFor(resolved.provider());
        int maxRetries = settings == null ? 0 : settings.getMaxRetries();

        log.info("🔧 Creating chat model {}", resolved);

        return switch (resolved.provider()) {
            case "openai" -> OpenAiChatModel.builder()
                    .apiKey(requireApiKey(resolved.provider(), settings))
                    .modelName(resolved.modelName())
                    .temperature(resolved.temperature())
                    .timeout(timeout)
                    .maxRetries(maxRetries)
                    .build();
            case "anthropic" -> AnthropicChatModel.builder()
                    .apiKey(requireApiKey(resolved.provider(), settings))
                    .modelName(resolved.modelName())
                    .temperature(resolved.temperature())
                    .timeout(timeout)
                    .maxRetries(maxRetries)
                    .build();
            case "ollama" -> OllamaChatModel.builder()
                    .baseUrl(settings != null && settings.getBaseUrl() != null
                            ? settings.getBaseUrl() : "http://localhost:11434")
                    .modelName(resolved.modelName())
                    .temperature(resolved.temperature())
                    .timeout(timeout)
                    .maxRetries(maxRetries)
                    .build();
            default -> throw new ConfigurationException(
                    "unknown LLM provider '" + resolved.provider() + "'", "app.llm.provider");
        };
    }

    private static String requireApiKey(String provider, ModelConfig.ProviderSettings settings) {
        if (settings == null || settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new ConfigurationException("missing API key for provider '" + provider + "'",
                    "app.llm.providers." + provider + ".api-key");
        }
        return settings.getApiKey();
    }
}
