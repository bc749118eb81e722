package com.purchasingpower.flowinsight.client;

import com.purchasingpower.flowinsight.config.ModelConfig;
import com.purchasingpower.flowinsight.exception.ConfigurationException;
import com.purchasingpower.flowinsight.model.llm.ResolvedModel;
import dev.langchain4j.model.chat.ChatLanguageModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Chat Model Factory Tests")
class ChatModelFactoryTest {

    private ModelConfig config;
    private ChatModelFactory factory;

    @BeforeEach
    void setUp() {
        config = new ModelConfig();
        Map<String, ModelConfig.ProviderSettings> providers = new HashMap<>();
        ModelConfig.ProviderSettings openai = new ModelConfig.ProviderSettings();
        openai.setDefaultModel("gpt-5-nano");
        providers.put("openai", openai);
        ModelConfig.ProviderSettings ollama = new ModelConfig.ProviderSettings();
        ollama.setDefaultModel("llama3.1");
        ollama.setSupportsTools(false);
        providers.put("ollama", ollama);
        config.setProviders(providers);
        factory = new ChatModelFactory(config);
    }

    @Test
    @DisplayName("Should refuse a provider without an API key")
    void getModel_missingApiKey() {
        ResolvedModel resolved = factory.resolve("analysis", null, null);

        assertThatThrownBy(() -> factory.getModel(resolved))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("missing API key for provider 'openai'");
    }

    @Test
    @DisplayName("Should refuse an unknown provider")
    void getModel_unknownProvider() {
        assertThatThrownBy(() -> factory.getModel(new ResolvedModel("foo", "bar", 0.0)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("unknown LLM provider 'foo'");
    }

    @Test
    @DisplayName("Should refuse a provider without a model")
    void resolve_noModel() {
        assertThatThrownBy(() -> factory.resolve("analysis", null, "anthropic"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("no model configured for provider 'anthropic'");
    }

    @Test
    @DisplayName("Should build one model per resolution and reuse it")
    void getModel_cached() {
        config.getProviders().get("openai").setApiKey("sk-test");
        ResolvedModel resolved = factory.resolve("analysis", null, null);

        ChatLanguageModel first = factory.getModel(resolved);
        ChatLanguageModel second = factory.getModel(new ResolvedModel("openai", "gpt-5-nano", 0.0));

        assertThat(first).isNotNull().isSameAs(second);
    }

    @Test
    @DisplayName("Should report tool support from provider settings")
    void supportsTools() {
        assertThat(factory.supportsTools(new ResolvedModel("openai", "gpt-5-nano", 0.0))).isTrue();
        assertThat(factory.supportsTools(new ResolvedModel("ollama", "llama3.1", 0.0))).isFalse();
        assertThat(factory.supportsTools(new ResolvedModel("anthropic", "claude-haiku", 0.0))).isTrue();
    }
}
