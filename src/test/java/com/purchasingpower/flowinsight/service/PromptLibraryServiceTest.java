package com.purchasingpower.flowinsight.service;

import com.purchasingpower.flowinsight.exception.ConfigurationException;
import com.purchasingpower.flowinsight.model.prompt.RenderedPrompt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Prompt Library Service Tests")
class PromptLibraryServiceTest {

    private PromptLibraryService promptLibrary;

    @BeforeEach
    void setUp() {
        promptLibrary = new PromptLibraryService();
        promptLibrary.loadPrompts();
    }

    @Test
    @DisplayName("Should load every bundled template")
    void loadPrompts() {
        assertThat(promptLibrary.getTemplate("process-analysis")).isNotNull();
        assertThat(promptLibrary.getTemplate("investigation").getTask()).isEqualTo("analysis");
        assertThat(promptLibrary.getTemplate("clarification").getTask()).isEqualTo("clarification");
        assertThat(promptLibrary.getTemplate("improvement-suggestions").getTask()).isEqualTo("explanation");
    }

    @Test
    @DisplayName("Should render lists without escaping model text")
    void render_clarification() {
        // Given
        Map<String, Object> vars = new HashMap<>();
        vars.put("confidencePct", "42");
        vars.put("phase", "initial_analysis");
        vars.put("dataGaps", List.of("time for 'Review'", "cost for \"Approve\" & sign"));
        vars.put("maxQuestions", 3);

        // When
        RenderedPrompt prompt = promptLibrary.render("clarification", vars);

        // Then
        assertThat(prompt.systemPrompt()).startsWith("You are a business process analyst");
        assertThat(prompt.userPrompt())
                .contains("Current confidence in the data: 42%.")
                .contains("- time for 'Review'")
                .contains("- cost for \"Approve\" & sign")
                .contains("at most 3 short questions")
                .doesNotContain("What we already know");
    }

    @Test
    @DisplayName("Should hide the gap section when there are no gaps")
    void render_improvementSuggestions_withoutGaps() {
        Map<String, Object> vars = new HashMap<>();
        vars.put("processName", "Expense claim");
        vars.put("stepCount", 2);
        vars.put("stepsWithTime", 0);
        vars.put("stepsWithCost", 0);
        vars.put("stepsWithErrors", 0);
        vars.put("stepsWithDependencies", 1);
        vars.put("hasGaps", false);
        vars.put("dataGaps", List.of());

        RenderedPrompt prompt = promptLibrary.render("improvement-suggestions", vars);

        assertThat(prompt.userPrompt())
                .startsWith("The process \"Expense claim\" has 2 steps.")
                .contains("- Steps with dependencies: 1")
                .doesNotContain("Known gaps");
    }

    @Test
    @DisplayName("Should fail with a configuration error for unknown templates")
    void render_unknownTemplate() {
        assertThatThrownBy(() -> promptLibrary.render("does-not-exist", Map.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("does-not-exist");
    }
}
