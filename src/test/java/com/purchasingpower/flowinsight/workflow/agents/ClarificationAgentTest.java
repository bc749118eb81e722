package com.purchasingpower.flowinsight.workflow.agents;

import com.purchasingpower.flowinsight.ProcessFixtures;
import com.purchasingpower.flowinsight.TestPipeline;
import com.purchasingpower.flowinsight.exception.ConfigurationException;
import com.purchasingpower.flowinsight.exception.ModelTransientException;
import com.purchasingpower.flowinsight.model.llm.ModelRequest;
import com.purchasingpower.flowinsight.workflow.state.AgentState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Clarification Agent Tests")
class ClarificationAgentTest {

    private TestPipeline pipeline;
    private ClarificationAgent agent;
    private AgentState state;

    @BeforeEach
    void setUp() {
        pipeline = new TestPipeline();
        pipeline.config.setLlmClarificationEnabled(true);
        agent = new ClarificationAgent(pipeline.gateway, pipeline.prompts, pipeline.config);
        state = AgentState.initial("t", ProcessFixtures.bareSubmitReview(), null, null).toBuilder()
                .confidenceScore(0.29)
                .dataGaps(List.of("time for 'Submit'", "cost for 'Submit'", "time for 'Review'", "cost for 'Review'"))
                .build();
    }

    @Test
    @DisplayName("Should use the questions the model wrote")
    void execute_llmQuestions() {
        // Given
        pipeline.gateway.texts("""
                1. How long does Submit usually take?
                2) What does one Review cost?
                3: How often is a claim sent back?
                4. Who approves claims?""");

        // When
        AgentState result = agent.execute(state);

        // Then
        assertThat(result.getClarificationQuestions()).containsExactly(
                "How long does Submit usually take?",
                "What does one Review cost?",
                "How often is a claim sent back?");
        assertThat(result.isNeedsClarification()).isTrue();
        assertThat(result.getReasoningTrace()).containsExactly("Requesting clarification: 3 questions (LLM generated)");

        ModelRequest request = pipeline.gateway.getRequests().get(0);
        assertThat(request.getTask()).isEqualTo(ClarificationAgent.TASK_CLARIFICATION);
        assertThat(request.getUserPrompt()).contains("- time for 'Submit'").contains("29%");
    }

    @Test
    @DisplayName("Should fall back to prepared questions when the model fails")
    void execute_modelFailure_usesPreparedQuestions() {
        pipeline.gateway.texts(new ModelTransientException(ModelTransientException.Kind.TIMEOUT, "slow"));

        AgentState result = agent.execute(state.toBuilder()
                .clarificationQuestions(List.of("Provide the average time for every step"))
                .build());

        assertThat(result.getClarificationQuestions()).containsExactly("Provide the average time for every step");
        assertThat(result.getReasoningTrace()).containsExactly("Requesting clarification: 1 questions");
    }

    @Test
    @DisplayName("Should ask for the most critical gaps when nothing else is available")
    void execute_gapFallback() {
        pipeline.config.setLlmClarificationEnabled(false);

        AgentState result = agent.execute(state);

        assertThat(result.getClarificationQuestions()).containsExactly(
                "Please provide: time for 'Submit'",
                "Please provide: cost for 'Submit'",
                "Please provide: time for 'Review'");
        assertThat(pipeline.gateway.getRequests()).isEmpty();
    }

    @Test
    @DisplayName("Should not hide configuration errors")
    void execute_configurationError_propagates() {
        pipeline.gateway.texts(new ConfigurationException("unknown LLM provider 'foo'", "app.llm.provider"));

        assertThatThrownBy(() -> agent.execute(state)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Should parse bulleted lists and keep unstructured replies whole")
    void parseQuestions() {
        assertThat(ClarificationAgent.parseQuestions("Intro\n- First?\n* Second?", 5))
                .containsExactly("First?", "Second?");
        assertThat(ClarificationAgent.parseQuestions("  Could you share step costs?  ", 3))
                .containsExactly("Could you share step costs?");
    }
}
