package com.purchasingpower.flowinsight.service;

import com.purchasingpower.flowinsight.ProcessFixtures;
import com.purchasingpower.flowinsight.TestPipeline;
import com.purchasingpower.flowinsight.exception.ModelTransientException;
import com.purchasingpower.flowinsight.model.llm.ModelRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Post Extraction Enricher Tests")
class PostExtractionEnricherTest {

    private TestPipeline pipeline;
    private PostExtractionEnricher enricher;

    @BeforeEach
    void setUp() {
        pipeline = new TestPipeline();
        enricher = new PostExtractionEnricher(pipeline.confidenceScorer, pipeline.metricsEngine,
                pipeline.insightService, pipeline.gateway, pipeline.prompts, pipeline.config, Runnable::run);
    }

    @Test
    @DisplayName("Should produce suggestions and a draft for well described processes")
    void enrich_completeData() {
        // Given
        pipeline.gateway
                .texts("  Adding error rates for the approval step would sharpen the analysis.  ")
                .structured(TestPipeline.reviewBottleneckInsight());

        // When
        EnrichmentResult result = enricher.enrich(ProcessFixtures.clientOnboarding(), null, null, null, null);

        // Then
        assertThat(result.getConfidence().getScore()).isGreaterThan(0.5);
        assertThat(result.getImprovementSuggestions())
                .isEqualTo("Adding error rates for the approval step would sharpen the analysis.");
        assertThat(result.getDraftInsight().getIssues()).hasSize(1);
        assertThat(pipeline.gateway.getRequests())
                .extracting(ModelRequest::getTask)
                .containsExactlyInAnyOrder(PostExtractionEnricher.TASK_EXPLANATION, ProcessInsightService.TASK_ANALYSIS);
    }

    @Test
    @DisplayName("Should skip the draft analysis below the confidence threshold")
    void enrich_lowConfidence_noDraft() {
        pipeline.gateway.texts("Please add times and costs for each step.");

        EnrichmentResult result = enricher.enrich(ProcessFixtures.bareSubmitReview(), null, null, null, null);

        assertThat(result.getDraftInsight()).isNull();
        assertThat(result.getImprovementSuggestions()).startsWith("Please add times");
        assertThat(pipeline.gateway.getRequests()).hasSize(1);
        assertThat(pipeline.gateway.getRequests().get(0).getUserPrompt()).contains("Known gaps");
    }

    @Test
    @DisplayName("Should degrade to empty parts when the model fails")
    void enrich_modelFailures_degrade() {
        pipeline.gateway
                .texts(new ModelTransientException(ModelTransientException.Kind.TRANSPORT, "down"))
                .structured(
                        new ModelTransientException(ModelTransientException.Kind.MALFORMED, "bad json"),
                        new ModelTransientException(ModelTransientException.Kind.MALFORMED, "bad json again"));

        EnrichmentResult result = enricher.enrich(ProcessFixtures.clientOnboarding(), null, null, null, null);

        assertThat(result.getConfidence()).isNotNull();
        assertThat(result.getImprovementSuggestions()).isNull();
        assertThat(result.getDraftInsight()).isNull();
    }

    @Test
    @DisplayName("Should degrade both parts when the worker pool rejects the tasks")
    void enrich_rejectedByExecutor() {
        // Given
        PostExtractionEnricher saturated = new PostExtractionEnricher(pipeline.confidenceScorer,
                pipeline.metricsEngine, pipeline.insightService, pipeline.gateway, pipeline.prompts,
                pipeline.config, task -> {
                    throw new RejectedExecutionException("pool full");
                });

        // When
        EnrichmentResult result = saturated.enrich(ProcessFixtures.clientOnboarding(), null, null, null, null);

        // Then
        assertThat(result.getConfidence().getScore()).isGreaterThan(0.5);
        assertThat(result.getImprovementSuggestions()).isNull();
        assertThat(result.getDraftInsight()).isNull();
        assertThat(pipeline.gateway.getRequests()).isEmpty();
    }
}
