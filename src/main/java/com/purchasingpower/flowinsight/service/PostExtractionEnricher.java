package com.purchasingpower.flowinsight.service;

import com.purchasingpower.flowinsight.analysis.ConfidenceResult;
import com.purchasingpower.flowinsight.analysis.ConfidenceScorer;
import com.purchasingpower.flowinsight.analysis.MetricsEngine;
import com.purchasingpower.flowinsight.client.ModelGateway;
import com.purchasingpower.flowinsight.config.AnalysisConfig;
import com.purchasingpower.flowinsight.configuration.AsyncConfig;
import com.purchasingpower.flowinsight.model.context.BusinessProfile;
import com.purchasingpower.flowinsight.model.context.Constraints;
import com.purchasingpower.flowinsight.model.insight.AnalysisInsight;
import com.purchasingpower.flowinsight.model.llm.ModelRequest;
import com.purchasingpower.flowinsight.model.process.ProcessData;
import com.purchasingpower.flowinsight.model.process.ProcessStep;
import com.purchasingpower.flowinsight.model.prompt.RenderedPrompt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Generates improvement suggestions and a draft analysis for freshly
 * extracted process data, in parallel.
 *
 * <p>Both calls are optional extras: any failure is logged and the
 * corresponding part of the result is left empty.
 */
@Slf4j
@Service
public class PostExtractionEnricher {

    public static final String TASK_EXPLANATION = "explanation";

    private final ConfidenceScorer confidenceScorer;
    private final MetricsEngine metricsEngine;
    private final ProcessInsightService insightService;
    private final ModelGateway modelGateway;
    private final PromptLibraryService promptLibrary;
    private final AnalysisConfig config;
    private final Executor executor;

    public PostExtractionEnricher(ConfidenceScorer confidenceScorer,
                                  MetricsEngine metricsEngine,
                                  ProcessInsightService insightService,
                                  ModelGateway modelGateway,
                                  PromptLibraryService promptLibrary,
                                  AnalysisConfig config,
                                  @Qualifier(AsyncConfig.ENRICHMENT_EXECUTOR) Executor executor) {
        this.confidenceScorer = confidenceScorer;
        this.metricsEngine = metricsEngine;
        this.insightService = insightService;
        this.modelGateway = modelGateway;
        this.promptLibrary = promptLibrary;
        this.config = config;
        this.executor = executor;
    }

    public EnrichmentResult enrich(ProcessData process,
                                   Constraints constraints,
                                   BusinessProfile profile,
                                   String analysisMode,
                                   String provider) {
        ConfidenceResult confidence = confidenceScorer.score(process, constraints, profile);

        CompletableFuture<String> suggestions = submit("improvement suggestions",
                () -> improvementSuggestions(process, confidence, analysisMode, provider));

        CompletableFuture<AnalysisInsight> draft = submit("draft analysis",
                () -> draftAnalysis(process, confidence, analysisMode, provider));

        return EnrichmentResult.builder()
                .confidence(confidence)
                .improvementSuggestions(suggestions.join())
                .draftInsight(draft.join())
                .build();
    }

    String improvementSuggestions(ProcessData process, ConfidenceResult confidence,
                                  String analysisMode, String provider) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("processName", process.getName());
        vars.put("stepCount", process.getSteps().size());
        vars.put("stepsWithTime", count(process, s -> s.getAverageTimeHours() > 0));
        vars.put("stepsWithCost", count(process, s -> s.getCostPerInstance() > 0));
        vars.put("stepsWithErrors", count(process, s -> s.getErrorRatePct() > 0));
        vars.put("stepsWithDependencies", count(process, ProcessStep::hasDependencies));
        vars.put("hasGaps", !confidence.getDataGaps().isEmpty());
        vars.put("dataGaps", confidence.getDataGaps());
        RenderedPrompt prompt = promptLibrary.render("improvement-suggestions", vars);

        log.debug("Generating improvement suggestions for: {}", process.getName());
        String text = modelGateway.generateText(ModelRequest.builder()
                .task(TASK_EXPLANATION)
                .analysisMode(analysisMode)
                .provider(provider)
                .systemPrompt(prompt.systemPrompt())
                .userPrompt(prompt.userPrompt())
                .build());

        log.info("Generated improvement suggestions ({} chars)", text.length());
        return text.strip();
    }

    AnalysisInsight draftAnalysis(ProcessData process, ConfidenceResult confidence,
                                  String analysisMode, String provider) {
        if (confidence.getScore() < config.getDraftAnalysisThreshold()) {
            log.debug("Skipping draft analysis: confidence {} < {} threshold",
                    String.format("%.2f", confidence.getScore()), config.getDraftAnalysisThreshold());
            return null;
        }
        log.info("Generating draft analysis for: {}", process.getName());
        AnalysisInsight insight = insightService.analyze(
                metricsEngine.compute(process), null, null, analysisMode, provider);
        log.info("Draft analysis: {} issues, {} recommendations",
                insight.getIssues().size(), insight.getRecommendations().size());
        return insight;
    }

    private <T> CompletableFuture<T> submit(String label, Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, executor)
                    .exceptionally(e -> degraded(label, e));
        } catch (RejectedExecutionException e) {
            // pool saturated
            return CompletableFuture.completedFuture(degraded(label, e));
        }
    }

    private static <T> T degraded(String label, Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.warn("⚠️ Post-extraction {} failed (non-critical): {}", label, cause.getMessage(), cause);
        return null;
    }

    private static long count(ProcessData process, Predicate<ProcessStep> predicate) {
        return process.getSteps().stream().filter(predicate).count();
    }
}
