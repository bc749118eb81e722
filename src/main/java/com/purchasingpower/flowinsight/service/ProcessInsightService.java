package com.purchasingpower.flowinsight.service;

import com.purchasingpower.flowinsight.analysis.MetricsFormatter;
import com.purchasingpower.flowinsight.analysis.RecommendationLinker;
import com.purchasingpower.flowinsight.client.ModelGateway;
import com.purchasingpower.flowinsight.config.AnalysisConfig;
import com.purchasingpower.flowinsight.exception.ModelTransientException;
import com.purchasingpower.flowinsight.model.context.BusinessProfile;
import com.purchasingpower.flowinsight.model.context.Constraints;
import com.purchasingpower.flowinsight.model.insight.AnalysisInsight;
import com.purchasingpower.flowinsight.model.insight.Issue;
import com.purchasingpower.flowinsight.model.insight.NotAProblem;
import com.purchasingpower.flowinsight.model.insight.Recommendation;
import com.purchasingpower.flowinsight.model.llm.ModelRequest;
import com.purchasingpower.flowinsight.model.metrics.ProcessMetrics;
import com.purchasingpower.flowinsight.model.prompt.RenderedPrompt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns calculated metrics into a model-judged {@link AnalysisInsight}.
 *
 * <p>Algorithms calculate FACTS (percentages, dependencies, patterns), the
 * model makes JUDGMENTS (what is a problem, what is core value). One structured
 * call, retried exactly once on a transient failure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProcessInsightService {

    public static final String TASK_ANALYSIS = "analysis";

    private final ModelGateway modelGateway;
    private final PromptLibraryService promptLibrary;
    private final RecommendationLinker recommendationLinker;
    private final AnalysisConfig config;

    /**
     * @param constraints   may be null
     * @param profile       may be null
     * @param analysisMode  optional model preset
     * @param provider      optional provider override
     * @throws ModelTransientException when both attempts fail
     */
    public AnalysisInsight analyze(ProcessMetrics metrics,
                                   Constraints constraints,
                                   BusinessProfile profile,
                                   String analysisMode,
                                   String provider) {
        RenderedPrompt prompt = promptLibrary.render("process-analysis",
                variables(MetricsFormatter.format(metrics), constraints, profile));

        ModelRequest request = ModelRequest.builder()
                .task(TASK_ANALYSIS)
                .analysisMode(analysisMode)
                .provider(provider)
                .systemPrompt(prompt.systemPrompt())
                .userPrompt(prompt.userPrompt())
                .build();

        AnalysisInsight insight;
        try {
            log.debug("Calling LLM for process analysis (attempt 1)...");
            insight = requestInsight(request);
        } catch (ModelTransientException first) {
            log.warn("⚠️ LLM analysis attempt 1 failed ({}): {}", first.getKind(), first.getMessage());
            pauseBeforeRetry(first);
            log.debug("Calling LLM for process analysis (attempt 2)...");
            insight = requestInsight(request);
        }

        AnalysisInsight linked = recommendationLinker.link(insight);
        log.info("🤖 LLM analysis complete: {} issues, {} recommendations, {} not-problems",
                linked.getIssues().size(), linked.getRecommendations().size(), linked.getNotProblems().size());
        return linked;
    }

    private AnalysisInsight requestInsight(ModelRequest request) {
        AnalysisInsight insight = modelGateway.generateStructured(request, AnalysisInsight.class);
        requireWellFormed(insight);
        return insight;
    }

    /**
     * Parsed JSON can still be unusable: every issue and recommendation needs a
     * title, every not-a-problem entry a step name.
     */
    static void requireWellFormed(AnalysisInsight insight) {
        if (insight.getIssues() == null || insight.getRecommendations() == null || insight.getNotProblems() == null) {
            throw new ModelTransientException(ModelTransientException.Kind.MALFORMED,
                    "Analysis is missing its issue, recommendation or not-problem list");
        }
        for (Issue issue : insight.getIssues()) {
            if (isBlank(issue.getTitle()) || issue.getAffectedSteps() == null) {
                throw new ModelTransientException(ModelTransientException.Kind.MALFORMED,
                        "Analysis contains an issue without a title");
            }
        }
        for (Recommendation rec : insight.getRecommendations()) {
            if (isBlank(rec.getTitle())) {
                throw new ModelTransientException(ModelTransientException.Kind.MALFORMED,
                        "Analysis contains a recommendation without a title");
            }
        }
        for (NotAProblem notAProblem : insight.getNotProblems()) {
            if (isBlank(notAProblem.getStepName())) {
                throw new ModelTransientException(ModelTransientException.Kind.MALFORMED,
                        "Analysis contains a not-a-problem entry without a step name");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private void pauseBeforeRetry(ModelTransientException cause) {
        if (config.getRetryBackoffMs() <= 0) {
            return;
        }
        try {
            Thread.sleep(config.getRetryBackoffMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }

    static Map<String, Object> variables(String metricsText, Constraints constraints, BusinessProfile profile) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("metricsText", metricsText);
        if (constraints != null) {
            vars.put("constraintsSummary", constraints.summarize());
        }
        if (profile != null) {
            vars.put("industry", profile.industryLabel());
            vars.put("companySize", profile.getCompanySize() == null ? null : profile.getCompanySize().toValue());
            vars.put("regulatoryEnvironment", profile.getRegulatoryEnvironment() == null
                    ? null : profile.getRegulatoryEnvironment().toValue());
            vars.put("preferredFrameworks", joined(profile.getPreferredFrameworks()));
            vars.put("previousImprovements", joined(profile.getPreviousImprovements()));
            vars.put("rejectedApproaches", joined(profile.getRejectedApproaches()));
            vars.put("notes", profile.getNotes() == null || profile.getNotes().isBlank() ? null : profile.getNotes());
        }
        return vars;
    }

    private static String joined(List<String> values) {
        return values == null || values.isEmpty() ? null : String.join(", ", values);
    }
}
