package com.purchasingpower.flowinsight.workflow.agents;

import com.purchasingpower.flowinsight.analysis.MetricsEngine;
import com.purchasingpower.flowinsight.config.AnalysisConfig;
import com.purchasingpower.flowinsight.exception.ModelTransientException;
import com.purchasingpower.flowinsight.model.insight.AnalysisInsight;
import com.purchasingpower.flowinsight.model.insight.Issue;
import com.purchasingpower.flowinsight.model.metrics.ProcessMetrics;
import com.purchasingpower.flowinsight.model.prompt.RenderedPrompt;
import com.purchasingpower.flowinsight.service.ProcessInsightService;
import com.purchasingpower.flowinsight.service.PromptLibraryService;
import com.purchasingpower.flowinsight.workflow.AnalysisStage;
import com.purchasingpower.flowinsight.workflow.state.AgentState;
import com.purchasingpower.flowinsight.workflow.state.AnalysisPhase;
import com.purchasingpower.flowinsight.workflow.state.ChatMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the process metrics and asks the model for its first judgment.
 *
 * <p>On success the metrics are cached in the state and the investigation
 * conversation is seeded with a summary of the issues found. When the model
 * call fails twice the state carries a user-facing error and no insight.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InitialAnalysisAgent implements AnalysisStage {

    static final String ANALYSIS_FAILED = "LLM analysis failed. Please try again.";

    private final MetricsEngine metricsEngine;
    private final ProcessInsightService insightService;
    private final PromptLibraryService promptLibrary;
    private final AnalysisConfig config;

    @Override
    public AnalysisPhase phase() {
        return AnalysisPhase.INITIAL_ANALYSIS;
    }

    @Override
    public AgentState execute(AgentState state) {
        log.info("🔍 Analyzing process: {}", state.getProcess().getName());

        ProcessMetrics metrics = metricsEngine.compute(state.getProcess());

        AnalysisInsight insight;
        try {
            insight = insightService.analyze(metrics, state.getConstraints(), state.getProfile(),
                    state.getAnalysisMode(), state.getLlmProvider());
        } catch (ModelTransientException e) {
            log.error("❌ LLM analysis failed after retry: {}", e.getMessage(), e);
            return state.toBuilder()
                    .metrics(metrics)
                    .insight(null)
                    .build()
                    .failed(ANALYSIS_FAILED, e.getErrorCode())
                    .withTrace("LLM analysis failed", config.getMaxTraceEntries());
        }

        String reasoning = String.format(
                "LLM analysis: %d issues identified, %d recommendations, %d steps identified as core value (not waste)",
                insight.getIssues().size(), insight.getRecommendations().size(), insight.getNotProblems().size());

        return state.toBuilder()
                .metrics(metrics)
                .insight(insight)
                .messages(List.of())
                .cycleCount(0)
                .toolFindings(List.of())
                .build()
                .withMessages(seedMessages(state, insight))
                .withTrace(reasoning, config.getMaxTraceEntries());
    }

    private List<ChatMessage> seedMessages(AgentState state, AnalysisInsight insight) {
        if (!insight.hasIssues()) {
            return List.of();
        }
        List<Map<String, Object>> issues = new ArrayList<>();
        for (Issue issue : insight.getIssues()) {
            Map<String, Object> item = new HashMap<>();
            item.put("title", issue.getTitle());
            item.put("severity", issue.getSeverity() == null ? "unrated" : issue.getSeverity().toValue());
            item.put("rootCauseHypothesis", issue.getRootCauseHypothesis());
            item.put("affectedSteps", String.join(", ", issue.getAffectedSteps()));
            issues.add(item);
        }
        Map<String, Object> vars = new HashMap<>();
        vars.put("processName", state.getProcess().getName());
        vars.put("issues", issues);
        RenderedPrompt prompt = promptLibrary.render("investigation", vars);

        return List.of(
                ChatMessage.system(prompt.systemPrompt()),
                ChatMessage.user(prompt.userPrompt()));
    }
}
