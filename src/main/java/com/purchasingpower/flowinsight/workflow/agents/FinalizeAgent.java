package com.purchasingpower.flowinsight.workflow.agents;

import com.purchasingpower.flowinsight.config.AnalysisConfig;
import com.purchasingpower.flowinsight.model.insight.AnalysisInsight;
import com.purchasingpower.flowinsight.workflow.AnalysisStage;
import com.purchasingpower.flowinsight.workflow.state.AgentState;
import com.purchasingpower.flowinsight.workflow.state.AnalysisPhase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds the tool findings into the insight and closes the trace.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FinalizeAgent implements AnalysisStage {

    private final AnalysisConfig config;

    @Override
    public AnalysisPhase phase() {
        return AnalysisPhase.FINALIZE;
    }

    @Override
    public AgentState execute(AgentState state) {
        AnalysisInsight insight = state.getInsight();
        if (insight != null && !state.getToolFindings().isEmpty()) {
            List<String> findings = new ArrayList<>(insight.getInvestigationFindings());
            findings.addAll(state.getToolFindings());
            insight = insight.toBuilder().investigationFindings(findings).build();
        }

        String reasoning;
        if (state.hasError()) {
            reasoning = "Analysis finalized with error: " + state.getError();
        } else if (insight != null) {
            reasoning = String.format("Analysis finalized: %d issues, %d recommendations, confidence=%.0f%%",
                    insight.getIssues().size(), insight.getRecommendations().size(),
                    state.getConfidenceScore() * 100);
        } else {
            reasoning = "Analysis finalized with no results";
        }

        log.info("✅ Analysis finalized (confidence={}%)", Math.round(state.getConfidenceScore() * 100));

        return state.toBuilder()
                .insight(insight)
                .build()
                .withTrace(reasoning, config.getMaxTraceEntries());
    }
}
