package com.purchasingpower.flowinsight.workflow.agents;

import com.purchasingpower.flowinsight.analysis.ConfidenceResult;
import com.purchasingpower.flowinsight.analysis.ConfidenceScorer;
import com.purchasingpower.flowinsight.config.AnalysisConfig;
import com.purchasingpower.flowinsight.exception.InsufficientDataException;
import com.purchasingpower.flowinsight.workflow.AnalysisStage;
import com.purchasingpower.flowinsight.workflow.state.AgentState;
import com.purchasingpower.flowinsight.workflow.state.AnalysisPhase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides whether the input is complete enough to analyze or the user has
 * to be asked for more.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContextCheckAgent implements AnalysisStage {

    private final ConfidenceScorer confidenceScorer;
    private final AnalysisConfig config;

    @Override
    public AnalysisPhase phase() {
        return AnalysisPhase.CHECK_CONTEXT;
    }

    @Override
    public AgentState execute(AgentState state) {
        if (state.getProcess() == null) {
            throw new InsufficientDataException("Agent state has no process", List.of("process"));
        }
        log.info("📊 Checking context for: {}", state.getProcess().getName());

        ConfidenceResult confidence = confidenceScorer.score(
                state.getProcess(), state.getConstraints(), state.getProfile());

        String reasoning = String.format("Context check: confidence=%.1f%% (%s)",
                confidence.getScore() * 100, confidence.level());

        AgentState.AgentStateBuilder next = state.toBuilder()
                .confidenceScore(confidence.getScore())
                .dataGaps(List.copyOf(confidence.getDataGaps()))
                .userResponse(null);

        if (!confidence.isSufficient()) {
            List<String> criticalGaps = confidence.criticalGaps();
            reasoning += String.format(", identified %d critical gaps", confidence.criticalGapCount());
            log.info("⚠️ Context insufficient ({} gaps), needs clarification", criticalGaps.size());

            List<String> suggestions = confidence.getSuggestionsForImprovement();
            return next
                    .needsClarification(true)
                    .dataGaps(List.copyOf(criticalGaps))
                    .clarificationQuestions(List.copyOf(
                            suggestions.subList(0, Math.min(config.getMaxClarificationQuestions(), suggestions.size()))))
                    .build()
                    .withTrace(reasoning, config.getMaxTraceEntries());
        }

        log.info("✅ Context sufficient, proceeding to analysis");
        return next
                .needsClarification(false)
                .clarificationQuestions(List.of())
                .build()
                .withTrace(reasoning, config.getMaxTraceEntries());
    }
}
