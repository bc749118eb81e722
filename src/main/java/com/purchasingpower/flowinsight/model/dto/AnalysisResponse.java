package com.purchasingpower.flowinsight.model.dto;

import com.purchasingpower.flowinsight.model.insight.AnalysisInsight;
import com.purchasingpower.flowinsight.model.insight.Issue;
import com.purchasingpower.flowinsight.model.insight.Severity;
import com.purchasingpower.flowinsight.workflow.state.AgentState;
import com.purchasingpower.flowinsight.workflow.state.AnalysisPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for an analysis run: the questions to answer, the insight,
 * or the error, plus the reasoning trace in every case.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResponse {
    private boolean success;
    private String threadId;
    private AnalysisPhase phase;
    private String message;
    private AnalysisInsight insight;
    private double confidence;
    private boolean needsInput;

    @Builder.Default
    private List<String> questions = new ArrayList<>();

    @Builder.Default
    private List<String> dataGaps = new ArrayList<>();

    @Builder.Default
    private List<String> reasoningTrace = new ArrayList<>();

    private String error;
    private String errorCode;

    public static AnalysisResponse fromState(AgentState state) {
        AnalysisResponseBuilder response = AnalysisResponse.builder()
                .threadId(state.getThreadId())
                .phase(state.getPhase())
                .insight(state.getInsight())
                .confidence(state.getConfidenceScore())
                .dataGaps(state.getDataGaps())
                .reasoningTrace(state.getReasoningTrace());

        if (state.isAwaitingInput()) {
            return response
                    .success(true)
                    .needsInput(true)
                    .questions(state.getClarificationQuestions())
                    .message("I need a bit more information to provide better recommendations.")
                    .build();
        }

        if (state.hasError()) {
            return response
                    .success(false)
                    .message(state.getError())
                    .error(state.getError())
                    .errorCode(state.getErrorCode())
                    .build();
        }

        if (!state.isComplete()) {
            return response
                    .success(false)
                    .message("Analysis was interrupted before it finished.")
                    .error("Analysis was interrupted before it finished.")
                    .errorCode("interrupted")
                    .build();
        }

        if (state.getInsight() != null) {
            return response
                    .success(true)
                    .message(summarize(state.getInsight()))
                    .build();
        }

        String noResults = "Analysis completed but could not generate recommendations. "
                + "This may indicate insufficient data.";
        return response
                .success(false)
                .message(noResults)
                .error(noResults)
                .errorCode("no_results")
                .build();
    }

    public static AnalysisResponse error(String threadId, String errorMessage, String errorCode) {
        return AnalysisResponse.builder()
                .success(false)
                .threadId(threadId)
                .message(errorMessage)
                .error(errorMessage)
                .errorCode(errorCode)
                .build();
    }

    /**
     * One-line summary, e.g. "Analysis complete. Found 2 significant issues, 3 recommendations."
     */
    static String summarize(AnalysisInsight insight) {
        List<String> parts = new ArrayList<>();

        if (insight.hasIssues()) {
            long high = insight.getIssues().stream().map(Issue::getSeverity).filter(s -> s == Severity.HIGH).count();
            if (high > 0) {
                parts.add(plural(high, "significant issue", "significant issues"));
            } else {
                parts.add(plural(insight.getIssues().size(), "issue", "issues"));
            }
        }
        if (!insight.getRecommendations().isEmpty()) {
            parts.add(plural(insight.getRecommendations().size(), "recommendation", "recommendations"));
        }
        if (!insight.getNotProblems().isEmpty()) {
            parts.add(plural(insight.getNotProblems().size(), "area that looks fine", "areas that look fine"));
        }

        return parts.isEmpty() ? "Analysis complete." : "Analysis complete. Found " + String.join(", ", parts) + ".";
    }

    private static String plural(long count, String one, String many) {
        return count + " " + (count == 1 ? one : many);
    }
}
