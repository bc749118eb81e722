package com.purchasingpower.flowinsight.workflow;

import com.purchasingpower.flowinsight.config.AnalysisConfig;
import com.purchasingpower.flowinsight.model.insight.AnalysisInsight;
import com.purchasingpower.flowinsight.workflow.state.AgentState;
import com.purchasingpower.flowinsight.workflow.state.AnalysisEvent;
import com.purchasingpower.flowinsight.workflow.state.AnalysisPhase;
import com.purchasingpower.flowinsight.workflow.state.ChatMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads the state a stage produced and names the event that happened.
 * Side-effect free.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisRouter {

    private final AnalysisConfig config;

    public AnalysisEvent route(AnalysisPhase completed, AgentState state) {
        return switch (completed) {
            case CHECK_CONTEXT -> state.isNeedsClarification()
                    ? AnalysisEvent.CONTEXT_INSUFFICIENT
                    : AnalysisEvent.CONTEXT_SUFFICIENT;
            case REQUEST_CLARIFICATION -> AnalysisEvent.QUESTIONS_READY;
            case AWAITING_INPUT -> afterClarification(state);
            case INITIAL_ANALYSIS -> afterInitialAnalysis(state);
            case INVESTIGATE -> afterInvestigation(state);
            case TOOL_EXEC -> AnalysisEvent.TOOLS_EXECUTED;
            case FINALIZE -> AnalysisEvent.FINALIZED;
            case DONE -> throw new IllegalStateException("Nothing to route after " + completed);
        };
    }

    private AnalysisEvent afterClarification(AgentState state) {
        if (state.getUserResponse() != null && !state.getUserResponse().isBlank()) {
            log.debug("User response received, re-checking context");
            return AnalysisEvent.USER_RESPONDED;
        }
        if (state.getConfidenceScore() >= config.getPostInteractionThreshold()) {
            log.debug("Proceeding with available data");
            return AnalysisEvent.PROCEED_WITHOUT_INPUT;
        }
        log.debug("Still need more context");
        return AnalysisEvent.STILL_WAITING;
    }

    private AnalysisEvent afterInitialAnalysis(AgentState state) {
        if (state.hasError()) {
            return AnalysisEvent.ANALYSIS_FAILED;
        }
        if (state.effectiveMaxCycles(config.getMaxCycles()) == 0) {
            log.debug("Routing: investigation disabled (max cycles = 0)");
            return AnalysisEvent.SKIP_INVESTIGATION;
        }
        AnalysisInsight insight = state.getInsight();
        if (insight == null || !insight.hasIssues()) {
            log.debug("Routing: no issues found, skipping investigation");
            return AnalysisEvent.SKIP_INVESTIGATION;
        }
        log.debug("Routing: {} issue(s) found, proceeding to investigation", insight.getIssues().size());
        return AnalysisEvent.ISSUES_FOUND;
    }

    /**
     * The investigate stage counts a cycle each time the model asks for tools,
     * so a count equal to the limit still gets its tool round.
     */
    private AnalysisEvent afterInvestigation(AgentState state) {
        boolean hasToolCalls = state.lastMessage().map(ChatMessage::hasToolCalls).orElse(false);
        int maxCycles = state.effectiveMaxCycles(config.getMaxCycles());
        if (hasToolCalls && state.getCycleCount() <= maxCycles) {
            log.debug("Routing to tools (cycle {}/{})", state.getCycleCount(), maxCycles);
            return AnalysisEvent.TOOLS_REQUESTED;
        }
        log.debug("Routing to finalize (cycle {}, tool calls={})", state.getCycleCount(), hasToolCalls);
        return AnalysisEvent.INVESTIGATION_DONE;
    }
}
