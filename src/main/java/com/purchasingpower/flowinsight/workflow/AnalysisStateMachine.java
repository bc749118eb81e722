package com.purchasingpower.flowinsight.workflow;

import com.purchasingpower.flowinsight.workflow.state.AnalysisEvent;
import com.purchasingpower.flowinsight.workflow.state.AnalysisPhase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static com.purchasingpower.flowinsight.workflow.state.AnalysisEvent.*;
import static com.purchasingpower.flowinsight.workflow.state.AnalysisPhase.*;

/**
 * Transition table of an analysis run.
 *
 * <pre>
 * CHECK_CONTEXT ──sufficient──▶ INITIAL_ANALYSIS ──issues──▶ INVESTIGATE ◀──┐
 *      │ insufficient                 │ skip / failed          │ tools     │ executed
 *      ▼                              ▼                        ▼           │
 * REQUEST_CLARIFICATION          FINALIZE ◀──done────────── TOOL_EXEC ─────┘
 *      │ questions ready              │
 *      ▼                              ▼
 * AWAITING_INPUT ──responded──▶ CHECK_CONTEXT        DONE
 *      └──proceed without input──▶ INITIAL_ANALYSIS
 * </pre>
 *
 * <p>{@link AnalysisEvent#FAILURE} moves every non-terminal phase to FINALIZE,
 * and FINALIZE itself to DONE. The table is built once and never modified.
 */
public final class AnalysisStateMachine {

    private static final Map<AnalysisPhase, Map<AnalysisEvent, AnalysisPhase>> TRANSITIONS =
            new EnumMap<>(AnalysisPhase.class);

    static {
        on(CHECK_CONTEXT, CONTEXT_SUFFICIENT, INITIAL_ANALYSIS);
        on(CHECK_CONTEXT, CONTEXT_INSUFFICIENT, REQUEST_CLARIFICATION);

        on(REQUEST_CLARIFICATION, QUESTIONS_READY, AWAITING_INPUT);

        on(AWAITING_INPUT, USER_RESPONDED, CHECK_CONTEXT);
        on(AWAITING_INPUT, PROCEED_WITHOUT_INPUT, INITIAL_ANALYSIS);
        on(AWAITING_INPUT, STILL_WAITING, AWAITING_INPUT);

        on(INITIAL_ANALYSIS, ISSUES_FOUND, INVESTIGATE);
        on(INITIAL_ANALYSIS, SKIP_INVESTIGATION, FINALIZE);
        on(INITIAL_ANALYSIS, ANALYSIS_FAILED, FINALIZE);

        on(INVESTIGATE, TOOLS_REQUESTED, TOOL_EXEC);
        on(INVESTIGATE, INVESTIGATION_DONE, FINALIZE);

        on(TOOL_EXEC, TOOLS_EXECUTED, INVESTIGATE);

        on(FINALIZE, FINALIZED, DONE);

        for (AnalysisPhase phase : AnalysisPhase.values()) {
            if (phase == FINALIZE) {
                on(phase, FAILURE, DONE);
            } else if (!phase.isTerminal()) {
                on(phase, FAILURE, FINALIZE);
            }
        }
    }

    private AnalysisStateMachine() {
    }

    /**
     * Next phase for {@code event} in {@code phase}.
     *
     * @throws IllegalStateException if the event is not valid in that phase
     */
    public static AnalysisPhase transition(AnalysisPhase phase, AnalysisEvent event) {
        AnalysisPhase next = TRANSITIONS.getOrDefault(phase, Map.of()).get(event);
        if (next == null) {
            throw new IllegalStateException("No transition from " + phase + " on " + event);
        }
        return next;
    }

    public static Set<AnalysisEvent> allowedEvents(AnalysisPhase phase) {
        return Collections.unmodifiableSet(TRANSITIONS.getOrDefault(phase, Map.of()).keySet());
    }

    private static void on(AnalysisPhase from, AnalysisEvent event, AnalysisPhase to) {
        TRANSITIONS.computeIfAbsent(from, p -> new EnumMap<>(AnalysisEvent.class)).put(event, to);
    }
}
