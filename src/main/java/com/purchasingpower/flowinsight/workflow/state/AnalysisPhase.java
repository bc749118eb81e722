package com.purchasingpower.flowinsight.workflow.state;

/**
 * Where an analysis run currently stands.
 */
public enum AnalysisPhase {
    CHECK_CONTEXT,
    REQUEST_CLARIFICATION,
    /** Suspended until the user answers the clarification questions. */
    AWAITING_INPUT,
    INITIAL_ANALYSIS,
    INVESTIGATE,
    TOOL_EXEC,
    FINALIZE,
    DONE;

    public boolean isTerminal() {
        return this == DONE;
    }

    /**
     * Whether the orchestrator stops driving the run in this phase.
     */
    public boolean isSuspended() {
        return this == AWAITING_INPUT || this == DONE;
    }
}
