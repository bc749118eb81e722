package com.purchasingpower.flowinsight.workflow.state;

/**
 * Outcome of a stage, fed to the state machine to pick the next phase.
 */
public enum AnalysisEvent {
    CONTEXT_SUFFICIENT,
    CONTEXT_INSUFFICIENT,
    QUESTIONS_READY,
    USER_RESPONDED,
    PROCEED_WITHOUT_INPUT,
    STILL_WAITING,
    ISSUES_FOUND,
    SKIP_INVESTIGATION,
    ANALYSIS_FAILED,
    TOOLS_REQUESTED,
    INVESTIGATION_DONE,
    TOOLS_EXECUTED,
    FINALIZED,
    /** A stage failed with an exception; the run is finalized with an error. */
    FAILURE
}
