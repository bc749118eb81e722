package com.purchasingpower.flowinsight.workflow;

import com.purchasingpower.flowinsight.workflow.state.AgentState;
import com.purchasingpower.flowinsight.workflow.state.AnalysisPhase;

/**
 * Work performed while a run is in one phase.
 * Implementations are detected by Spring and looked up by {@link #phase()}.
 */
public interface AnalysisStage {

    AnalysisPhase phase();

    /**
     * Runs the stage and returns the resulting state. Must not modify {@code state}.
     * The orchestrator applies the phase change.
     *
     * @throws RuntimeException if the stage cannot complete; the run is then finalized with an error
     */
    AgentState execute(AgentState state);
}
