package com.purchasingpower.flowinsight.agent;

import com.purchasingpower.flowinsight.model.context.Constraints;
import com.purchasingpower.flowinsight.model.insight.AnalysisInsight;
import com.purchasingpower.flowinsight.model.metrics.ProcessMetrics;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only view of the run that tools query.
 *
 * <p>Built from the agent state before each tool round. Tools must not
 * modify anything reachable from here.
 */
@Value
@Builder
public class InvestigationContext {
    ProcessMetrics metrics;
    AnalysisInsight insight;
    /** May be null when the user gave no constraints. */
    Constraints constraints;
}
