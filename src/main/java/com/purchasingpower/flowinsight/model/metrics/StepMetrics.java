package com.purchasingpower.flowinsight.model.metrics;

import lombok.Builder;
import lombok.Value;

/**
 * Derived facts for a single step.
 */
@Value
@Builder
public class StepMetrics {
    int stepIndex;
    String stepName;
    double timeHours;
    double timePct;
    double cost;
    double costPct;
    double errorRatePct;
    int resources;
    StepCategory category;
    int downstreamCount;
    int upstreamCount;
    boolean longest;
    boolean mostExpensive;
    boolean highestError;
    boolean parallelCandidate;
}
