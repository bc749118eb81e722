package com.purchasingpower.flowinsight.model.metrics;

import lombok.Builder;
import lombok.Value;

/**
 * Process-wide counts and ratios.
 */
@Value
@Builder
public class PatternMetrics {
    int reviewStepCount;
    double reviewPctOfSteps;
    double timeInReviewsPct;
    int externalTouchpoints;
    int creativeStepCount;
    double timeInCreativePct;
    int handoffCount;
    /** Length of the longest dependency chain, counted in steps. */
    int sequentialChainLength;
    /** Steps nothing else depends on. */
    int parallelOpportunities;

    public static PatternMetrics empty() {
        return PatternMetrics.builder().build();
    }
}
