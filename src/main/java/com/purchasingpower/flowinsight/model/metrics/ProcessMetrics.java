package com.purchasingpower.flowinsight.model.metrics;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Everything the metrics engine knows about a process. Immutable snapshot
 * shared by the prompts, the investigation tools and the enricher.
 */
@Value
@Builder
public class ProcessMetrics {

    String processName;
    double totalTimeHours;
    double totalCost;
    int stepCount;

    @Singular
    List<StepMetrics> steps;

    PatternMetrics patterns;

    boolean hasAllTimes;
    boolean hasAllCosts;
    boolean hasErrorRates;
    boolean hasDependencies;

    public Optional<StepMetrics> findStep(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim();
        return steps.stream()
                .filter(s -> s.getStepName().equalsIgnoreCase(wanted))
                .findFirst();
    }
}
