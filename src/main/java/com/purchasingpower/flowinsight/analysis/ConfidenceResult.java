package com.purchasingpower.flowinsight.analysis;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Completeness score of the input, with the gaps that lowered it.
 */
@Value
@Builder
public class ConfidenceResult {

    private static final List<String> CRITICAL_KEYWORDS =
            List.of("time", "cost", "error rate", "no process steps", "no constraints");

    double score;
    List<String> dataGaps;
    List<String> suggestionsForImprovement;
    /** Sub-scores keyed by component: process, constraints, profile. */
    Map<String, Double> breakdown;
    double threshold;

    public boolean isSufficient() {
        return isSufficient(threshold);
    }

    public boolean isSufficient(double minimum) {
        return score >= minimum;
    }

    public String level() {
        if (score >= 0.8) {
            return "high";
        }
        if (score >= 0.6) {
            return "moderate";
        }
        if (score >= 0.4) {
            return "low";
        }
        return "very low";
    }

    /**
     * Gaps reordered so that missing core data (time, cost, error rate,
     * steps, constraints) comes first. Order within each group is kept.
     */
    public List<String> criticalGaps() {
        List<String> critical = new ArrayList<>();
        List<String> other = new ArrayList<>();
        for (String gap : dataGaps) {
            String lower = gap.toLowerCase(Locale.ROOT);
            if (CRITICAL_KEYWORDS.stream().anyMatch(lower::contains)) {
                critical.add(gap);
            } else {
                other.add(gap);
            }
        }
        critical.addAll(other);
        return critical;
    }

    public long criticalGapCount() {
        return dataGaps.stream()
                .map(g -> g.toLowerCase(Locale.ROOT))
                .filter(g -> CRITICAL_KEYWORDS.stream().anyMatch(g::contains))
                .count();
    }
}
