package com.purchasingpower.flowinsight.analysis;

import com.purchasingpower.flowinsight.model.metrics.PatternMetrics;
import com.purchasingpower.flowinsight.model.metrics.ProcessMetrics;
import com.purchasingpower.flowinsight.model.metrics.StepMetrics;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@link ProcessMetrics} as the markdown fact sheet given to the model.
 */
public final class MetricsFormatter {

    private MetricsFormatter() {
    }

    public static String format(ProcessMetrics metrics) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Process: ").append(metrics.getProcessName()).append("\n\n");

        sb.append("## Summary\n");
        sb.append("- Total steps: ").append(metrics.getStepCount()).append('\n');
        sb.append(String.format("- Total time: %.1f hours%n", metrics.getTotalTimeHours()));
        sb.append(String.format("- Total cost: $%.2f%n%n", metrics.getTotalCost()));

        sb.append("## Step Details\n\n");
        sb.append("| # | Step | Time | Time% | Cost | Cost% | Errors | Resources | Type | Downstream |\n");
        sb.append("|---|------|------|-------|------|-------|--------|-----------|------|------------|\n");
        for (StepMetrics s : metrics.getSteps()) {
            sb.append(String.format("| %d | %s%s | %.1fh | %.0f%% | $%.0f | %.0f%% | %.0f%% | %d | %s | %d |%n",
                    s.getStepIndex() + 1, s.getStepName(), flags(s),
                    s.getTimeHours(), s.getTimePct(), s.getCost(), s.getCostPct(),
                    s.getErrorRatePct(), s.getResources(), s.getCategory().toValue(),
                    s.getDownstreamCount()));
        }

        PatternMetrics p = metrics.getPatterns();
        sb.append("\n## Patterns Detected\n");
        sb.append(String.format("- Review steps: %d (%.0f%% of steps)%n", p.getReviewStepCount(), p.getReviewPctOfSteps()));
        sb.append(String.format("- Time in reviews: %.0f%%%n", p.getTimeInReviewsPct()));
        sb.append("- External touchpoints: ").append(p.getExternalTouchpoints()).append('\n');
        sb.append(String.format("- Creative work steps: %d (%.0f%% of time)%n", p.getCreativeStepCount(), p.getTimeInCreativePct()));
        sb.append("- Handoffs: ").append(p.getHandoffCount()).append('\n');
        sb.append("- Longest sequential chain: ").append(p.getSequentialChainLength()).append(" steps\n");
        sb.append("- Parallel opportunities: ").append(p.getParallelOpportunities()).append(" steps\n\n");

        sb.append("## Data Quality\n");
        sb.append("- Has all timing data: ").append(yesNo(metrics.isHasAllTimes())).append('\n');
        sb.append("- Has all cost data: ").append(yesNo(metrics.isHasAllCosts())).append('\n');
        sb.append("- Has error rates: ").append(yesNo(metrics.isHasErrorRates())).append('\n');
        sb.append("- Has dependency info: ").append(yesNo(metrics.isHasDependencies())).append('\n');
        return sb.toString();
    }

    private static String flags(StepMetrics step) {
        List<String> flags = new ArrayList<>();
        if (step.isLongest()) {
            flags.add("longest");
        }
        if (step.isMostExpensive()) {
            flags.add("costly");
        }
        if (step.isHighestError()) {
            flags.add("error-prone");
        }
        return flags.isEmpty() ? "" : " (" + String.join(", ", flags) + ")";
    }

    private static String yesNo(boolean value) {
        return value ? "Yes" : "No";
    }
}
