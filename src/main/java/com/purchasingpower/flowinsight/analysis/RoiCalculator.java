package com.purchasingpower.flowinsight.analysis;

import com.purchasingpower.flowinsight.model.process.ProcessData;
import com.purchasingpower.flowinsight.model.process.ProcessStep;
import com.purchasingpower.flowinsight.model.roi.RoiEstimate;
import com.purchasingpower.flowinsight.model.roi.SuggestionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Three-point savings estimate for applying an improvement to one step.
 *
 * <p>Savings per execution are the hours saved at the step's hourly rate plus
 * the avoided rework cost, where one error is assumed to cost twice the step.
 * Scenarios scale the base improvement factors by 0.5, 1.0 and 1.3, each
 * reduction capped at 100%.
 */
@Slf4j
@Component
public class RoiCalculator {

    public static final int DEFAULT_EXECUTIONS_PER_YEAR = 1000;
    public static final double DEFAULT_CONFIDENCE = 0.7;
    static final double DEFAULT_HOURLY_RATE = 75.0;

    private static final double PESSIMISTIC = 0.5;
    private static final double LIKELY = 1.0;
    private static final double OPTIMISTIC = 1.3;

    private static final Map<SuggestionType, Factors> FACTORS = new EnumMap<>(SuggestionType.class);

    static {
        FACTORS.put(SuggestionType.AUTOMATION, new Factors(0.70, 0.80, 0.3));
        FACTORS.put(SuggestionType.PROCESS_REDESIGN, new Factors(0.40, 0.30, 0.7));
        FACTORS.put(SuggestionType.RESOURCE_REALLOCATION, new Factors(0.25, 0.15, 0.9));
        FACTORS.put(SuggestionType.TRAINING, new Factors(0.15, 0.40, 0.95));
        FACTORS.put(SuggestionType.TOOL_UPGRADE, new Factors(0.35, 0.25, 0.6));
        FACTORS.put(SuggestionType.ELIMINATION, new Factors(1.0, 1.0, 0.0));
        FACTORS.put(SuggestionType.PARALLELIZATION, new Factors(0.50, 0.0, 1.1));
    }

    /**
     * Per-type improvement factors.
     *
     * @param timeReduction  share of step time removed
     * @param errorReduction share of errors removed
     * @param costMultiplier ongoing cost relative to today
     */
    record Factors(double timeReduction, double errorReduction, double costMultiplier) {
    }

    public RoiEstimate estimate(SuggestionType type, String stepName, ProcessData process) {
        return estimate(type, stepName, process, 0.0, DEFAULT_EXECUTIONS_PER_YEAR, DEFAULT_CONFIDENCE);
    }

    /**
     * @param type               improvement kind; null falls back to process redesign
     * @param stepName           step the improvement applies to, matched case-insensitively
     * @param implementationCost one-off cost used for the payback period
     * @return a zero estimate with confidence 0 when the step does not exist
     */
    public RoiEstimate estimate(SuggestionType type,
                                String stepName,
                                ProcessData process,
                                double implementationCost,
                                int executionsPerYear,
                                double baseConfidence) {
        Optional<ProcessStep> step = process == null ? Optional.empty() : process.getStep(stepName);
        if (step.isEmpty()) {
            log.warn("ROI requested for unknown step '{}'", stepName);
            return RoiEstimate.builder()
                    .assumptions(List.of("Unable to calculate ROI - step not found"))
                    .confidence(0.0)
                    .build();
        }

        SuggestionType effectiveType = type == null ? SuggestionType.PROCESS_REDESIGN : type;
        Factors factors = FACTORS.get(effectiveType);
        ProcessStep target = step.get();

        double pessimistic = annualSavings(target, factors, PESSIMISTIC, executionsPerYear);
        double likely = annualSavings(target, factors, LIKELY, executionsPerYear);
        double optimistic = annualSavings(target, factors, OPTIMISTIC, executionsPerYear);

        Double payback = null;
        if (likely > 0 && implementationCost > 0) {
            payback = implementationCost / likely * 12;
        }

        log.debug("ROI for {} on '{}': pessimistic=${}, likely=${}, optimistic=${}",
                effectiveType.toValue(), target.getStepName(),
                Math.round(pessimistic), Math.round(likely), Math.round(optimistic));

        return RoiEstimate.builder()
                .pessimistic(pessimistic)
                .likely(likely)
                .optimistic(optimistic)
                .assumptions(assumptions(target, factors, effectiveType, implementationCost, executionsPerYear))
                .confidence(baseConfidence)
                .paybackMonths(payback)
                .build();
    }

    private static double annualSavings(ProcessStep step, Factors factors, double multiplier, int executionsPerYear) {
        double timeReduction = Math.min(factors.timeReduction() * multiplier, 1.0);
        double errorReduction = Math.min(factors.errorReduction() * multiplier, 1.0);

        double hours = step.getAverageTimeHours();
        double cost = step.getCostPerInstance();
        double hourlyRate = hours > 0 ? cost / hours : DEFAULT_HOURLY_RATE;

        double timeSavings = hours * timeReduction * hourlyRate;
        double errorCost = cost * 2 * (step.getErrorRatePct() / 100);
        double errorSavings = errorCost * errorReduction;

        return (timeSavings + errorSavings) * executionsPerYear;
    }

    private static List<String> assumptions(ProcessStep step,
                                            Factors factors,
                                            SuggestionType type,
                                            double implementationCost,
                                            int executionsPerYear) {
        List<String> assumptions = new ArrayList<>();
        assumptions.add(String.format("Process executes %,d times per year", executionsPerYear));
        assumptions.add(String.format("Current step cost: $%.2f per execution", step.getCostPerInstance()));
        assumptions.add(String.format("Current step time: %.1f hours", step.getAverageTimeHours()));
        if (factors.timeReduction() > 0) {
            assumptions.add(String.format("Expected time reduction: %.0f%% (based on %s)",
                    factors.timeReduction() * 100, type.toValue()));
        }
        if (factors.errorReduction() > 0 && step.getErrorRatePct() > 0) {
            assumptions.add(String.format("Expected error reduction: %.0f%%", factors.errorReduction() * 100));
            assumptions.add("Error rework cost estimated at 2x step cost");
        }
        if (factors.costMultiplier() != 1.0) {
            assumptions.add(String.format("Ongoing step cost after change: %.0f%% of current",
                    factors.costMultiplier() * 100));
        }
        if (implementationCost > 0) {
            assumptions.add(String.format("Implementation cost: $%,.0f", implementationCost));
        }
        return assumptions;
    }
}
