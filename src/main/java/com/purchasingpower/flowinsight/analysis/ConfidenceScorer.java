package com.purchasingpower.flowinsight.analysis;

import com.purchasingpower.flowinsight.config.AnalysisConfig;
import com.purchasingpower.flowinsight.exception.DataInvariantException;
import com.purchasingpower.flowinsight.model.context.BusinessProfile;
import com.purchasingpower.flowinsight.model.context.Constraints;
import com.purchasingpower.flowinsight.model.process.ProcessData;
import com.purchasingpower.flowinsight.model.process.ProcessStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores how complete the analysis input is, from 0 to 1.
 *
 * <p>The score is a weighted sum of three sub-scores:
 * <ul>
 *   <li>process data, weight {@value #WEIGHT_PROCESS}</li>
 *   <li>constraints, weight {@value #WEIGHT_CONSTRAINTS}</li>
 *   <li>business profile, weight {@value #WEIGHT_PROFILE}</li>
 * </ul>
 * Every deduction records a human-readable data gap. Deterministic, no model calls.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfidenceScorer {

    public static final double WEIGHT_PROCESS = 0.60;
    public static final double WEIGHT_CONSTRAINTS = 0.25;
    public static final double WEIGHT_PROFILE = 0.15;

    static {
        checkWeights(WEIGHT_PROCESS, WEIGHT_CONSTRAINTS, WEIGHT_PROFILE);
    }

    private final AnalysisConfig analysisConfig;

    /**
     * @throws DataInvariantException if the weights do not sum to 1.0
     */
    static void checkWeights(double... weights) {
        double sum = 0;
        for (double weight : weights) {
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > 1e-9) {
            throw new DataInvariantException("confidenceWeights",
                    "confidence weights must sum to 1.0, got " + sum);
        }
    }

    public ConfidenceResult score(ProcessData process, Constraints constraints, BusinessProfile profile) {
        List<String> gaps = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();

        double processScore = scoreProcess(process, gaps, suggestions);
        double constraintsScore = scoreConstraints(constraints, gaps, suggestions);
        double profileScore = scoreProfile(profile, gaps, suggestions);

        double total = processScore * WEIGHT_PROCESS
                + constraintsScore * WEIGHT_CONSTRAINTS
                + profileScore * WEIGHT_PROFILE;
        total = Math.max(0.0, Math.min(1.0, total));

        Map<String, Double> breakdown = new LinkedHashMap<>();
        breakdown.put("process", processScore);
        breakdown.put("constraints", constraintsScore);
        breakdown.put("profile", profileScore);

        ConfidenceResult result = ConfidenceResult.builder()
                .score(total)
                .dataGaps(List.copyOf(gaps))
                .suggestionsForImprovement(List.copyOf(suggestions))
                .breakdown(breakdown)
                .threshold(analysisConfig.getConfidenceThreshold())
                .build();

        log.info("Confidence for '{}': {}% ({}), {} gaps",
                process.getName(), String.format("%.1f", total * 100), result.level(), gaps.size());
        return result;
    }

    private double scoreProcess(ProcessData process, List<String> gaps, List<String> suggestions) {
        List<ProcessStep> steps = process.getSteps() == null ? List.of() : process.getSteps();
        if (steps.isEmpty()) {
            gaps.add("No process steps defined");
            suggestions.add("Add at least one process step");
            return 0.0;
        }

        boolean missingTime = false;
        boolean missingCost = false;
        double sum = 0;
        for (ProcessStep step : steps) {
            double stepScore = 1.0;
            if (step.getAverageTimeHours() == 0) {
                stepScore -= 0.30;
                gaps.add("time for '" + step.getStepName() + "'");
                missingTime = true;
            }
            if (step.getCostPerInstance() == 0) {
                stepScore -= 0.20;
                gaps.add("cost for '" + step.getStepName() + "'");
                missingCost = true;
            }
            if (step.getErrorRatePct() == 0) {
                stepScore -= 0.15;
                gaps.add("error rate for '" + step.getStepName() + "'");
            }
            sum += Math.max(stepScore, 0.0);
        }
        double average = sum / steps.size();

        if (steps.size() > 1 && steps.stream().noneMatch(ProcessStep::hasDependencies)) {
            gaps.add("No dependencies defined between steps");
            suggestions.add("Define step dependencies to enable cascade analysis");
            average *= 0.9;
        }
        if (missingTime) {
            suggestions.add("Provide the average time for every step");
        }
        if (missingCost) {
            suggestions.add("Provide a cost per instance for every step");
        }
        if (process.getDescription() == null || process.getDescription().isBlank()) {
            suggestions.add("Add a process description for better context");
        }
        if (steps.size() >= 5) {
            average = Math.min(average + 0.05, 1.0);
        }
        return average;
    }

    private double scoreConstraints(Constraints constraints, List<String> gaps, List<String> suggestions) {
        if (constraints == null) {
            gaps.add("No constraints provided");
            suggestions.add("Define business constraints (budget, hiring, timeline)");
            return 0.3;
        }
        double score = 0.5;
        if (constraints.hasBudgetLimit()) {
            score += 0.15;
        } else {
            suggestions.add("Consider adding a budget limit for better filtering");
        }
        if (constraints.getMaxImplementationWeeks() != null) {
            score += 0.15;
        }
        if (constraints.hasCustomConstraints()) {
            score += 0.1;
        }
        if (constraints.isCannotHire() || constraints.isMustMaintainAuditTrail()) {
            score += 0.1;
        }
        return Math.min(score, 1.0);
    }

    private double scoreProfile(BusinessProfile profile, List<String> gaps, List<String> suggestions) {
        if (profile == null) {
            gaps.add("No business profile provided");
            suggestions.add("Add business context (industry, company size, regulatory environment)");
            return 0.2;
        }
        double score = 0.4;
        if (profile.getIndustry() != null || profile.getCompanySize() != null) {
            score += 0.2;
        }
        if (notEmpty(profile.getPreviousImprovements())) {
            score += 0.1;
        }
        if (notEmpty(profile.getPreferredFrameworks())) {
            score += 0.1;
        }
        if (notEmpty(profile.getRejectedApproaches())) {
            score += 0.15;
        }
        return Math.min(score, 1.0);
    }

    private static boolean notEmpty(List<String> values) {
        return values != null && !values.isEmpty();
    }
}
