package com.purchasingpower.flowinsight.analysis;

import com.purchasingpower.flowinsight.model.metrics.PatternMetrics;
import com.purchasingpower.flowinsight.model.metrics.ProcessMetrics;
import com.purchasingpower.flowinsight.model.metrics.StepCategory;
import com.purchasingpower.flowinsight.model.metrics.StepMetrics;
import com.purchasingpower.flowinsight.model.process.ProcessData;
import com.purchasingpower.flowinsight.model.process.ProcessStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Computes facts about a process: shares of time and cost, dependency reach,
 * inferred step categories and aggregate patterns.
 *
 * <p>Facts only. Whether a number indicates a problem is left to the model.
 * Pure and stateless, safe to share between concurrent runs.
 */
@Slf4j
@Component
public class MetricsEngine {

    // Checked in insertion order, first match wins.
    private static final Map<StepCategory, List<Pattern>> CATEGORY_PATTERNS = new LinkedHashMap<>();

    static {
        CATEGORY_PATTERNS.put(StepCategory.REVIEW, compile(
                "\\breview", "\\bapproval\\b", "\\bapprove", "\\bcheck\\b", "\\bvalidat",
                "\\bverif", "\\binspect", "\\bqc\\b", "\\bqa\\b"));
        CATEGORY_PATTERNS.put(StepCategory.EXTERNAL, compile(
                "\\bclient\\b", "\\bcustomer\\b", "\\bvendor\\b", "\\bexternal\\b",
                "\\bfeedback\\b", "\\bhappy\\b"));
        CATEGORY_PATTERNS.put(StepCategory.HANDOFF, compile(
                "\\bsend\\b", "\\bsubmit\\b", "\\bshare\\b", "\\btransfer\\b", "\\bforward\\b",
                "\\bdeliver\\b", "\\bhandoff\\b", "\\bhand off\\b"));
        CATEGORY_PATTERNS.put(StepCategory.CREATIVE, compile(
                "\\bdesign\\b", "\\bcreate\\b", "\\bdevelop\\b", "\\bwrite\\b", "\\bbuild\\b",
                "\\bsolution\\b", "\\bwork on\\b", "\\bimplement\\b"));
        CATEGORY_PATTERNS.put(StepCategory.ADMINISTRATIVE, compile(
                "\\binvoice\\b", "\\bdocument\\b", "\\brecord\\b", "\\bfile\\b", "\\blog\\b",
                "\\breport\\b"));
        CATEGORY_PATTERNS.put(StepCategory.PROCESSING, compile(
                "\\bprocess\\b", "\\bprepare\\b", "\\banalyze\\b", "\\bcollect\\b", "\\bgather\\b",
                "\\btask\\b"));
    }

    public ProcessMetrics compute(ProcessData process) {
        List<ProcessStep> steps = process.getSteps() == null ? List.of() : process.getSteps();
        if (steps.isEmpty()) {
            log.warn("Process '{}' has no steps, returning zeroed metrics", process.getName());
            return ProcessMetrics.builder()
                    .processName(process.getName())
                    .patterns(PatternMetrics.empty())
                    .build();
        }

        double totalTime = process.getTotalTimeHours();
        double totalCost = process.getTotalCost();
        ProcessGraph graph = ProcessGraph.of(process);

        double maxTime = steps.stream().mapToDouble(ProcessStep::getAverageTimeHours).max().orElse(0);
        double maxCost = steps.stream().mapToDouble(ProcessStep::getCostPerInstance).max().orElse(0);
        double maxError = steps.stream().mapToDouble(ProcessStep::getErrorRatePct).max().orElse(0);

        List<StepMetrics> stepMetrics = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            ProcessStep step = steps.get(i);
            int downstream = graph.downstreamOf(step.getStepName()).size();
            stepMetrics.add(StepMetrics.builder()
                    .stepIndex(i)
                    .stepName(step.getStepName())
                    .timeHours(step.getAverageTimeHours())
                    .timePct(percent(step.getAverageTimeHours(), totalTime))
                    .cost(step.getCostPerInstance())
                    .costPct(percent(step.getCostPerInstance(), totalCost))
                    .errorRatePct(step.getErrorRatePct())
                    .resources(step.getResourcesNeeded())
                    .category(inferCategory(step.getStepName()))
                    .downstreamCount(downstream)
                    .upstreamCount(graph.upstreamOf(step.getStepName()).size())
                    .parallelCandidate(downstream == 0)
                    .longest(maxTime > 0 && step.getAverageTimeHours() == maxTime)
                    .mostExpensive(maxCost > 0 && step.getCostPerInstance() == maxCost)
                    .highestError(maxError > 0 && step.getErrorRatePct() == maxError)
                    .build());
        }

        PatternMetrics patterns = patterns(stepMetrics, graph);

        ProcessMetrics metrics = ProcessMetrics.builder()
                .processName(process.getName())
                .totalTimeHours(totalTime)
                .totalCost(totalCost)
                .stepCount(steps.size())
                .steps(stepMetrics)
                .patterns(patterns)
                .hasAllTimes(steps.stream().allMatch(s -> s.getAverageTimeHours() > 0))
                .hasAllCosts(steps.stream().allMatch(s -> s.getCostPerInstance() > 0))
                .hasErrorRates(steps.stream().anyMatch(s -> s.getErrorRatePct() > 0))
                .hasDependencies(steps.stream().anyMatch(ProcessStep::hasDependencies))
                .build();

        log.info("📊 Metrics for '{}': {} steps, {}h total, ${} total, {} reviews, {} external, chain={}",
                process.getName(), steps.size(), String.format("%.1f", totalTime),
                String.format("%.2f", totalCost), patterns.getReviewStepCount(),
                patterns.getExternalTouchpoints(), patterns.getSequentialChainLength());
        return metrics;
    }

    /**
     * Keyword-based category hint for a step name.
     */
    public StepCategory inferCategory(String stepName) {
        if (stepName == null) {
            return StepCategory.UNKNOWN;
        }
        String lower = stepName.toLowerCase(Locale.ROOT);
        for (Map.Entry<StepCategory, List<Pattern>> entry : CATEGORY_PATTERNS.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(lower).find()) {
                    return entry.getKey();
                }
            }
        }
        return StepCategory.UNKNOWN;
    }

    private PatternMetrics patterns(List<StepMetrics> steps, ProcessGraph graph) {
        int reviews = 0;
        int handoffs = 0;
        int external = 0;
        int creative = 0;
        int parallel = 0;
        double totalTime = 0;
        double reviewTime = 0;
        double creativeTime = 0;

        for (StepMetrics step : steps) {
            totalTime += step.getTimeHours();
            switch (step.getCategory()) {
                case REVIEW -> {
                    reviews++;
                    reviewTime += step.getTimeHours();
                }
                case HANDOFF -> handoffs++;
                case EXTERNAL -> external++;
                case CREATIVE -> {
                    creative++;
                    creativeTime += step.getTimeHours();
                }
                default -> {
                }
            }
            if (step.isParallelCandidate()) {
                parallel++;
            }
        }

        return PatternMetrics.builder()
                .reviewStepCount(reviews)
                .reviewPctOfSteps(percent(reviews, steps.size()))
                .timeInReviewsPct(percent(reviewTime, totalTime))
                .handoffCount(handoffs)
                .externalTouchpoints(external)
                .creativeStepCount(creative)
                .timeInCreativePct(percent(creativeTime, totalTime))
                .sequentialChainLength(graph.longestChain())
                .parallelOpportunities(parallel)
                .build();
    }

    private static double percent(double part, double total) {
        return total > 0 ? part / total * 100 : 0;
    }

    private static List<Pattern> compile(String... regexes) {
        List<Pattern> patterns = new ArrayList<>(regexes.length);
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex));
        }
        return List.copyOf(patterns);
    }
}
