package com.purchasingpower.flowinsight.agent.tools;

import com.purchasingpower.flowinsight.agent.InvestigationContext;
import com.purchasingpower.flowinsight.agent.InvestigationTool;
import com.purchasingpower.flowinsight.agent.ToolResult;
import com.purchasingpower.flowinsight.model.llm.ToolDefinition;
import com.purchasingpower.flowinsight.model.metrics.StepMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reports a step's metrics and how much of the process waits on it.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class DependencyImpactTool implements InvestigationTool {

    @Override
    public String getName() {
        return "analyze_dependency_impact";
    }

    @Override
    public String getDescription() {
        return "Analyze how a specific process step impacts downstream work. Use this when a step "
                + "appears problematic and you need to understand the cascade effect on everything that depends on it.";
    }

    @Override
    public List<ToolDefinition.Parameter> getParameters() {
        return List.of(
                new ToolDefinition.Parameter("step_name", "The exact name of the step to investigate."),
                new ToolDefinition.Parameter("question", "The specific aspect of dependency impact to analyze."));
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, InvestigationContext context) {
        String stepName = text(arguments, "step_name");
        String question = text(arguments, "question");
        log.info("🔧 Tool: {} - step={}", getName(), stepName);

        Optional<StepMetrics> found = context.getMetrics().findStep(stepName);
        if (found.isEmpty()) {
            return ToolResult.failure("Step '" + stepName + "' not found in process data.");
        }

        StepMetrics step = found.get();
        List<String> lines = new ArrayList<>();
        lines.add("Step '" + step.getStepName() + "':");
        lines.add(String.format("  Time: %.1fh (%.0f%% of total)", step.getTimeHours(), step.getTimePct()));
        lines.add(String.format("  Cost: $%.0f (%.0f%% of total)", step.getCost(), step.getCostPct()));
        lines.add(String.format("  Error rate: %.0f%%", step.getErrorRatePct()));
        lines.add("  Resources: " + step.getResources());
        lines.add("  Type: " + step.getCategory().toValue());
        lines.add("  Downstream steps blocked by this: " + step.getDownstreamCount());
        lines.add("  Upstream dependencies: " + step.getUpstreamCount());
        lines.add("  Question being investigated: " + question);
        if (step.isLongest()) {
            lines.add("  Flag: longest step in process");
        }
        if (step.isMostExpensive()) {
            lines.add("  Flag: most expensive step in process");
        }
        if (step.isHighestError()) {
            lines.add("  Flag: highest error rate in process");
        }
        return ToolResult.success(String.join("\n", lines));
    }

    static String text(Map<String, Object> arguments, String key) {
        Object value = arguments == null ? null : arguments.get(key);
        return value == null ? "" : value.toString();
    }
}
