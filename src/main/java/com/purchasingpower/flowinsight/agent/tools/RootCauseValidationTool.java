package com.purchasingpower.flowinsight.agent.tools;

import com.purchasingpower.flowinsight.agent.InvestigationContext;
import com.purchasingpower.flowinsight.agent.InvestigationTool;
import com.purchasingpower.flowinsight.agent.ToolResult;
import com.purchasingpower.flowinsight.model.context.Constraints;
import com.purchasingpower.flowinsight.model.insight.Issue;
import com.purchasingpower.flowinsight.model.llm.ToolDefinition;
import com.purchasingpower.flowinsight.model.metrics.PatternMetrics;
import com.purchasingpower.flowinsight.model.metrics.ProcessMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.purchasingpower.flowinsight.agent.tools.DependencyImpactTool.text;

/**
 * Lays the data next to a root-cause hypothesis: the affected steps of the
 * named issue, or process-wide patterns when the issue is unknown.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class RootCauseValidationTool implements InvestigationTool {

    @Override
    public String getName() {
        return "validate_root_cause";
    }

    @Override
    public String getDescription() {
        return "Test whether a root cause hypothesis is consistent with the process data. "
                + "Use this before committing to an explanation for a pattern or issue.";
    }

    @Override
    public List<ToolDefinition.Parameter> getParameters() {
        return List.of(
                new ToolDefinition.Parameter("issue_title", "The issue you are investigating (from your initial analysis)."),
                new ToolDefinition.Parameter("hypothesis", "Your proposed explanation for why this issue exists."));
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, InvestigationContext context) {
        String issueTitle = text(arguments, "issue_title");
        String hypothesis = text(arguments, "hypothesis");
        log.info("🔧 Tool: {} - issue={}", getName(), issueTitle);

        ProcessMetrics metrics = context.getMetrics();
        List<String> affected = affectedSteps(issueTitle, context);

        List<String> lines = new ArrayList<>();
        lines.add("Hypothesis: " + hypothesis);
        lines.add("Issue: " + issueTitle);
        lines.add("");
        lines.add("Affected step data:");

        if (!affected.isEmpty()) {
            for (String stepName : affected) {
                metrics.findStep(stepName).ifPresentOrElse(
                        s -> lines.add(String.format("  %s: %.1fh, %.0f%% errors, type=%s, downstream=%d",
                                s.getStepName(), s.getTimeHours(), s.getErrorRatePct(),
                                s.getCategory().toValue(), s.getDownstreamCount())),
                        () -> lines.add("  " + stepName + ": not found in process data"));
            }
        } else {
            PatternMetrics patterns = metrics.getPatterns();
            lines.add("  (no affected steps found, showing process-wide patterns)");
            lines.add(String.format("  Review steps: %d (%.0f%%)",
                    patterns.getReviewStepCount(), patterns.getReviewPctOfSteps()));
            lines.add("  Longest chain: " + patterns.getSequentialChainLength());
            lines.add("  External touchpoints: " + patterns.getExternalTouchpoints());
            lines.add("  Handoffs: " + patterns.getHandoffCount());
        }

        Constraints constraints = context.getConstraints();
        if (constraints != null) {
            lines.add("");
            lines.add("Active constraints (may be relevant):");
            if (constraints.isCannotHire()) {
                lines.add("  - Cannot hire new staff");
            }
            if (constraints.isMustMaintainAuditTrail()) {
                lines.add("  - Must maintain audit trail");
            }
            if (constraints.hasBudgetLimit()) {
                lines.add(String.format("  - Budget limit: $%,.0f", constraints.getBudgetLimit()));
            }
        }
        return ToolResult.success(String.join("\n", lines));
    }

    private static List<String> affectedSteps(String issueTitle, InvestigationContext context) {
        if (context.getInsight() == null || context.getInsight().getIssues() == null) {
            return List.of();
        }
        for (Issue issue : context.getInsight().getIssues()) {
            if (issue.getTitle() != null && issue.getTitle().equalsIgnoreCase(issueTitle.trim())) {
                return issue.getAffectedSteps() == null ? List.of() : issue.getAffectedSteps();
            }
        }
        return List.of();
    }
}
