package com.purchasingpower.flowinsight.agent.tools;

import com.purchasingpower.flowinsight.agent.InvestigationContext;
import com.purchasingpower.flowinsight.agent.InvestigationTool;
import com.purchasingpower.flowinsight.agent.ToolResult;
import com.purchasingpower.flowinsight.model.context.Constraints;
import com.purchasingpower.flowinsight.model.llm.ToolDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.purchasingpower.flowinsight.agent.tools.DependencyImpactTool.text;

/**
 * Lists the constraints a proposed recommendation has to respect.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class ConstraintFeasibilityTool implements InvestigationTool {

    @Override
    public String getName() {
        return "check_constraint_feasibility";
    }

    @Override
    public String getDescription() {
        return "Verify whether a recommendation would conflict with user constraints. "
                + "Use this before finalizing any significant recommendation.";
    }

    @Override
    public List<ToolDefinition.Parameter> getParameters() {
        return List.of(
                new ToolDefinition.Parameter("recommendation_concept", "The recommendation you are considering."),
                new ToolDefinition.Parameter("concern", "Which constraint or requirement you are checking against."));
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, InvestigationContext context) {
        String concept = text(arguments, "recommendation_concept");
        String concern = text(arguments, "concern");
        log.info("🔧 Tool: {} - rec={}", getName(), concept.length() > 50 ? concept.substring(0, 50) : concept);

        Constraints constraints = context.getConstraints();
        if (constraints == null) {
            return ToolResult.success("No constraints defined. Recommendation appears feasible.");
        }

        List<String> active = new ArrayList<>();
        if (constraints.hasBudgetLimit()) {
            active.add(String.format("Budget limit: $%,.0f", constraints.getBudgetLimit()));
        }
        if (constraints.isCannotHire()) {
            active.add("Cannot hire new staff");
        }
        if (constraints.isMustMaintainAuditTrail()) {
            active.add("Must maintain audit trail");
        }
        if (constraints.getMaxImplementationWeeks() != null) {
            active.add("Max implementation time: " + constraints.getMaxImplementationWeeks() + " weeks");
        }
        if (constraints.getMaxErrorRateIncreasePct() > 0) {
            active.add(String.format("Max error rate increase: %.1f%%", constraints.getMaxErrorRateIncreasePct()));
        }
        if (constraints.hasCustomConstraints()) {
            active.addAll(constraints.getCustomConstraints());
        }

        if (active.isEmpty()) {
            return ToolResult.success("No binding constraints. Recommendation appears feasible.");
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Checking: '").append(concept).append("'\n");
        sb.append("Concern: ").append(concern).append('\n');
        sb.append("Active constraints:");
        for (String constraint : active) {
            sb.append("\n- ").append(constraint);
        }
        return ToolResult.success(sb.toString());
    }
}
