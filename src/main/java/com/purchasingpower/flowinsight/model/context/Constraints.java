package com.purchasingpower.flowinsight.model.context;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Business constraints that limit which recommendations are acceptable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Constraints {

    /** Maximum budget in dollars, null when unbounded. */
    private Double budgetLimit;

    private boolean cannotHire;

    /** Maximum tolerated increase in error rate, in percentage points. */
    private double maxErrorRateIncreasePct;

    private boolean mustMaintainAuditTrail;

    /** Maximum implementation time in weeks, null when unbounded. */
    private Integer maxImplementationWeeks;

    @Builder.Default
    private Priority priority = Priority.COST_REDUCTION;

    @Builder.Default
    private List<String> customConstraints = new ArrayList<>();

    public boolean hasBudgetLimit() {
        return budgetLimit != null;
    }

    public boolean hasCustomConstraints() {
        return customConstraints != null && !customConstraints.isEmpty();
    }

    /**
     * One-line summary used in model prompts.
     */
    public String summarize() {
        List<String> parts = new ArrayList<>();
        if (budgetLimit != null && budgetLimit > 0) {
            parts.add(String.format("Budget limit: $%,.0f", budgetLimit));
        }
        if (cannotHire) {
            parts.add("Cannot hire new staff");
        }
        if (mustMaintainAuditTrail) {
            parts.add("Must maintain audit trail");
        }
        if (maxImplementationWeeks != null && maxImplementationWeeks > 0) {
            parts.add("Max implementation time: " + maxImplementationWeeks + " weeks");
        }
        if (maxErrorRateIncreasePct > 0) {
            parts.add("Max acceptable error rate increase: " + formatPct(maxErrorRateIncreasePct) + "%");
        }
        if (priority != null) {
            parts.add("Priority: " + priority.toValue());
        }
        return parts.isEmpty() ? "No specific constraints" : String.join("; ", parts);
    }

    private static String formatPct(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
