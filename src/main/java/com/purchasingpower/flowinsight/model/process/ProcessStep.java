package com.purchasingpower.flowinsight.model.process;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.purchasingpower.flowinsight.exception.DataInvariantException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A single step in a business process.
 *
 * <p>Immutable. Use {@link #toBuilder()} to derive an edited copy.
 * Ranges are checked on construction:
 * <ul>
 *   <li>time and cost are non-negative</li>
 *   <li>resources is at least 1 (defaults to 1)</li>
 *   <li>error rate is a percentage in 0..100</li>
 * </ul>
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProcessStep {

    String stepName;
    double averageTimeHours;
    int resourcesNeeded;
    double errorRatePct;
    double costPerInstance;
    List<String> dependsOn;

    /** Tags steps that are alternatives to, or run in parallel with, each other. */
    String groupId;
    StepGroupType groupType;

    /** Field names that were estimated rather than supplied by the user. */
    List<String> estimatedFields;

    @Builder(toBuilder = true)
    @Jacksonized
    public ProcessStep(String stepName,
                       double averageTimeHours,
                       Integer resourcesNeeded,
                       double errorRatePct,
                       double costPerInstance,
                       List<String> dependsOn,
                       String groupId,
                       StepGroupType groupType,
                       List<String> estimatedFields) {
        if (stepName == null || stepName.isBlank()) {
            throw new DataInvariantException("stepName", "step name must not be blank");
        }
        if (averageTimeHours < 0) {
            throw new DataInvariantException("averageTimeHours",
                    "average time must be >= 0 for step '" + stepName + "'");
        }
        if (resourcesNeeded != null && resourcesNeeded < 1) {
            throw new DataInvariantException("resourcesNeeded",
                    "resources needed must be >= 1 for step '" + stepName + "'");
        }
        if (errorRatePct < 0 || errorRatePct > 100) {
            throw new DataInvariantException("errorRatePct",
                    "error rate must be between 0 and 100 for step '" + stepName + "'");
        }
        if (costPerInstance < 0) {
            throw new DataInvariantException("costPerInstance",
                    "cost must be >= 0 for step '" + stepName + "'");
        }
        this.stepName = stepName.trim();
        this.averageTimeHours = averageTimeHours;
        this.resourcesNeeded = resourcesNeeded == null ? 1 : resourcesNeeded;
        this.errorRatePct = errorRatePct;
        this.costPerInstance = costPerInstance;
        this.dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        this.groupId = groupId;
        this.groupType = groupType;
        this.estimatedFields = estimatedFields == null ? List.of() : List.copyOf(estimatedFields);
    }

    public boolean hasDependencies() {
        return !dependsOn.isEmpty();
    }

    public boolean matchesName(String name) {
        return name != null && stepName.equalsIgnoreCase(name.trim());
    }
}
