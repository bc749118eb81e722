package com.purchasingpower.flowinsight.model.process;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.purchasingpower.flowinsight.exception.DataInvariantException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Already-parsed process description handed to the analysis pipeline.
 *
 * <p>Totals are derived on read. Dependency names that do not resolve to a
 * step are tolerated and simply ignored by the graph algorithms.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProcessData {

    private String name;

    @Builder.Default
    private String description = "";

    @Builder.Default
    private List<ProcessStep> steps = new ArrayList<>();

    @JsonIgnore
    public double getTotalTimeHours() {
        return steps.stream().mapToDouble(ProcessStep::getAverageTimeHours).sum();
    }

    @JsonIgnore
    public double getTotalCost() {
        return steps.stream().mapToDouble(ProcessStep::getCostPerInstance).sum();
    }

    @JsonIgnore
    public List<String> getStepNames() {
        return steps.stream().map(ProcessStep::getStepName).toList();
    }

    /**
     * Case-insensitive lookup by step name.
     */
    public Optional<ProcessStep> getStep(String stepName) {
        if (stepName == null) {
            return Optional.empty();
        }
        return steps.stream().filter(s -> s.matchesName(stepName)).findFirst();
    }

    /**
     * Checks the invariants a run depends on: a name and at least one step
     * with unique (case-insensitive) names.
     *
     * @throws DataInvariantException if any invariant is violated
     */
    public ProcessData requireValid() {
        if (name == null || name.isBlank()) {
            throw new DataInvariantException("name", "process name must not be blank");
        }
        if (steps == null || steps.isEmpty()) {
            throw new DataInvariantException("steps", "process '" + name + "' has no steps");
        }
        Set<String> seen = new LinkedHashSet<>();
        for (ProcessStep step : steps) {
            if (!seen.add(step.getStepName().toLowerCase(Locale.ROOT))) {
                throw new DataInvariantException("steps",
                        "duplicate step name '" + step.getStepName() + "'");
            }
        }
        return this;
    }

    /**
     * Merges newly extracted data into this process.
     *
     * <p>Steps are matched by case-insensitive name. For a matched step each
     * non-zero incoming value replaces the existing one (resources only when
     * above the default of 1, dependencies only when non-empty). Unmatched
     * incoming steps are appended. Neither input is modified.
     */
    public ProcessData mergeWith(ProcessData incoming) {
        if (incoming == null) {
            return toBuilder().steps(new ArrayList<>(steps)).build();
        }

        List<ProcessStep> merged = new ArrayList<>();
        Set<String> consumed = new LinkedHashSet<>();

        for (ProcessStep existing : steps) {
            Optional<ProcessStep> update = incoming.getStep(existing.getStepName());
            if (update.isPresent()) {
                merged.add(mergeStep(existing, update.get()));
                consumed.add(existing.getStepName().toLowerCase(Locale.ROOT));
            } else {
                merged.add(existing);
            }
        }

        for (ProcessStep candidate : incoming.getSteps()) {
            String key = candidate.getStepName().toLowerCase(Locale.ROOT);
            if (consumed.add(key)) {
                merged.add(candidate);
            }
        }

        return ProcessData.builder()
                .name(isBlank(incoming.getName()) ? name : incoming.getName())
                .description(isBlank(incoming.getDescription()) ? description : incoming.getDescription())
                .steps(merged)
                .build();
    }

    private static ProcessStep mergeStep(ProcessStep existing, ProcessStep incoming) {
        ProcessStep.ProcessStepBuilder builder = existing.toBuilder();
        if (incoming.getAverageTimeHours() != 0) {
            builder.averageTimeHours(incoming.getAverageTimeHours());
        }
        if (incoming.getCostPerInstance() != 0) {
            builder.costPerInstance(incoming.getCostPerInstance());
        }
        if (incoming.getErrorRatePct() != 0) {
            builder.errorRatePct(incoming.getErrorRatePct());
        }
        if (incoming.getResourcesNeeded() > 1) {
            builder.resourcesNeeded(incoming.getResourcesNeeded());
        }
        if (!incoming.getDependsOn().isEmpty()) {
            builder.dependsOn(incoming.getDependsOn());
        }
        if (incoming.getGroupId() != null) {
            builder.groupId(incoming.getGroupId()).groupType(incoming.getGroupType());
        }
        return builder.build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
