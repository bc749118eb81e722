package com.purchasingpower.flowinsight;

import com.purchasingpower.flowinsight.model.process.ProcessData;
import com.purchasingpower.flowinsight.model.process.ProcessStep;

import java.util.ArrayList;
import java.util.List;

/**
 * Sample processes shared by the tests.
 */
public final class ProcessFixtures {

    private ProcessFixtures() {
    }

    public static ProcessStep step(String name, double hours, double cost, double errorPct, String... dependsOn) {
        return ProcessStep.builder()
                .stepName(name)
                .averageTimeHours(hours)
                .costPerInstance(cost)
                .errorRatePct(errorPct)
                .dependsOn(List.of(dependsOn))
                .build();
    }

    /**
     * Five-step onboarding chain with complete data.
     * Review application is the longest, most expensive and most error-prone step.
     */
    public static ProcessData clientOnboarding() {
        return ProcessData.builder()
                .name("Client onboarding")
                .description("From signed contract to active account")
                .steps(new ArrayList<>(List.of(
                        step("Collect client documents", 2, 100, 5),
                        step("Review application", 4, 300, 10, "Collect client documents"),
                        step("Manager approval", 1, 150, 2, "Review application"),
                        step("Create account", 3, 200, 8, "Manager approval"),
                        step("Send welcome pack", 0.5, 50, 1, "Create account"))))
                .build();
    }

    /**
     * Two steps with names only.
     */
    public static ProcessData bareSubmitReview() {
        return ProcessData.builder()
                .name("Expense claim")
                .steps(new ArrayList<>(List.of(
                        ProcessStep.builder().stepName("Submit").build(),
                        ProcessStep.builder().stepName("Review").build())))
                .build();
    }

    /**
     * {@code length} steps where each depends on the one before.
     */
    public static ProcessData linearChain(int length) {
        List<ProcessStep> steps = new ArrayList<>();
        for (int i = 1; i <= length; i++) {
            steps.add(i == 1
                    ? step("Step " + i, 1, 10, 1)
                    : step("Step " + i, 1, 10, 1, "Step " + (i - 1)));
        }
        return ProcessData.builder().name("Chain of " + length).steps(steps).build();
    }
}
