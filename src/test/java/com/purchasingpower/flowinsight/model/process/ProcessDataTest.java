package com.purchasingpower.flowinsight.model.process;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.flowinsight.ProcessFixtures;
import com.purchasingpower.flowinsight.exception.DataInvariantException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.purchasingpower.flowinsight.ProcessFixtures.step;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Process Data Tests")
class ProcessDataTest {

    @Test
    @DisplayName("Should default resources to one and copy lists")
    void step_defaults() {
        ProcessStep step = ProcessStep.builder().stepName("  Intake ").build();

        assertThat(step.getStepName()).isEqualTo("Intake");
        assertThat(step.getResourcesNeeded()).isEqualTo(1);
        assertThat(step.getDependsOn()).isEmpty();
        assertThat(step.hasDependencies()).isFalse();
    }

    @Test
    @DisplayName("Should reject out-of-range step values")
    void step_invalidValues_throw() {
        assertThatThrownBy(() -> ProcessStep.builder().stepName(" ").build())
                .isInstanceOf(DataInvariantException.class);
        assertThatThrownBy(() -> ProcessStep.builder().stepName("A").averageTimeHours(-1).build())
                .isInstanceOf(DataInvariantException.class);
        assertThatThrownBy(() -> ProcessStep.builder().stepName("A").errorRatePct(101).build())
                .isInstanceOf(DataInvariantException.class);
        assertThatThrownBy(() -> ProcessStep.builder().stepName("A").resourcesNeeded(0).build())
                .isInstanceOf(DataInvariantException.class)
                .extracting("field").isEqualTo("resourcesNeeded");
    }

    @Test
    @DisplayName("Should reject a process without steps or with duplicate names")
    void requireValid_invalid_throws() {
        ProcessData empty = ProcessData.builder().name("Empty").build();
        ProcessData duplicates = ProcessData.builder()
                .name("Dupes")
                .steps(new ArrayList<>(List.of(step("Pack", 1, 1, 1), step("PACK", 2, 2, 2))))
                .build();

        assertThatThrownBy(empty::requireValid).isInstanceOf(DataInvariantException.class);
        assertThatThrownBy(duplicates::requireValid)
                .isInstanceOf(DataInvariantException.class)
                .hasMessageContaining("duplicate step name");
        assertThat(ProcessFixtures.clientOnboarding().requireValid()).isNotNull();
    }

    @Test
    @DisplayName("Should merge non-zero incoming values and append new steps")
    void mergeWith_updatesAndAppends() {
        // Given
        ProcessData existing = ProcessFixtures.bareSubmitReview();
        ProcessData incoming = ProcessData.builder()
                .name("")
                .steps(new ArrayList<>(List.of(
                        step("review", 2, 80, 0, "Submit"),
                        step("Archive", 0.1, 5, 0))))
                .build();

        // When
        ProcessData merged = existing.mergeWith(incoming);

        // Then
        assertThat(merged.getName()).isEqualTo("Expense claim");
        assertThat(merged.getStepNames()).containsExactly("Submit", "Review", "Archive");
        ProcessStep review = merged.getStep("Review").orElseThrow();
        assertThat(review.getAverageTimeHours()).isEqualTo(2.0);
        assertThat(review.getCostPerInstance()).isEqualTo(80.0);
        assertThat(review.getDependsOn()).containsExactly("Submit");
        assertThat(merged.getTotalCost()).isEqualTo(85.0);
        // originals untouched
        assertThat(existing.getStep("Review").orElseThrow().getAverageTimeHours()).isZero();
        assertThat(existing.getSteps()).hasSize(2);
    }

    @Test
    @DisplayName("Should keep existing values when incoming values are zero")
    void mergeWith_zeroDoesNotOverwrite() {
        ProcessData existing = ProcessFixtures.clientOnboarding();
        ProcessData incoming = ProcessData.builder()
                .steps(new ArrayList<>(List.of(ProcessStep.builder().stepName("Create account").errorRatePct(3).build())))
                .build();

        ProcessStep merged = existing.mergeWith(incoming).getStep("Create account").orElseThrow();

        assertThat(merged.getAverageTimeHours()).isEqualTo(3.0);
        assertThat(merged.getCostPerInstance()).isEqualTo(200.0);
        assertThat(merged.getErrorRatePct()).isEqualTo(3.0);
        assertThat(merged.getDependsOn()).containsExactly("Manager approval");
    }

    @Test
    @DisplayName("Should read process JSON with camelCase fields")
    void json_deserialize() throws Exception {
        // Given
        String json = """
                {
                  "name": "Refund",
                  "steps": [
                    {"stepName": "Receive claim", "averageTimeHours": 0.5, "costPerInstance": 10},
                    {"stepName": "Approve refund", "averageTimeHours": 1, "dependsOn": ["Receive claim"],
                     "groupId": "g1", "groupType": "parallel", "unknownField": true}
                  ]
                }
                """;

        // When
        ProcessData process = new ObjectMapper().readValue(json, ProcessData.class);

        // Then
        assertThat(process.getDescription()).isEmpty();
        assertThat(process.getSteps()).hasSize(2);
        ProcessStep approve = process.getStep("approve refund").orElseThrow();
        assertThat(approve.getResourcesNeeded()).isEqualTo(1);
        assertThat(approve.getGroupType()).isEqualTo(StepGroupType.PARALLEL);
        assertThat(approve.getDependsOn()).containsExactly("Receive claim");
    }
}
