package com.purchasingpower.flowinsight.analysis;

import com.purchasingpower.flowinsight.ProcessFixtures;
import com.purchasingpower.flowinsight.model.metrics.ProcessMetrics;
import com.purchasingpower.flowinsight.model.metrics.StepCategory;
import com.purchasingpower.flowinsight.model.metrics.StepMetrics;
import com.purchasingpower.flowinsight.model.process.ProcessData;
import com.purchasingpower.flowinsight.model.process.ProcessStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Metrics Engine Tests")
class MetricsEngineTest {

    private final MetricsEngine engine = new MetricsEngine();

    @Test
    @DisplayName("Should compute shares, totals and dependency reach")
    void compute_completeProcess_derivesFacts() {
        // Given
        ProcessData process = ProcessFixtures.clientOnboarding();

        // When
        ProcessMetrics metrics = engine.compute(process);

        // Then
        assertThat(metrics.getStepCount()).isEqualTo(5);
        assertThat(metrics.getTotalTimeHours()).isEqualTo(10.5, within(1e-9));
        assertThat(metrics.getTotalCost()).isEqualTo(800.0, within(1e-9));
        assertThat(metrics.getSteps().stream().mapToDouble(StepMetrics::getTimePct).sum())
                .isEqualTo(100.0, within(1e-6));
        assertThat(metrics.getSteps().stream().mapToDouble(StepMetrics::getCostPct).sum())
                .isEqualTo(100.0, within(1e-6));

        StepMetrics first = metrics.findStep("collect client documents").orElseThrow();
        assertThat(first.getDownstreamCount()).isEqualTo(4);
        assertThat(first.getUpstreamCount()).isZero();
        assertThat(first.isParallelCandidate()).isFalse();

        StepMetrics last = metrics.findStep("Send welcome pack").orElseThrow();
        assertThat(last.getDownstreamCount()).isZero();
        assertThat(last.getUpstreamCount()).isEqualTo(4);
        assertThat(last.isParallelCandidate()).isTrue();

        assertThat(metrics.isHasAllTimes()).isTrue();
        assertThat(metrics.isHasAllCosts()).isTrue();
        assertThat(metrics.isHasDependencies()).isTrue();
    }

    @Test
    @DisplayName("Should flag the longest, most expensive and most error-prone step")
    void compute_flagsExtremes() {
        ProcessMetrics metrics = engine.compute(ProcessFixtures.clientOnboarding());

        StepMetrics review = metrics.findStep("Review application").orElseThrow();
        assertThat(review.isLongest()).isTrue();
        assertThat(review.isMostExpensive()).isTrue();
        assertThat(review.isHighestError()).isTrue();

        assertThat(metrics.getSteps())
                .filteredOn(StepMetrics::isLongest)
                .hasSize(1);
    }

    @Test
    @DisplayName("Should aggregate category patterns and chain length")
    void compute_patterns() {
        ProcessMetrics metrics = engine.compute(ProcessFixtures.clientOnboarding());

        assertThat(metrics.getPatterns().getReviewStepCount()).isEqualTo(2);
        assertThat(metrics.getPatterns().getReviewPctOfSteps()).isEqualTo(40.0, within(1e-9));
        assertThat(metrics.getPatterns().getExternalTouchpoints()).isEqualTo(1);
        assertThat(metrics.getPatterns().getHandoffCount()).isEqualTo(1);
        assertThat(metrics.getPatterns().getCreativeStepCount()).isEqualTo(1);
        assertThat(metrics.getPatterns().getSequentialChainLength()).isEqualTo(5);
        assertThat(metrics.getPatterns().getParallelOpportunities()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should report a 13-step chain as 13")
    void compute_longLinearChain() {
        ProcessMetrics metrics = engine.compute(ProcessFixtures.linearChain(13));

        assertThat(metrics.getPatterns().getSequentialChainLength()).isEqualTo(13);
    }

    @Test
    @DisplayName("Should return zero shares and no flags when totals are zero")
    void compute_zeroTotals_noDivisionByZero() {
        // Given
        ProcessData process = ProcessFixtures.bareSubmitReview();

        // When
        ProcessMetrics metrics = engine.compute(process);

        // Then
        assertThat(metrics.getSteps()).allSatisfy(step -> {
            assertThat(step.getTimePct()).isZero();
            assertThat(step.getCostPct()).isZero();
            assertThat(step.isLongest()).isFalse();
            assertThat(step.isMostExpensive()).isFalse();
            assertThat(step.isHighestError()).isFalse();
        });
        assertThat(metrics.isHasAllTimes()).isFalse();
        assertThat(metrics.isHasErrorRates()).isFalse();
        assertThat(metrics.getPatterns().getTimeInReviewsPct()).isZero();
    }

    @Test
    @DisplayName("Should return zeroed metrics for a process without steps")
    void compute_emptyProcess() {
        ProcessMetrics metrics = engine.compute(ProcessData.builder().name("Nothing").build());

        assertThat(metrics.getStepCount()).isZero();
        assertThat(metrics.getSteps()).isEmpty();
        assertThat(metrics.getPatterns()).isNotNull();
        assertThat(metrics.getPatterns().getSequentialChainLength()).isZero();
    }

    @Test
    @DisplayName("Should mark tied maxima on every tied step")
    void compute_ties_flagAll() {
        // Given
        ProcessData process = ProcessData.builder()
                .name("Ties")
                .steps(new ArrayList<>(List.of(
                        ProcessFixtures.step("Pick", 2, 20, 0),
                        ProcessFixtures.step("Pack", 2, 20, 0))))
                .build();

        // When
        ProcessMetrics metrics = engine.compute(process);

        // Then
        assertThat(metrics.getSteps()).allMatch(StepMetrics::isLongest);
        assertThat(metrics.getSteps()).noneMatch(StepMetrics::isHighestError);
    }

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @DisplayName("Should infer categories from step names")
    @CsvSource({
            "Review application, REVIEW",
            "Manager approval, REVIEW",
            "QA check, REVIEW",
            "Client feedback, EXTERNAL",
            "Submit form, HANDOFF",
            "Design mockups, CREATIVE",
            "Record invoice, ADMINISTRATIVE",
            "Prepare shipment, PROCESSING",
            "Lunch, UNKNOWN"
    })
    void inferCategory(String stepName, StepCategory expected) {
        assertThat(engine.inferCategory(stepName)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should infer categories under a Turkish default locale")
    void inferCategory_turkishLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(engine.inferCategory("Invoice matching")).isEqualTo(StepCategory.ADMINISTRATIVE);
            assertThat(engine.inferCategory("INTERNAL REVIEW")).isEqualTo(StepCategory.REVIEW);
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("Should keep resource counts per step")
    void compute_resources() {
        ProcessData process = ProcessData.builder()
                .name("Staffing")
                .steps(new ArrayList<>(List.of(
                        ProcessStep.builder().stepName("Interview").averageTimeHours(1).resourcesNeeded(3).build())))
                .build();

        assertThat(engine.compute(process).getSteps().get(0).getResources()).isEqualTo(3);
    }
}
