package com.purchasingpower.flowinsight.analysis;

import com.purchasingpower.flowinsight.ProcessFixtures;
import com.purchasingpower.flowinsight.model.process.ProcessData;
import com.purchasingpower.flowinsight.model.roi.RoiEstimate;
import com.purchasingpower.flowinsight.model.roi.SuggestionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ROI Calculator Tests")
class RoiCalculatorTest {

    private final RoiCalculator calculator = new RoiCalculator();
    private final ProcessData process = ProcessFixtures.clientOnboarding();

    @ParameterizedTest(name = "{0}")
    @EnumSource(SuggestionType.class)
    @DisplayName("Should order scenarios pessimistic <= likely <= optimistic")
    void estimate_scenarioOrdering(SuggestionType type) {
        RoiEstimate estimate = calculator.estimate(type, "Review application", process);

        assertThat(estimate.getPessimistic()).isLessThanOrEqualTo(estimate.getLikely());
        assertThat(estimate.getLikely()).isLessThanOrEqualTo(estimate.getOptimistic());
        assertThat(estimate.getPessimistic()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    @DisplayName("Should value automation from time and rework savings")
    void estimate_automation_likely() {
        // Given: 4h at $75/h, $300 per run, 10% errors
        // When
        RoiEstimate estimate = calculator.estimate(SuggestionType.AUTOMATION, "Review application", process);

        // Then: (4 * 0.7 * 75 + 300 * 2 * 0.1 * 0.8) * 1000
        assertThat(estimate.getLikely()).isEqualTo(258_000.0, within(0.01));
        assertThat(estimate.getConfidence()).isEqualTo(RoiCalculator.DEFAULT_CONFIDENCE);
        assertThat(estimate.getPaybackMonths()).isNull();
        assertThat(estimate.getAssumptions()).anyMatch(a -> a.startsWith("Expected time reduction: 70%"));
    }

    @Test
    @DisplayName("Should never value automation above elimination")
    void estimate_eliminationAtLeastAutomation() {
        RoiEstimate automation = calculator.estimate(SuggestionType.AUTOMATION, "Create account", process);
        RoiEstimate elimination = calculator.estimate(SuggestionType.ELIMINATION, "Create account", process);

        assertThat(elimination.getLikely()).isGreaterThanOrEqualTo(automation.getLikely());
        assertThat(elimination.getOptimistic()).isGreaterThanOrEqualTo(automation.getOptimistic());
    }

    @Test
    @DisplayName("Should compute payback months from the implementation cost")
    void estimate_paybackMonths() {
        RoiEstimate estimate = calculator.estimate(SuggestionType.AUTOMATION, "review application", process,
                129_000, 1000, 0.8);

        assertThat(estimate.getPaybackMonths()).isEqualTo(6.0, within(1e-9));
        assertThat(estimate.getConfidence()).isEqualTo(0.8);
        assertThat(estimate.expectedValue()).isBetween(estimate.getPessimistic(), estimate.getOptimistic());
    }

    @Test
    @DisplayName("Should return a zero estimate for an unknown step")
    void estimate_unknownStep() {
        RoiEstimate estimate = calculator.estimate(SuggestionType.TRAINING, "Teleport", process);

        assertThat(estimate.getLikely()).isZero();
        assertThat(estimate.getConfidence()).isZero();
        assertThat(estimate.getPaybackMonths()).isNull();
        assertThat(estimate.getAssumptions()).containsExactly("Unable to calculate ROI - step not found");
    }

    @Test
    @DisplayName("Should fall back to process redesign factors when no type is given")
    void estimate_nullType_usesRedesign() {
        RoiEstimate untyped = calculator.estimate(null, "Manager approval", process);
        RoiEstimate redesign = calculator.estimate(SuggestionType.PROCESS_REDESIGN, "Manager approval", process);

        assertThat(untyped.getLikely()).isEqualTo(redesign.getLikely());
    }

    @Test
    @DisplayName("Should parse suggestion types leniently")
    void suggestionType_fromValue() {
        assertThat(SuggestionType.fromValue("tool upgrade")).isEqualTo(SuggestionType.TOOL_UPGRADE);
        assertThat(SuggestionType.fromValue("AUTOMATION")).isEqualTo(SuggestionType.AUTOMATION);
        assertThat(SuggestionType.fromValue("magic")).isNull();
    }
}
