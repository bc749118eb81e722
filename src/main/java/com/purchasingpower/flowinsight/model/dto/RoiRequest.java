package com.purchasingpower.flowinsight.model.dto;

import com.purchasingpower.flowinsight.model.process.ProcessData;
import com.purchasingpower.flowinsight.model.roi.SuggestionType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a three-point ROI estimate on one step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoiRequest {
    /** Unknown or missing types fall back to process_redesign. */
    private SuggestionType suggestionType;

    @NotBlank
    private String stepName;

    @NotNull
    private ProcessData process;

    @DecimalMin("0.0")
    private double implementationCost;

    @Min(1)
    private Integer executionsPerYear;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double baseConfidence;
}
