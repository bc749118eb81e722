package com.purchasingpower.flowinsight.model.dto;

import com.purchasingpower.flowinsight.model.context.BusinessProfile;
import com.purchasingpower.flowinsight.model.context.Constraints;
import com.purchasingpower.flowinsight.model.process.ProcessData;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for starting an analysis of confirmed process data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {
    /** Optional; a new thread id is generated when absent. */
    private String threadId;

    @NotNull
    private ProcessData process;

    private Constraints constraints;
    private BusinessProfile profile;

    /** cost_optimized, balanced or deep_analysis */
    private String analysisMode;

    /** openai, anthropic or ollama */
    private String llmProvider;

    /** Overrides app.analysis.max-cycles for this run; 0 disables investigation. */
    @Min(0)
    private Integer maxCycles;
}
