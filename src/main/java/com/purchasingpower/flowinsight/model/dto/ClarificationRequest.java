package com.purchasingpower.flowinsight.model.dto;

import com.purchasingpower.flowinsight.model.process.ProcessData;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for answering the clarification questions of a suspended run.
 * A blank response means "continue with what you have".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClarificationRequest {
    private String response;

    /** Corrected or additional steps, merged into the saved process by step name. */
    private ProcessData process;
}
