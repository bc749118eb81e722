package com.purchasingpower.flowinsight.model.insight;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A step that looks slow or costly but is core value rather than waste.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotAProblem {
    private String stepName;
    private String whyNotAProblem;
}
