package com.purchasingpower.flowinsight.model.roi;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Three-point annual savings estimate, in dollars per year.
 */
@Value
@Builder
public class RoiEstimate {

    double pessimistic;
    double likely;
    double optimistic;
    List<String> assumptions;
    double confidence;

    /** Months to recover the implementation cost; null when undefined. */
    Double paybackMonths;

    /**
     * PERT weighted mean: (pessimistic + 4 x likely + optimistic) / 6.
     */
    @JsonProperty("expectedValue")
    public double expectedValue() {
        return (pessimistic + 4 * likely + optimistic) / 6;
    }
}
