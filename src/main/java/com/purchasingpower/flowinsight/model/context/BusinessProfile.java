package com.purchasingpower.flowinsight.model.context;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Facts about the business that shape which recommendations make sense.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BusinessProfile {

    private Industry industry;

    /** Free-text industry when {@link Industry#OTHER} is selected. */
    @Builder.Default
    private String customIndustry = "";

    private CompanySize companySize;

    @Builder.Default
    private RegulatoryEnvironment regulatoryEnvironment = RegulatoryEnvironment.MODERATE;

    @Builder.Default
    private List<String> typicalConstraints = new ArrayList<>();

    /** Frameworks the user responds well to (Lean, Six Sigma, ...). */
    @Builder.Default
    private List<String> preferredFrameworks = new ArrayList<>();

    @Builder.Default
    private List<String> previousImprovements = new ArrayList<>();

    @Builder.Default
    private List<String> rejectedApproaches = new ArrayList<>();

    @Builder.Default
    private String notes = "";

    /**
     * Industry label for prompts; the custom text wins when present.
     */
    public String industryLabel() {
        if (customIndustry != null && !customIndustry.isBlank()) {
            return customIndustry;
        }
        return industry == null ? null : industry.toValue();
    }
}
