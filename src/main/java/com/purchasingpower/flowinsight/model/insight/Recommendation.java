package com.purchasingpower.flowinsight.model.insight;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A suggested change, linked to an {@link Issue} by title.
 *
 * <p>The link is textual: {@code addressesIssue} should equal an issue title,
 * but model output is only normalized after the fact, see
 * {@link com.purchasingpower.flowinsight.analysis.RecommendationLinker}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Recommendation {

    private String title;
    private String addressesIssue;
    private String description;
    private String expectedBenefit;
    private Feasibility feasibility;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    private List<String> risks = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    private List<String> nextSteps = new ArrayList<>();
}
