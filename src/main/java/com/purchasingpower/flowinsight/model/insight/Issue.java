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
 * A problem in the process as judged by the model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Issue {

    private String title;
    private String description;
    private Severity severity;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    private List<String> affectedSteps = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private String rootCauseHypothesis = "";

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    private List<String> evidence = new ArrayList<>();
}
