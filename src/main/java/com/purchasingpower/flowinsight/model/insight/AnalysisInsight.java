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
 * Structured result of an analysis run.
 *
 * <p>Produced by the model in the initial analysis, then enriched with
 * investigation findings when the run is finalized. Treated as a value:
 * stages derive a new instance with {@link #toBuilder()} instead of mutating.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisInsight {

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private String processSummary = "";

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    private List<String> patterns = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    private List<Issue> issues = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    private List<Recommendation> recommendations = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    private List<NotAProblem> notProblems = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    private List<String> investigationFindings = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY, contentNulls = Nulls.SKIP)
    private List<String> followUpQuestions = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private String confidenceNotes = "";

    public boolean hasIssues() {
        return issues != null && !issues.isEmpty();
    }

    public List<Recommendation> recommendationsFor(Issue issue) {
        return recommendations.stream()
                .filter(r -> issue.getTitle() != null && issue.getTitle().equals(r.getAddressesIssue()))
                .toList();
    }
}
