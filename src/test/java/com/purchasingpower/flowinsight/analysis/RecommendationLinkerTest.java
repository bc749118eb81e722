package com.purchasingpower.flowinsight.analysis;

import com.purchasingpower.flowinsight.model.insight.AnalysisInsight;
import com.purchasingpower.flowinsight.model.insight.Issue;
import com.purchasingpower.flowinsight.model.insight.Recommendation;
import com.purchasingpower.flowinsight.model.insight.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Recommendation Linker Tests")
class RecommendationLinkerTest {

    private final RecommendationLinker linker = new RecommendationLinker();

    private final List<Issue> issues = List.of(
            Issue.builder().title("Review bottleneck").severity(Severity.HIGH).build(),
            Issue.builder().title("Manual data entry errors").severity(Severity.MEDIUM).build());

    @Test
    @DisplayName("Should keep exact references")
    void resolve_exact() {
        assertThat(linker.resolve("Review bottleneck", issues))
                .get().extracting(Issue::getTitle).isEqualTo("Review bottleneck");
    }

    @Test
    @DisplayName("Should match after case and whitespace normalization")
    void resolve_normalized() {
        assertThat(linker.resolve("  manual   DATA entry errors ", issues))
                .get().extracting(Issue::getTitle).isEqualTo("Manual data entry errors");
    }

    @Test
    @DisplayName("Should match a partial title")
    void resolve_substring() {
        assertThat(linker.resolve("the review bottleneck in approvals", issues))
                .get().extracting(Issue::getTitle).isEqualTo("Review bottleneck");
        assertThat(linker.resolve("data entry", issues))
                .get().extracting(Issue::getTitle).isEqualTo("Manual data entry errors");
    }

    @Test
    @DisplayName("Should leave unknown or blank references unresolved")
    void resolve_noMatch() {
        assertThat(linker.resolve("Vendor delays", issues)).isEmpty();
        assertThat(linker.resolve(" ", issues)).isEmpty();
        assertThat(linker.resolve(null, issues)).isEmpty();
    }

    @Test
    @DisplayName("Should rewrite loose references to the issue title")
    void link_rewritesReferences() {
        // Given
        AnalysisInsight insight = AnalysisInsight.builder()
                .issues(new ArrayList<>(issues))
                .recommendations(new ArrayList<>(List.of(
                        Recommendation.builder().title("Parallel reviews").addressesIssue("review BOTTLENECK").build(),
                        Recommendation.builder().title("Hire more").addressesIssue("Staffing").build())))
                .build();

        // When
        AnalysisInsight linked = linker.link(insight);

        // Then
        assertThat(linked.getRecommendations())
                .extracting(Recommendation::getAddressesIssue)
                .containsExactly("Review bottleneck", "Staffing");
        assertThat(linked.recommendationsFor(issues.get(0)))
                .extracting(Recommendation::getTitle)
                .containsExactly("Parallel reviews");
        // input untouched
        assertThat(insight.getRecommendations().get(0).getAddressesIssue()).isEqualTo("review BOTTLENECK");
    }

    @Test
    @DisplayName("Should pass through an insight without recommendations")
    void link_noRecommendations() {
        AnalysisInsight insight = AnalysisInsight.builder().issues(new ArrayList<>(issues)).build();

        assertThat(linker.link(insight)).isSameAs(insight);
        assertThat(linker.link(null)).isNull();
    }
}
