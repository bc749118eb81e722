package com.purchasingpower.flowinsight.analysis;

import com.purchasingpower.flowinsight.model.insight.AnalysisInsight;
import com.purchasingpower.flowinsight.model.insight.Issue;
import com.purchasingpower.flowinsight.model.insight.Recommendation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Links each recommendation back to the issue it addresses.
 *
 * <p>Matching order: exact title, then title equal after case and whitespace
 * normalization, then case-insensitive substring in either direction.
 * The substring step is a heuristic and can pick the wrong issue when two
 * titles share text; results are best effort only.
 */
@Slf4j
@Component
public class RecommendationLinker {

    public AnalysisInsight link(AnalysisInsight insight) {
        if (insight == null || insight.getRecommendations() == null || insight.getRecommendations().isEmpty()) {
            return insight;
        }
        List<Issue> issues = insight.getIssues() == null ? List.of() : insight.getIssues();
        List<Recommendation> linked = new ArrayList<>(insight.getRecommendations().size());
        for (Recommendation rec : insight.getRecommendations()) {
            Optional<Issue> match = resolve(rec.getAddressesIssue(), issues);
            if (match.isPresent() && !match.get().getTitle().equals(rec.getAddressesIssue())) {
                log.debug("Linked recommendation '{}' to issue '{}' (was '{}')",
                        rec.getTitle(), match.get().getTitle(), rec.getAddressesIssue());
                linked.add(rec.toBuilder().addressesIssue(match.get().getTitle()).build());
            } else {
                linked.add(rec);
            }
        }
        return insight.toBuilder().recommendations(linked).build();
    }

    public Optional<Issue> resolve(String reference, List<Issue> issues) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        for (Issue issue : issues) {
            if (reference.equals(issue.getTitle())) {
                return Optional.of(issue);
            }
        }
        String wanted = normalize(reference);
        for (Issue issue : issues) {
            if (wanted.equals(normalize(issue.getTitle()))) {
                return Optional.of(issue);
            }
        }
        for (Issue issue : issues) {
            String title = normalize(issue.getTitle());
            if (!title.isEmpty() && (title.contains(wanted) || wanted.contains(title))) {
                return Optional.of(issue);
            }
        }
        return Optional.empty();
    }

    private static String normalize(String text) {
        return text == null ? "" : text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
