package com.purchasingpower.flowinsight.analysis;

import com.purchasingpower.flowinsight.ProcessFixtures;
import com.purchasingpower.flowinsight.model.process.ProcessData;
import com.purchasingpower.flowinsight.model.process.ProcessStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.purchasingpower.flowinsight.ProcessFixtures.step;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Process Graph Tests")
class ProcessGraphTest {

    @Test
    @DisplayName("Should count every step of a linear chain")
    void longestChain_linear_countsAllSteps() {
        // Given
        ProcessGraph graph = ProcessGraph.of(ProcessFixtures.linearChain(13));

        // Then
        assertThat(graph.longestChain()).isEqualTo(13);
        assertThat(graph.downstreamOf("Step 1")).hasSize(12);
        assertThat(graph.upstreamOf("Step 13")).hasSize(12);
    }

    @Test
    @DisplayName("Should follow the longest branch")
    void longestChain_branching_takesLongestPath() {
        // Given: Start fans out to a short branch and a long one that rejoins at End
        List<ProcessStep> steps = new ArrayList<>();
        steps.add(step("Start", 1, 1, 1));
        steps.add(step("Quick path", 1, 1, 1, "Start"));
        for (int i = 1; i <= 9; i++) {
            steps.add(step("Long " + i, 1, 1, 1, i == 1 ? "Start" : "Long " + (i - 1)));
        }
        steps.add(step("End", 1, 1, 1, "Quick path", "Long 9"));
        ProcessData process = ProcessData.builder().name("Branching").steps(steps).build();

        // When
        int chain = ProcessGraph.of(process).longestChain();

        // Then: Start + 9 long steps + End
        assertThat(chain).isEqualTo(11);
        assertThat(chain).isGreaterThanOrEqualTo(10);
    }

    @Test
    @DisplayName("Should terminate on cyclic dependencies")
    void traversals_cycle_terminate() {
        // Given: A -> B -> C -> A
        ProcessData process = ProcessData.builder()
                .name("Loop")
                .steps(new ArrayList<>(List.of(
                        step("A", 1, 1, 1, "C"),
                        step("B", 1, 1, 1, "A"),
                        step("C", 1, 1, 1, "B"))))
                .build();

        // When
        ProcessGraph graph = ProcessGraph.of(process);

        // Then
        assertThat(graph.downstreamOf("A")).containsExactlyInAnyOrder("B", "C");
        assertThat(graph.upstreamOf("A")).containsExactlyInAnyOrder("B", "C");
        assertThat(graph.longestChain()).isBetween(1, 3);
    }

    @Test
    @DisplayName("Should collapse duplicate edges and match names case-insensitively")
    void edges_duplicates_collapse() {
        // Given
        ProcessData process = ProcessData.builder()
                .name("Dupes")
                .steps(new ArrayList<>(List.of(
                        step("Draft", 1, 1, 1),
                        step("Publish", 1, 1, 1, "Draft", "draft", " DRAFT "))))
                .build();

        // When
        ProcessGraph graph = ProcessGraph.of(process);

        // Then
        assertThat(graph.directDependents("Draft")).containsExactly("Publish");
        assertThat(graph.directDependencies("Publish")).containsExactly("Draft");
        assertThat(graph.longestChain()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should ignore dependencies on unknown steps")
    void edges_danglingReference_ignored() {
        // Given
        ProcessData process = ProcessData.builder()
                .name("Dangling")
                .steps(new ArrayList<>(List.of(
                        step("Ship", 1, 1, 1, "Pack"),
                        step("Invoice", 1, 1, 1))))
                .build();

        // When
        ProcessGraph graph = ProcessGraph.of(process);

        // Then
        assertThat(graph.hasEdges()).isFalse();
        assertThat(graph.upstreamOf("Ship")).isEmpty();
        assertThat(graph.longestChain()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should report a zero-length chain for an empty process")
    void longestChain_empty_isZero() {
        ProcessGraph graph = ProcessGraph.of(ProcessData.builder().name("Empty").build());

        assertThat(graph.longestChain()).isZero();
        assertThat(graph.getStepNames()).isEmpty();
    }

    @Test
    @DisplayName("Should match dependency names case-insensitively under a Turkish default locale")
    void of_turkishLocale_matchesDependencies() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            // Given
            ProcessData process = ProcessData.builder()
                    .name("Intake")
                    .steps(List.of(step("Intake", 1, 1, 1), step("Triage", 1, 1, 1, "intake")))
                    .build();

            // When
            ProcessGraph graph = ProcessGraph.of(process);

            // Then
            assertThat(graph.directDependents("Intake")).containsExactly("Triage");
            assertThat(graph.longestChain()).isEqualTo(2);
        } finally {
            Locale.setDefault(previous);
        }
    }
}
