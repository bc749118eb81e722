package com.purchasingpower.flowinsight.analysis;

import com.purchasingpower.flowinsight.model.process.ProcessData;
import com.purchasingpower.flowinsight.model.process.ProcessStep;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Dependency graph over the steps of one process.
 *
 * <p>Edges point from a step to the steps that depend on it. Dependency names
 * are matched case-insensitively; names that do not resolve to a step are
 * dropped, and duplicate edges collapse into one. Cyclic input is tolerated
 * by every traversal.
 */
public final class ProcessGraph {

    private final List<String> stepNames;
    private final Map<String, Set<String>> dependents = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();

    private ProcessGraph(List<String> stepNames) {
        this.stepNames = stepNames;
    }

    public static ProcessGraph of(ProcessData process) {
        List<ProcessStep> steps = process.getSteps() == null ? List.of() : process.getSteps();
        ProcessGraph graph = new ProcessGraph(steps.stream().map(ProcessStep::getStepName).toList());

        Map<String, String> canonical = new HashMap<>();
        for (ProcessStep step : steps) {
            canonical.putIfAbsent(step.getStepName().toLowerCase(Locale.ROOT), step.getStepName());
            graph.dependents.putIfAbsent(step.getStepName(), new LinkedHashSet<>());
            graph.dependencies.putIfAbsent(step.getStepName(), new LinkedHashSet<>());
        }

        for (ProcessStep step : steps) {
            for (String dependency : step.getDependsOn()) {
                if (dependency == null) {
                    continue;
                }
                String upstream = canonical.get(dependency.trim().toLowerCase(Locale.ROOT));
                if (upstream == null) {
                    continue;
                }
                graph.dependents.get(upstream).add(step.getStepName());
                graph.dependencies.get(step.getStepName()).add(upstream);
            }
        }
        return graph;
    }

    public List<String> getStepNames() {
        return stepNames;
    }

    public Set<String> directDependents(String stepName) {
        return Collections.unmodifiableSet(dependents.getOrDefault(stepName, Set.of()));
    }

    public Set<String> directDependencies(String stepName) {
        return Collections.unmodifiableSet(dependencies.getOrDefault(stepName, Set.of()));
    }

    /**
     * All steps that transitively depend on {@code stepName}.
     */
    public Set<String> downstreamOf(String stepName) {
        return closure(stepName, dependents);
    }

    /**
     * All steps {@code stepName} transitively depends on.
     */
    public Set<String> upstreamOf(String stepName) {
        return closure(stepName, dependencies);
    }

    public boolean hasEdges() {
        return dependencies.values().stream().anyMatch(s -> !s.isEmpty());
    }

    /**
     * Number of steps on the longest dependency chain. A step nobody depends
     * on has length 1; an empty graph has length 0.
     */
    public int longestChain() {
        Map<String, Integer> memo = new HashMap<>();
        Set<String> onPath = new HashSet<>();
        int longest = 0;
        for (String step : stepNames) {
            longest = Math.max(longest, chainFrom(step, memo, onPath));
        }
        return longest;
    }

    private int chainFrom(String step, Map<String, Integer> memo, Set<String> onPath) {
        Integer known = memo.get(step);
        if (known != null) {
            return known;
        }
        if (!onPath.add(step)) {
            // back edge in cyclic input
            return 0;
        }
        int longestChild = 0;
        for (String child : dependents.getOrDefault(step, Set.of())) {
            longestChild = Math.max(longestChild, chainFrom(child, memo, onPath));
        }
        onPath.remove(step);
        memo.put(step, 1 + longestChild);
        return 1 + longestChild;
    }

    // One visited set for the whole walk from a start node, so diamonds are
    // expanded once and cycles end on revisit.
    private static Set<String> closure(String start, Map<String, Set<String>> edges) {
        Set<String> visited = new LinkedHashSet<>();
        visited.add(start);
        walk(start, edges, visited);
        visited.remove(start);
        return visited;
    }

    private static void walk(String node, Map<String, Set<String>> edges, Set<String> visited) {
        for (String next : edges.getOrDefault(node, Set.of())) {
            if (visited.add(next)) {
                walk(next, edges, visited);
            }
        }
    }
}
