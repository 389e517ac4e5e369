package com.repo.readiness.graph;

import java.util.*;

/**
 * File-level dependency graph keyed by file stem.
 * Edge lists keep the order in which imports appear in the source file; every node that appears
 * as an edge target is also a node of the graph.
 */
public final class DependencyGraph {

    private final Map<String, List<String>> edges;

    private DependencyGraph(Map<String, List<String>> edges) {
        this.edges = edges;
    }

    /**
     * Build a graph from an adjacency map. Targets missing from the key set are added as leaves.
     */
    public static DependencyGraph of(Map<String, List<String>> adjacency) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        adjacency.forEach((node, targets) -> copy.put(node, List.copyOf(targets)));
        for (List<String> targets : adjacency.values()) {
            for (String target : targets) {
                copy.putIfAbsent(target, List.of());
            }
        }
        return new DependencyGraph(Collections.unmodifiableMap(copy));
    }

    public static DependencyGraph empty() {
        return new DependencyGraph(Map.of());
    }

    /**
     * Nodes in insertion order.
     */
    public Set<String> nodes() {
        return edges.keySet();
    }

    public List<String> targetsOf(String node) {
        return edges.getOrDefault(node, List.of());
    }

    public boolean contains(String node) {
        return edges.containsKey(node);
    }

    public int size() {
        return edges.size();
    }

    public Map<String, List<String>> asMap() {
        return edges;
    }

    @Override
    public String toString() {
        return "DependencyGraph" + edges;
    }
}
