package com.repo.readiness.graph;

import java.util.*;

/**
 * Depth-first cycle enumeration.
 *
 * Every time the walk reaches a node that is still on the recursion stack, the slice of the
 * current path from that node onwards is recorded as a cycle. Each node is expanded once, so the
 * walk terminates; cycles are neither minimal nor deduplicated.
 */
public class CycleDetector {

    public List<List<String>> findCycles(DependencyGraph graph) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();

        for (String node : graph.nodes()) {
            if (!visited.contains(node)) {
                visit(node, graph, visited, onStack, new ArrayList<>(), cycles);
            }
        }

        return cycles;
    }

    private void visit(
            String node,
            DependencyGraph graph,
            Set<String> visited,
            Set<String> onStack,
            List<String> path,
            List<List<String>> cycles) {
        visited.add(node);
        onStack.add(node);
        path.add(node);

        for (String neighbor : graph.targetsOf(node)) {
            if (!visited.contains(neighbor)) {
                visit(neighbor, graph, visited, onStack, path, cycles);
            } else if (onStack.contains(neighbor)) {
                int cycleStart = path.indexOf(neighbor);
                if (cycleStart >= 0) {
                    cycles.add(List.copyOf(path.subList(cycleStart, path.size())));
                }
            }
        }

        path.remove(path.size() - 1);
        onStack.remove(node);
    }
}
