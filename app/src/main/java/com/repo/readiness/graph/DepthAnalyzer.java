package com.repo.readiness.graph;

import java.util.*;

/**
 * Longest dependency chain (in edges) reachable from each node, never revisiting a node.
 *
 * Strongly connected components are found with Tarjan's algorithm and processed sinks-first, so
 * the depth of every node outside the current component is already known. Inside a component the
 * longest simple path is searched exhaustively from each member; at every node reached, an edge
 * leaving the component extends the path by one plus the depth of its target. A path that has left
 * a component can never return to it, so this gives the same numbers as a per-branch visited-set
 * search over the whole graph while only searching within one component at a time.
 */
public class DepthAnalyzer {

    /**
     * Depth per node, in graph iteration order.
     */
    public Map<String, Integer> computeDepths(DependencyGraph graph) {
        Tarjan tarjan = new Tarjan(graph);
        List<List<String>> components = tarjan.run();
        Map<String, Integer> componentOf = tarjan.componentIndex;

        Map<String, Integer> nodeDepth = new HashMap<>();
        Map<String, Integer> exitDepth = new HashMap<>();

        // Tarjan emits components in reverse topological order: successors are already done
        for (int c = 0; c < components.size(); c++) {
            List<String> members = components.get(c);
            for (String node : members) {
                int best = 0;
                for (String target : graph.targetsOf(node)) {
                    if (componentOf.get(target) != c) {
                        best = Math.max(best, 1 + nodeDepth.get(target));
                    }
                }
                exitDepth.put(node, best);
            }

            if (members.size() == 1) {
                String node = members.get(0);
                nodeDepth.put(node, exitDepth.get(node));
                continue;
            }
            for (String node : members) {
                Set<String> onPath = new HashSet<>();
                nodeDepth.put(node, longestWithin(node, c, 0, graph, componentOf, exitDepth, onPath));
            }
        }

        Map<String, Integer> depths = new LinkedHashMap<>();
        for (String node : graph.nodes()) {
            depths.put(node, nodeDepth.get(node));
        }
        return depths;
    }

    private int longestWithin(
            String node,
            int component,
            int pathLength,
            DependencyGraph graph,
            Map<String, Integer> componentOf,
            Map<String, Integer> exitDepth,
            Set<String> onPath) {
        onPath.add(node);
        int best = pathLength + exitDepth.get(node);
        for (String target : graph.targetsOf(node)) {
            if (componentOf.get(target) == component && !onPath.contains(target)) {
                best = Math.max(best,
                        longestWithin(target, component, pathLength + 1, graph, componentOf, exitDepth, onPath));
            }
        }
        onPath.remove(node);
        return best;
    }

    private static final class Tarjan {
        private final DependencyGraph graph;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final Map<String, Integer> componentIndex = new HashMap<>();
        private final List<List<String>> components = new ArrayList<>();
        private int counter = 0;

        Tarjan(DependencyGraph graph) {
            this.graph = graph;
        }

        List<List<String>> run() {
            for (String node : graph.nodes()) {
                if (!index.containsKey(node)) {
                    strongConnect(node);
                }
            }
            return components;
        }

        private void strongConnect(String node) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);

            for (String target : graph.targetsOf(node)) {
                if (!index.containsKey(target)) {
                    strongConnect(target);
                    lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(target)));
                } else if (onStack.contains(target)) {
                    lowLink.put(node, Math.min(lowLink.get(node), index.get(target)));
                }
            }

            if (lowLink.get(node).equals(index.get(node))) {
                List<String> component = new ArrayList<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    componentIndex.put(member, components.size());
                    component.add(member);
                } while (!member.equals(node));
                components.add(component);
            }
        }
    }
}
