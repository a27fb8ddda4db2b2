package com.opsforge.core.correlation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Undirected graph over alert positions {@code 0..n-1}.
 *
 * <p>
 * Call-scoped: created, filled and discarded inside one
 * {@link CorrelationGraphEngine#correlate(List)} invocation.
 * </p>
 */
final class AlertGraph {

    private final List<Set<Integer>> adjacency;
    private int edgeCount;

    AlertGraph(int nodeCount) {
        if (nodeCount < 0) {
            throw new IllegalArgumentException("nodeCount must be >= 0, got: " + nodeCount);
        }
        this.adjacency = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            adjacency.add(new TreeSet<>());
        }
    }

    void addEdge(int a, int b) {
        if (a == b) {
            throw new IllegalArgumentException("Self-loops are not allowed: " + a);
        }
        if (adjacency.get(a).add(b)) {
            adjacency.get(b).add(a);
            edgeCount++;
        }
    }

    int nodeCount() {
        return adjacency.size();
    }

    int edgeCount() {
        return edgeCount;
    }

    boolean hasEdge(int a, int b) {
        return adjacency.get(a).contains(b);
    }

    /**
     * Connected components, each as an ascending list of node positions.
     * Components are returned in order of their lowest node position.
     */
    List<List<Integer>> connectedComponents() {
        boolean[] visited = new boolean[adjacency.size()];
        List<List<Integer>> components = new ArrayList<>();

        for (int start = 0; start < adjacency.size(); start++) {
            if (visited[start]) {
                continue;
            }
            List<Integer> component = new ArrayList<>();
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start);
            visited[start] = true;
            while (!queue.isEmpty()) {
                int node = queue.poll();
                component.add(node);
                for (int next : adjacency.get(node)) {
                    if (!visited[next]) {
                        visited[next] = true;
                        queue.add(next);
                    }
                }
            }
            Collections.sort(component);
            components.add(component);
        }
        return components;
    }
}
