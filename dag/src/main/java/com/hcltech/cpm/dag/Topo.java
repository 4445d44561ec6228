package com.hcltech.cpm.dag;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class Topo {
    private Topo() {}

    /**
     * Kahn's algorithm over task handles. Iterative, linear in tasks plus edges.
     * Handles within a generation are in ascending (registration) order.
     *
     * @throws CyclicDependencyException naming one concrete cycle if any task can never be placed
     */
    public static TopologicalOrder generations(TaskGraph graph) {
        int n = graph.size();
        int[] pending = new int[n];
        List<Integer> current = new ArrayList<>();
        for (int h = 0; h < n; h++) {
            pending[h] = graph.dependencies(h).size();
            if (pending[h] == 0) current.add(h);
        }

        List<List<Integer>> gens = new ArrayList<>();
        int placed = 0;
        while (!current.isEmpty()) {
            gens.add(current);
            placed += current.size();
            List<Integer> next = new ArrayList<>();
            for (int h : current) {
                for (int s : graph.successors(h)) {
                    if (--pending[s] == 0) next.add(s);
                }
            }
            next.sort(null);
            current = next;
        }

        if (placed != n) throw new CyclicDependencyException(findCycle(graph, pending));
        return new TopologicalOrder(gens);
    }

    /**
     * Every unplaced task still has an unplaced dependency, so following those
     * from the lowest unplaced handle must revisit a task.
     */
    static List<String> findCycle(TaskGraph graph, int[] pending) {
        int start = 0;
        while (pending[start] == 0) start++;

        List<Integer> path = new ArrayList<>();
        Map<Integer, Integer> positionOf = new HashMap<>();
        int cur = start;
        while (!positionOf.containsKey(cur)) {
            positionOf.put(cur, path.size());
            path.add(cur);
            cur = firstUnplacedDependency(graph, pending, cur);
        }

        List<String> cycle = new ArrayList<>();
        for (int i = positionOf.get(cur); i < path.size(); i++) cycle.add(graph.id(path.get(i)));
        cycle.add(graph.id(cur));
        return cycle;
    }

    private static int firstUnplacedDependency(TaskGraph graph, int[] pending, int handle) {
        for (int dep : graph.dependencies(handle)) {
            if (pending[dep] > 0) return dep;
        }
        throw new IllegalStateException("Unplaced task " + graph.id(handle) + " has no unplaced dependency");
    }
}
