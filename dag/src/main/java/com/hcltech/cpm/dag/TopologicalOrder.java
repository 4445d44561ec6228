package com.hcltech.cpm.dag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Kahn generations: every task in generation k has all its dependencies in generations before k.
 * Tasks within one generation are independent of each other.
 */
public record TopologicalOrder(List<List<Integer>> generations) {
    public TopologicalOrder {
        List<List<Integer>> copy = new ArrayList<>(generations.size());
        for (List<Integer> g : generations) copy.add(List.copyOf(g));
        generations = Collections.unmodifiableList(copy);
    }

    /** Generations last-to-first: every task comes after all of its successors. */
    public List<List<Integer>> reversed() {
        List<List<Integer>> out = new ArrayList<>(generations);
        Collections.reverse(out);
        return Collections.unmodifiableList(out);
    }

    /** Number of tasks placed. */
    public int size() {
        int n = 0;
        for (List<Integer> g : generations) n += g.size();
        return n;
    }
}
