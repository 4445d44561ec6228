package com.hcltech.cpm.schedule;

import com.hcltech.cpm.dag.TaskGraph;
import com.hcltech.cpm.dag.TopologicalOrder;

final class PassPreconditions {
    private PassPreconditions() {}

    static void requireComplete(TaskGraph graph, TopologicalOrder order) {
        if (order.size() != graph.size()) {
            throw new IllegalArgumentException("Topological order covers " + order.size()
                    + " tasks but the graph has " + graph.size());
        }
    }
}
