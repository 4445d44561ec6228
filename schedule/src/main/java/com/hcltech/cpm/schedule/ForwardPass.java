package com.hcltech.cpm.schedule;

import com.hcltech.cpm.dag.TaskGraph;
import com.hcltech.cpm.dag.TopologicalOrder;

public final class ForwardPass {
    private ForwardPass() {}

    /**
     * ES = 0 for a task without dependencies, otherwise the latest EF among its dependencies.
     * Each arena slot is written once, by the generation that owns the task.
     */
    public static ForwardPassResult compute(TaskGraph graph, TopologicalOrder order, GenerationRunner runner) {
        PassPreconditions.requireComplete(graph, order);
        int[] earlyStart = new int[graph.size()];
        runner.run(order.generations(), handle -> {
            int start = 0;
            for (int dep : graph.dependencies(handle)) {
                start = Math.max(start, Math.addExact(earlyStart[dep], graph.duration(dep)));
            }
            earlyStart[handle] = start;
        });
        return new ForwardPassResult(graph, earlyStart);
    }
}
