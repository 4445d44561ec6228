package com.hcltech.cpm.schedule;

import com.hcltech.cpm.dag.TaskGraph;
import com.hcltech.cpm.dag.TopologicalOrder;

import java.util.Objects;

public final class BackwardPass {
    private BackwardPass() {}

    /**
     * LF of a sink comes from {@code anchor}; otherwise LF is the earliest LS among successors.
     * Runs over the generations last-to-first so every successor is final before it is read.
     *
     * @throws BackwardPassUnderdeterminedException if a successor has not been computed yet
     */
    public static BackwardPassResult compute(ForwardPassResult forward, TopologicalOrder order,
                                             GenerationRunner runner, SinkAnchor anchor) {
        Objects.requireNonNull(anchor, "anchor");
        TaskGraph graph = forward.graph();
        PassPreconditions.requireComplete(graph, order);

        int[] lateFinish = new int[graph.size()];
        boolean[] resolved = new boolean[graph.size()];
        int horizon = forward.horizon();

        runner.run(order.reversed(), handle -> {
            if (graph.isSink(handle)) {
                lateFinish[handle] = anchor == SinkAnchor.PROJECT_HORIZON ? horizon : forward.earlyFinish(handle);
                resolved[handle] = true;
                return;
            }
            int finish = Integer.MAX_VALUE;
            for (int succ : graph.successors(handle)) {
                if (!resolved[succ]) {
                    throw new BackwardPassUnderdeterminedException(graph.id(handle), graph.id(succ));
                }
                finish = Math.min(finish, Math.subtractExact(lateFinish[succ], graph.duration(succ)));
            }
            lateFinish[handle] = finish;
            resolved[handle] = true;
        });
        return new BackwardPassResult(forward, lateFinish);
    }
}
