package com.hcltech.cpm.schedule;

import com.hcltech.cpm.dag.TaskGraph;

/** Earliest start and finish of every task. EF is always ES + duration, never wrapped past {@code int}. */
public final class ForwardPassResult {
    private final TaskGraph graph;
    private final int[] earlyStart;
    private final int horizon;

    /** @throws ArithmeticException if some EF exceeds {@link Integer#MAX_VALUE} */
    ForwardPassResult(TaskGraph graph, int[] earlyStart) {
        this.graph = graph;
        this.earlyStart = earlyStart;
        int max = 0;
        for (int h = 0; h < earlyStart.length; h++) max = Math.max(max, earlyFinish(h));
        this.horizon = max;
    }

    public TaskGraph graph() { return graph; }

    public int earlyStart(int handle) {
        return earlyStart[handle];
    }

    public int earlyFinish(int handle) {
        return Math.addExact(earlyStart[handle], graph.duration(handle));
    }

    public int earlyStart(String id) {
        return earlyStart(graph.handleOf(id));
    }

    public int earlyFinish(String id) {
        return earlyFinish(graph.handleOf(id));
    }

    /** max(EF) over all tasks; 0 when there are none. */
    public int horizon() { return horizon; }
}
