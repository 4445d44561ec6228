package com.hcltech.cpm.schedule;

import com.hcltech.cpm.dag.TaskGraph;

/** Latest start and finish of every task. LS is always LF - duration. */
public final class BackwardPassResult {
    private final ForwardPassResult forward;
    private final int[] lateFinish;

    BackwardPassResult(ForwardPassResult forward, int[] lateFinish) {
        this.forward = forward;
        this.lateFinish = lateFinish;
    }

    public ForwardPassResult forward() { return forward; }

    public TaskGraph graph() { return forward.graph(); }

    public int lateFinish(int handle) {
        return lateFinish[handle];
    }

    public int lateStart(int handle) {
        return Math.subtractExact(lateFinish[handle], forward.graph().duration(handle));
    }

    public int lateFinish(String id) {
        return lateFinish(graph().handleOf(id));
    }

    public int lateStart(String id) {
        return lateStart(graph().handleOf(id));
    }
}
