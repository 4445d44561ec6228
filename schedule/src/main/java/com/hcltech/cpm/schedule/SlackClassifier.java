package com.hcltech.cpm.schedule;

import com.hcltech.cpm.dag.TaskGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class SlackClassifier {
    private SlackClassifier() {}

    /** slack = LS - ES; a task is critical iff its slack is zero. */
    public static Schedule classify(BackwardPassResult backward) {
        ForwardPassResult forward = backward.forward();
        TaskGraph graph = backward.graph();

        List<ScheduledTask> rows = new ArrayList<>(graph.size());
        for (int h = 0; h < graph.size(); h++) {
            int slack = backward.lateStart(h) - forward.earlyStart(h);
            if (slack < 0) {
                throw new IllegalStateException("Negative slack " + slack + " for task " + graph.id(h));
            }
            rows.add(new ScheduledTask(graph.id(h), graph.duration(h),
                    forward.earlyStart(h), forward.earlyFinish(h),
                    backward.lateStart(h), backward.lateFinish(h),
                    slack));
        }
        return new Schedule(rows, forward.horizon(), criticalPath(graph, forward, rows));
    }

    /**
     * Starts at the first sink finishing on the horizon and walks back through
     * critical dependencies that finish exactly when the current task starts.
     */
    static List<String> criticalPath(TaskGraph graph, ForwardPassResult forward, List<ScheduledTask> rows) {
        int end = -1;
        for (int h = 0; h < graph.size() && end < 0; h++) {
            if (graph.isSink(h) && forward.earlyFinish(h) == forward.horizon() && rows.get(h).critical()) end = h;
        }
        List<String> path = new ArrayList<>();
        int cur = end;
        while (cur >= 0) {
            path.add(graph.id(cur));
            int next = -1;
            for (int dep : graph.dependencies(cur)) {
                if (rows.get(dep).critical() && forward.earlyFinish(dep) == forward.earlyStart(cur)) {
                    next = dep;
                    break;
                }
            }
            cur = next;
        }
        Collections.reverse(path);
        return path;
    }
}
