package com.hcltech.cpm.schedule;

import com.hcltech.cpm.dag.TaskNotFoundException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Complete, read-only CPM result. Tasks are in input order. */
public final class Schedule {
    private final List<ScheduledTask> tasks;
    private final Map<String, ScheduledTask> byId;
    private final int horizon;
    private final List<String> criticalPath;

    Schedule(List<ScheduledTask> tasks, int horizon, List<String> criticalPath) {
        this.tasks = List.copyOf(tasks);
        this.horizon = horizon;
        this.criticalPath = List.copyOf(criticalPath);
        this.byId = new LinkedHashMap<>();
        for (ScheduledTask t : this.tasks) byId.put(t.id(), t);
    }

    public List<ScheduledTask> tasks() { return tasks; }

    public int horizon() { return horizon; }

    public ScheduledTask task(String id) {
        ScheduledTask t = byId.get(id);
        if (t == null) throw new TaskNotFoundException(id);
        return t;
    }

    /** Identifiers of every zero-slack task, in input order. */
    public List<String> criticalTasks() {
        return tasks.stream().filter(ScheduledTask::critical).map(ScheduledTask::id).toList();
    }

    /**
     * One chain of critical tasks from time 0 to the horizon, each starting
     * exactly when the previous one finishes. Empty for an empty project.
     */
    public List<String> criticalPath() { return criticalPath; }

    public int size() { return tasks.size(); }
}
