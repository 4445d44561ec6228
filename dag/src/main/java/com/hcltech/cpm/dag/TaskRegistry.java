package com.hcltech.cpm.dag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Owns every task of one run and resolves identifiers to handles.
 * Handles are assigned in registration order starting at 0.
 */
public final class TaskRegistry {
    private final Map<String, Integer> handles = new HashMap<>();
    private final List<Task> tasks = new ArrayList<>();

    public Task register(TaskRecord record) {
        Objects.requireNonNull(record, "record");
        if (handles.containsKey(record.id())) throw new DuplicateTaskException(record.id());
        Task task = new Task(tasks.size(), record.id(), record.duration(), record.dependencies());
        handles.put(task.id(), task.handle());
        tasks.add(task);
        return task;
    }

    public Task lookup(String id) {
        return tasks.get(handleOf(id));
    }

    public int handleOf(String id) {
        Integer handle = handles.get(id);
        if (handle == null) throw new TaskNotFoundException(id);
        return handle;
    }

    public boolean contains(String id) {
        return handles.containsKey(id);
    }

    public Task task(int handle) {
        return tasks.get(handle);
    }

    public int size() {
        return tasks.size();
    }

    /** Read-only view in registration order. */
    public List<Task> tasks() {
        return Collections.unmodifiableList(tasks);
    }
}
