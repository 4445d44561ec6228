package com.hcltech.cpm.dag;

import com.hcltech.cpm.common.errorsor.ErrorsOr;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public final class TaskGraphBuilder {
    private TaskGraphBuilder() {}

    /**
     * Registers every record, resolves every dependency and derives successors once.
     * All references are resolved before any successor list exists, so a failure
     * never leaves a partial graph behind.
     *
     * @throws DuplicateTaskException if two records share an identifier
     * @throws TaskNotFoundException  if a dependency names an unregistered task
     */
    public static TaskGraph build(List<TaskRecord> records) {
        Objects.requireNonNull(records, "records");
        TaskRegistry registry = new TaskRegistry();
        for (TaskRecord record : records) registry.register(record);

        int n = registry.size();
        List<List<Integer>> dependencies = new ArrayList<>(n);
        for (Task task : registry.tasks()) {
            List<Integer> resolved = new ArrayList<>(task.dependencies().size());
            for (String dep : task.dependencies()) {
                if (!registry.contains(dep)) throw new TaskNotFoundException(dep, task.id());
                resolved.add(registry.handleOf(dep));
            }
            dependencies.add(List.copyOf(resolved));
        }

        List<List<Integer>> successors = new ArrayList<>(n);
        for (int i = 0; i < n; i++) successors.add(new ArrayList<>());
        for (int handle = 0; handle < n; handle++) {
            for (int dep : dependencies.get(handle)) successors.get(dep).add(handle);
        }
        List<List<Integer>> frozen = new ArrayList<>(n);
        for (List<Integer> s : successors) frozen.add(List.copyOf(s));

        return new TaskGraph(registry, dependencies, frozen);
    }

    /**
     * Reports every duplicate identifier, unknown dependency and self-dependency at once.
     * Never throws. Longer cycles are only found by {@link Topo#generations}.
     */
    public static ErrorsOr<List<TaskRecord>> validate(List<TaskRecord> records) {
        Objects.requireNonNull(records, "records");
        Set<String> ids = new HashSet<>();
        List<String> errors = new ArrayList<>();

        for (TaskRecord r : records) {
            if (!ids.add(r.id())) errors.add("Duplicate task identifier: " + r.id());
        }
        for (TaskRecord r : records) {
            for (String dep : r.dependencies()) {
                if (dep.equals(r.id())) errors.add("Task " + r.id() + " depends on itself");
                else if (!ids.contains(dep)) errors.add("Task not found: " + dep + " (dependency of " + r.id() + ")");
            }
        }
        return errors.isEmpty() ? ErrorsOr.lift(List.copyOf(records)) : ErrorsOr.errors(errors);
    }
}
