package com.hcltech.cpm.dag;

import java.util.List;

/**
 * Immutable dependency graph over registry handles. Successors are the exact inverse
 * of dependencies: {@code b ∈ successors(a) ⇔ a ∈ dependencies(b)}.
 * Built only by {@link TaskGraphBuilder}.
 */
public final class TaskGraph {
    private final TaskRegistry registry;
    private final List<List<Integer>> dependencies;
    private final List<List<Integer>> successors;

    TaskGraph(TaskRegistry registry, List<List<Integer>> dependencies, List<List<Integer>> successors) {
        this.registry = registry;
        this.dependencies = List.copyOf(dependencies);
        this.successors = List.copyOf(successors);
    }

    public int size() {
        return registry.size();
    }

    public Task task(int handle) {
        return registry.task(handle);
    }

    public Task lookup(String id) {
        return registry.lookup(id);
    }

    public int handleOf(String id) {
        return registry.handleOf(id);
    }

    public List<Task> tasks() {
        return registry.tasks();
    }

    public String id(int handle) {
        return registry.task(handle).id();
    }

    public int duration(int handle) {
        return registry.task(handle).duration();
    }

    public List<Integer> dependencies(int handle) {
        return dependencies.get(handle);
    }

    public List<Integer> successors(int handle) {
        return successors.get(handle);
    }

    /** No dependencies: starts at time 0. */
    public boolean isSource(int handle) {
        return dependencies.get(handle).isEmpty();
    }

    /** No successors: nothing waits on it. */
    public boolean isSink(int handle) {
        return successors.get(handle).isEmpty();
    }

    public int edgeCount() {
        int edges = 0;
        for (List<Integer> deps : dependencies) edges += deps.size();
        return edges;
    }
}
