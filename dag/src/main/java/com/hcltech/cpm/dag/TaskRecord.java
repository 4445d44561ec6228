package com.hcltech.cpm.dag;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * One input row: identifier, duration and the identifiers it waits on.
 * Repeated dependency identifiers collapse to their first occurrence.
 */
public record TaskRecord(String id, int duration, List<String> dependencies) {
    public TaskRecord {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) throw new IllegalArgumentException("Task identifier must not be blank");
        if (duration < 0) throw new IllegalArgumentException("Task " + id + " has negative duration " + duration);
        dependencies = List.copyOf(new LinkedHashSet<>(Objects.requireNonNull(dependencies, "dependencies")));
    }

    public static TaskRecord of(String id, int duration, String... dependencies) {
        return new TaskRecord(id, duration, new ArrayList<>(List.of(dependencies)));
    }
}
