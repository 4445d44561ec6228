package com.hcltech.cpm.dag;

import java.util.List;

/** A registered task. {@code handle} is its stable index in the {@link TaskRegistry}. */
public record Task(int handle, String id, int duration, List<String> dependencies) {
    public Task {
        dependencies = List.copyOf(dependencies);
    }
}
