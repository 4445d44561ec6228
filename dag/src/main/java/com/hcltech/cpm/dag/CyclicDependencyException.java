package com.hcltech.cpm.dag;

import java.util.List;

public class CyclicDependencyException extends CpmException {
    private final List<String> cycle;

    /**
     * @param cycle task identifiers where each depends on the next; the last equals the first
     */
    public CyclicDependencyException(List<String> cycle) {
        super(ErrorKind.CYCLIC_DEPENDENCY, cycle.get(0), "Cyclic dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() { return cycle; }
}
