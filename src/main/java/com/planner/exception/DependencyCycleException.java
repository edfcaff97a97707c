package com.planner.exception;

import java.util.List;

/**
 * Thrown when the task dependency graph contains a cycle.
 * Aborts the allocation run before any priority is changed.
 */
public class DependencyCycleException extends PlannerException {

    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super("Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Task identifiers along the cycle; the first identifier is repeated at the end.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
