package com.planner.allocator;

import com.planner.core.Task;

import java.util.Collection;

/**
 * Weekly slot allocator abstraction for external callers.
 * Assigns each task a window in the recurring week, or reports why it could not.
 */
public interface SlotAllocator {

    /**
     * Allocate windows for a task set.
     * <p>
     * Placements are written back to the tasks ({@link Task#getAssignedWindow()}) and
     * priorities are raised in place by dependency propagation. Any placement left from
     * an earlier run is cleared first.
     *
     * @param tasks Tasks with unique identifiers
     * @return placed tasks in placement order, and a report per unplaced task
     * @throws com.planner.exception.DependencyCycleException if the dependencies form a cycle
     */
    AllocationResult allocate(Collection<Task> tasks);
}
