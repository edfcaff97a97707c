package com.planner.strategy;

import com.planner.allocator.AllocationContext;

/**
 * One placement phase of an allocation run.
 * <p>
 * Strategies share the run's {@link AllocationContext}: each sees the placements of the
 * phases before it and only works on tasks that are still pending. A strategy never
 * aborts the run for a single task; it records a failure in the context instead.
 */
public interface AllocationStrategy {

    /**
     * Get the strategy type name.
     */
    String getName();

    /**
     * Place as many pending tasks as this strategy can.
     *
     * @param context State of the current run
     */
    void allocate(AllocationContext context);
}
